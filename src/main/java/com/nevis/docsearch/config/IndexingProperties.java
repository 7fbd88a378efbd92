package com.nevis.docsearch.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.indexing")
public record IndexingProperties(
	@NotNull @Min(1) Integer maxAttempts,
	@NotNull Duration backoffBase,
	@NotNull Duration backoffCap,
	@NotNull @Min(1) Integer staleThresholdMinutes,
	@NotNull @Min(1) Integer batchSize
) {

	/**
	 * Delay before the next attempt after {@code attempt} failed: {@code base * 2^(attempt-1)}, capped.
	 */
	public Duration backoffFor(int attempt) {
		int exponent = Math.max(0, Math.min(attempt - 1, 30));
		Duration delay = backoffBase.multipliedBy(1L << exponent);
		return delay.compareTo(backoffCap) > 0 ? backoffCap : delay;
	}
}
