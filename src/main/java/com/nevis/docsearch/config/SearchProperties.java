package com.nevis.docsearch.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.search")
public record SearchProperties(
	@NotNull @Min(1) @Max(100) Integer defaultPerPage,
	@NotNull @Min(1) @Max(1000) Integer maxPerPage,
	@NotNull Duration cacheTtl
) {}
