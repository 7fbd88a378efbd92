package com.nevis.docsearch.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.search-engine")
public record SearchEngineProperties(
	@NotBlank String backend,
	@NotBlank String collection,
	String url,
	String apiKey,
	@NotNull Duration connectTimeout,
	@NotNull Duration requestTimeout
) {}
