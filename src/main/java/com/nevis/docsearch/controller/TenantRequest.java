package com.nevis.docsearch.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

public record TenantRequest(
    @NotBlank
    String name,

    @NotBlank
    @Pattern(regexp = "[a-z0-9][a-z0-9-]{0,62}")
    String subdomain,

    @NotNull
    @Positive
    @JsonProperty("document_quota")
    Integer documentQuota,

    @NotNull
    @Positive
    @JsonProperty("rate_limit_per_minute")
    Integer rateLimitPerMinute
) {}
