package com.nevis.docsearch.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record HealthReport(
    String status,
    String version,
    Map<String, String> services,
    @JsonProperty("circuit_breakers") Map<String, String> circuitBreakers
) {
    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    public boolean healthy() {
        return HEALTHY.equals(status);
    }
}
