package com.nevis.docsearch.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.docsearch.model.Tenant;

import java.time.OffsetDateTime;

/**
 * {@code apiKey} is only present in the response to tenant creation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TenantResponse(
    Long id,

    String name,

    String subdomain,

    @JsonProperty("document_quota")
    int documentQuota,

    @JsonProperty("rate_limit_per_minute")
    int rateLimitPerMinute,

    @JsonProperty("api_key")
    String apiKey,

    @JsonProperty("created_at")
    OffsetDateTime createdAt
) {
    public static TenantResponse from(Tenant tenant, String apiKey) {
        return new TenantResponse(
            tenant.id(),
            tenant.name(),
            tenant.subdomain(),
            tenant.documentQuota(),
            tenant.rateLimitPerMinute(),
            apiKey,
            tenant.createdAt()
        );
    }
}
