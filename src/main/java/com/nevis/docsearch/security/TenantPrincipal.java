package com.nevis.docsearch.security;

import com.nevis.docsearch.model.Tenant;

/**
 * Authenticated tenant of the current request. Controllers read it once and pass the tenant
 * id explicitly to everything below them.
 */
public record TenantPrincipal(Long tenantId, String name, int rateLimitPerMinute) {

    public static TenantPrincipal of(Tenant tenant) {
        return new TenantPrincipal(tenant.id(), tenant.name(), tenant.rateLimitPerMinute());
    }
}
