package com.nevis.docsearch.controller;

import com.nevis.docsearch.security.TenantApiKeyFilter;
import com.nevis.docsearch.security.TenantPrincipal;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.List;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;

final class TenantAuthentication {

    private TenantAuthentication() {
    }

    static RequestPostProcessor tenant(long tenantId, int rateLimitPerMinute) {
        return authentication(UsernamePasswordAuthenticationToken.authenticated(
            new TenantPrincipal(tenantId, "Tenant " + tenantId, rateLimitPerMinute),
            null,
            List.of(new SimpleGrantedAuthority("ROLE_" + TenantApiKeyFilter.ROLE))));
    }
}
