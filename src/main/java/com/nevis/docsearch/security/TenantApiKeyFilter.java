package com.nevis.docsearch.security;

import com.nevis.docsearch.model.Tenant;
import com.nevis.docsearch.service.TenantService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the {@value #HEADER} header to a tenant. Requests without the header pass through
 * unauthenticated and are rejected by the authorization rules.
 */
@Slf4j
@RequiredArgsConstructor
public class TenantApiKeyFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Tenant-Api-Key";
    public static final String ROLE = "TENANT";

    private final TenantService tenantService;
    private final AuthenticationEntryPoint entryPoint;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
        throws ServletException, IOException {

        String apiKey = request.getHeader(HEADER);
        if (!StringUtils.hasText(apiKey)) {
            chain.doFilter(request, response);
            return;
        }

        Optional<Tenant> tenant = tenantService.authenticate(apiKey.trim());
        if (tenant.isEmpty()) {
            log.warn("Rejected request to {} with an unknown API key", request.getRequestURI());
            entryPoint.commence(request, response, new BadCredentialsException(JsonAuthenticationEntryPoint.MESSAGE));
            return;
        }

        UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
            TenantPrincipal.of(tenant.get()), null, List.of(new SimpleGrantedAuthority("ROLE_" + ROLE)));
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);

        chain.doFilter(request, response);
    }
}
