package com.nevis.docsearch.security;

import com.nevis.docsearch.exception.RateLimitExceededException;
import com.nevis.docsearch.infra.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Per-tenant request gate. A request is rejected once the window count exceeds the tenant's
 * limit; the limiter's fail-open answer of 0 always passes.
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimiter rateLimiter;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof TenantPrincipal tenant)) {
            return true;
        }

        long count = rateLimiter.check(tenant.tenantId());
        if (count > tenant.rateLimitPerMinute()) {
            log.warn("Tenant {} exceeded {} requests per minute", tenant.tenantId(), tenant.rateLimitPerMinute());
            throw new RateLimitExceededException(tenant.tenantId(), RateLimiter.WINDOW_SECONDS);
        }
        return true;
    }
}
