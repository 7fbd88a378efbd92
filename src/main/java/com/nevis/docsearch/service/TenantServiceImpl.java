package com.nevis.docsearch.service;

import com.nevis.docsearch.controller.TenantRequest;
import com.nevis.docsearch.controller.TenantResponse;
import com.nevis.docsearch.event.TenantDestroyedEvent;
import com.nevis.docsearch.exception.EntityNotFoundException;
import com.nevis.docsearch.infra.RateLimiter;
import com.nevis.docsearch.model.Tenant;
import com.nevis.docsearch.repository.DocumentRepository;
import com.nevis.docsearch.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * API keys have the form {@code tk_<tenantId>_<secret>}; only a BCrypt hash of the secret is
 * stored, and the key itself is shown once, on creation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantServiceImpl implements TenantService {

    static final String KEY_PREFIX = "tk_";
    private static final int SECRET_BYTES = 32;

    private final SecureRandom secureRandom = new SecureRandom();

    private final TenantRepository tenantRepository;
    private final DocumentRepository documentRepository;
    private final PasswordEncoder passwordEncoder;
    private final RateLimiter rateLimiter;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public TenantResponse create(TenantRequest request) {
        log.debug("Creating tenant {} ({})", request.name(), request.subdomain());

        byte[] secretBytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(secretBytes);
        String secret = HexFormat.of().formatHex(secretBytes);

        Tenant saved = tenantRepository.save(new Tenant(
            null,
            request.name(),
            request.subdomain(),
            passwordEncoder.encode(secret),
            request.documentQuota(),
            request.rateLimitPerMinute(),
            null,
            null
        ));

        log.info("Created tenant {} ({})", saved.id(), saved.subdomain());
        return TenantResponse.from(saved, KEY_PREFIX + saved.id() + "_" + secret);
    }

    @Override
    @Transactional(readOnly = true)
    public TenantResponse getById(long id) {
        return tenantRepository.findById(id)
            .map(tenant -> TenantResponse.from(tenant, null))
            .orElseThrow(() -> new EntityNotFoundException("Tenant", id));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Tenant> authenticate(String apiKey) {
        if (apiKey == null || !apiKey.startsWith(KEY_PREFIX)) {
            return Optional.empty();
        }
        int separator = apiKey.indexOf('_', KEY_PREFIX.length());
        if (separator < 0) {
            return Optional.empty();
        }

        long tenantId;
        try {
            tenantId = Long.parseLong(apiKey.substring(KEY_PREFIX.length(), separator));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        String secret = apiKey.substring(separator + 1);

        return tenantRepository.findById(tenantId)
            .filter(tenant -> passwordEncoder.matches(secret, tenant.apiKeyHash()));
    }

    @Override
    @Transactional
    public void destroy(long id) {
        List<Long> documentIds = documentRepository.findIdsByTenant(id);
        if (!tenantRepository.deleteById(id)) {
            throw new EntityNotFoundException("Tenant", id);
        }
        eventPublisher.publishEvent(new TenantDestroyedEvent(id, documentIds));
        log.info("Destroyed tenant {} with {} documents", id, documentIds.size());
    }

    @Override
    public void resetRateLimit(long id) {
        tenantRepository.findById(id).orElseThrow(() -> new EntityNotFoundException("Tenant", id));
        rateLimiter.reset(id);
        log.info("Reset rate-limit counters of tenant {}", id);
    }
}
