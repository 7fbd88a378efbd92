package com.nevis.docsearch.service;

import com.nevis.docsearch.controller.TenantRequest;
import com.nevis.docsearch.controller.TenantResponse;
import com.nevis.docsearch.model.Tenant;

import java.util.Optional;

public interface TenantService {
    TenantResponse create(TenantRequest request);
    TenantResponse getById(long id);
    Optional<Tenant> authenticate(String apiKey);
    void destroy(long id);
    void resetRateLimit(long id);
}
