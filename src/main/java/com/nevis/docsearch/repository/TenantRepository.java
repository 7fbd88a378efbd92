package com.nevis.docsearch.repository;

import com.nevis.docsearch.model.Tenant;

import java.util.Optional;

public interface TenantRepository {
    Tenant save(Tenant tenant);
    Optional<Tenant> findById(Long id);
    boolean deleteById(Long id);
}
