package com.nevis.docsearch.repository;

import com.nevis.docsearch.model.Tenant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcTenantRepository implements TenantRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<Tenant> tenantRowMapper = (rs, rowNum) -> new Tenant(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("subdomain"),
        rs.getString("api_key_hash"),
        rs.getInt("document_quota"),
        rs.getInt("rate_limit_per_minute"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    @Transactional
    public Tenant save(Tenant tenant) {
        return jdbcClient.sql("""
                INSERT INTO tenants (name, subdomain, api_key_hash, document_quota, rate_limit_per_minute)
                VALUES (:name, :subdomain, :apiKeyHash, :documentQuota, :rateLimitPerMinute)
                RETURNING *
                """)
            .param("name", tenant.name())
            .param("subdomain", tenant.subdomain())
            .param("apiKeyHash", tenant.apiKeyHash())
            .param("documentQuota", tenant.documentQuota())
            .param("rateLimitPerMinute", tenant.rateLimitPerMinute())
            .query(tenantRowMapper)
            .single();
    }

    @Override
    public Optional<Tenant> findById(Long id) {
        return jdbcClient.sql("SELECT * FROM tenants WHERE id = :id")
            .param("id", id)
            .query(tenantRowMapper)
            .optional();
    }

    @Override
    @Transactional
    public boolean deleteById(Long id) {
        return jdbcClient.sql("DELETE FROM tenants WHERE id = :id")
            .param("id", id)
            .update() > 0;
    }
}
