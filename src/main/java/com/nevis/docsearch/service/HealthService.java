package com.nevis.docsearch.service;

import com.nevis.docsearch.engine.SearchEngine;
import com.nevis.docsearch.infra.CacheStore;
import com.nevis.docsearch.infra.CircuitBreakerGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Probes every dependency once and reports the overall status. A single failing
 * dependency makes the service {@code degraded}.
 */
@Slf4j
@Service
public class HealthService {

    private static final String UP = "up";
    private static final String DOWN = "down";

    private final JdbcClient jdbcClient;
    private final SearchEngine searchEngine;
    private final CacheStore cacheStore;
    private final CircuitBreakerGuard circuitBreaker;
    private final String version;

    public HealthService(
        JdbcClient jdbcClient,
        SearchEngine searchEngine,
        CacheStore cacheStore,
        CircuitBreakerGuard circuitBreaker,
        @Value("${app.version:unknown}") String version
    ) {
        this.jdbcClient = jdbcClient;
        this.searchEngine = searchEngine;
        this.cacheStore = cacheStore;
        this.circuitBreaker = circuitBreaker;
        this.version = version;
    }

    public HealthReport check() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("postgres", probe("postgres", () ->
            jdbcClient.sql("SELECT 1").query(Integer.class).single() == 1));
        services.put(searchEngine.name(), probe(searchEngine.name(), searchEngine::schemaExists));
        services.put("cache", probe("cache", cacheStore::ping));

        Map<String, String> breakers = new LinkedHashMap<>();
        circuitBreaker.states().forEach((name, state) -> breakers.put(name, state.name().toLowerCase()));

        boolean healthy = services.values().stream().allMatch(UP::equals);
        return new HealthReport(healthy ? HealthReport.HEALTHY : HealthReport.DEGRADED, version, services, breakers);
    }

    private String probe(String name, BooleanSupplier check) {
        try {
            return check.getAsBoolean() ? UP : DOWN;
        } catch (RuntimeException e) {
            log.warn("Health probe for {} failed: {}", name, e.getMessage());
            return DOWN;
        }
    }
}
