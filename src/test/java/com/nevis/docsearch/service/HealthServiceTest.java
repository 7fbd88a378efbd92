package com.nevis.docsearch.service;

import com.nevis.docsearch.engine.SearchEngine;
import com.nevis.docsearch.exception.SearchEngineException;
import com.nevis.docsearch.infra.CacheStore;
import com.nevis.docsearch.infra.CircuitBreakerGuard;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;
import org.mockito.Mockito;
import org.springframework.jdbc.core.simple.JdbcClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class HealthServiceTest {

    private final JdbcClient jdbcClient = Mockito.mock(JdbcClient.class, Answers.RETURNS_DEEP_STUBS);
    private final SearchEngine searchEngine = Mockito.mock(SearchEngine.class);
    private final CacheStore cacheStore = Mockito.mock(CacheStore.class);
    private final CircuitBreakerRegistry breakers = CircuitBreakerRegistry.ofDefaults();
    private final HealthService healthService = new HealthService(jdbcClient, searchEngine, cacheStore,
        new CircuitBreakerGuard(breakers, TimeLimiterRegistry.ofDefaults(), Runnable::run), "1.2.3");

    @BeforeEach
    void setUp() {
        when(jdbcClient.sql("SELECT 1").query(Integer.class).single()).thenReturn(1);
        when(searchEngine.name()).thenReturn("elasticsearch");
        when(searchEngine.schemaExists()).thenReturn(true);
        when(cacheStore.ping()).thenReturn(true);
    }

    @Test
    @DisplayName("All dependencies up should report healthy")
    void shouldReportHealthy() {
        HealthReport report = healthService.check();

        assertThat(report.healthy()).isTrue();
        assertThat(report.version()).isEqualTo("1.2.3");
        assertThat(report.services())
            .containsEntry("postgres", "up")
            .containsEntry("elasticsearch", "up")
            .containsEntry("cache", "up");
        assertThat(report.circuitBreakers()).containsEntry(CircuitBreakerGuard.SEARCH_ENGINE, "closed");
    }

    @Test
    @DisplayName("A failing probe should report degraded")
    void shouldReportDegraded() {
        when(searchEngine.schemaExists()).thenThrow(new SearchEngineException("connection refused"));
        breakers.circuitBreaker(CircuitBreakerGuard.SEARCH_ENGINE).transitionToOpenState();

        HealthReport report = healthService.check();

        assertThat(report.status()).isEqualTo(HealthReport.DEGRADED);
        assertThat(report.services()).containsEntry("elasticsearch", "down");
        assertThat(report.circuitBreakers()).containsEntry(CircuitBreakerGuard.SEARCH_ENGINE, "open");
    }
}
