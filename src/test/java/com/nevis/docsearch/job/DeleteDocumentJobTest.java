package com.nevis.docsearch.job;

import com.nevis.docsearch.config.IndexingProperties;
import com.nevis.docsearch.engine.SearchEngine;
import com.nevis.docsearch.exception.SearchEngineException;
import com.nevis.docsearch.infra.CircuitBreakerGuard;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DeleteDocumentJobTest {

    private final SearchEngine searchEngine = Mockito.mock(SearchEngine.class);
    private final DeadLetterSink deadLetterSink = Mockito.mock(DeadLetterSink.class);
    private final CircuitBreakerRegistry breakers = CircuitBreakerRegistry.ofDefaults();
    private final CircuitBreakerGuard guard = new CircuitBreakerGuard(
        breakers, TimeLimiterRegistry.ofDefaults(), Runnable::run);
    private final DeleteDocumentJob job = new DeleteDocumentJob(searchEngine, guard, deadLetterSink,
        new IndexingProperties(3, Duration.ofSeconds(5), Duration.ofMinutes(10), 5, 100));

    @BeforeEach
    void setUp() {
        when(searchEngine.collection()).thenReturn("documents");
    }

    @Test
    @DisplayName("Should delete the document scoped to its tenant")
    void shouldDeleteScopedToTenant() {
        job.perform(42L, 9L, 1);

        verify(searchEngine).delete("documents", 42L, 9L);
    }

    @Test
    @DisplayName("Messages without ids should be skipped")
    void shouldSkipMissingIds() {
        job.perform(null, 9L, 1);
        job.perform(42L, null, 1);

        verify(searchEngine, never()).delete(anyString(), anyLong(), anyLong());
    }

    @Test
    @DisplayName("A failure on the last attempt should be dead-lettered as a deletion")
    void shouldDeadLetterOnLastAttempt() {
        doThrow(new SearchEngineException("engine down")).when(searchEngine).delete("documents", 42L, 9L);

        assertThatThrownBy(() -> job.perform(42L, 9L, 3)).isInstanceOf(SearchEngineException.class);

        verify(deadLetterSink).record("deletion", 42L, 9L, "engine down");
    }

    @Test
    @DisplayName("A failure before the last attempt should only rethrow")
    void shouldRethrowBeforeLastAttempt() {
        doThrow(new SearchEngineException("engine down")).when(searchEngine).delete("documents", 42L, 9L);

        assertThatThrownBy(() -> job.perform(42L, 9L, 1)).isInstanceOf(SearchEngineException.class);

        verifyNoInteractions(deadLetterSink);
    }

    @Test
    @DisplayName("An open search-engine circuit should keep the job away from the engine entirely")
    void shouldNotTouchEngineWhileCircuitOpen() {
        breakers.circuitBreaker(CircuitBreakerGuard.SEARCH_ENGINE).transitionToOpenState();

        assertThatThrownBy(() -> job.perform(42L, 9L, 1)).isInstanceOf(CallNotPermittedException.class);

        verify(searchEngine, never()).ensureSchema();
        verify(searchEngine, never()).delete(anyString(), anyLong(), anyLong());
    }
}
