package com.nevis.docsearch.infra;

import com.nevis.docsearch.exception.DependencyTimeoutException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class CircuitBreakerGuardTest {

    private static final String DEPENDENCY = CircuitBreakerGuard.SEARCH_ENGINE;

    private ExecutorService executor;
    private CircuitBreakerGuard guard;

    @BeforeEach
    void setUp() {
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(4)
            .minimumNumberOfCalls(4)
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofMillis(300))
            .permittedNumberOfCallsInHalfOpenState(1)
            .build());
        TimeLimiterRegistry timeLimiters = TimeLimiterRegistry.of(TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofSeconds(2))
            .build());
        executor = Executors.newCachedThreadPool();
        guard = new CircuitBreakerGuard(breakers, timeLimiters, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should return the value of a successful call")
    void shouldPassThroughResult() {
        assertThat(guard.call(DEPENDENCY, () -> "ok")).isEqualTo("ok");
        assertThat(guard.state(DEPENDENCY)).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("Should rethrow the original exception of a failed call")
    void shouldRethrowFailure() {
        assertThatThrownBy(() -> guard.call(DEPENDENCY, () -> {
            throw new IllegalStateException("engine down");
        }))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("engine down");
    }

    @Test
    @DisplayName("Open breaker should reject calls without invoking them")
    void shouldShortCircuitWhenOpen() {
        tripBreaker();
        AtomicInteger invocations = new AtomicInteger();

        assertThatThrownBy(() -> guard.call(DEPENDENCY, invocations::incrementAndGet))
            .isInstanceOf(CallNotPermittedException.class);
        assertThat(invocations).hasValue(0);
        assertThat(guard.state(DEPENDENCY)).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("After the open interval exactly one trial call should be let through")
    void shouldAllowSingleTrialCallWhenHalfOpen() throws Exception {
        tripBreaker();
        Thread.sleep(400);

        CountDownLatch trialStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> trial = CompletableFuture.supplyAsync(() -> guard.call(DEPENDENCY, () -> {
            trialStarted.countDown();
            awaitQuietly(release);
            return "recovered";
        }));
        assertThat(trialStarted.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(guard.state(DEPENDENCY)).isEqualTo(CircuitBreaker.State.HALF_OPEN);

        AtomicInteger invocations = new AtomicInteger();
        assertThatThrownBy(() -> guard.call(DEPENDENCY, invocations::incrementAndGet))
            .isInstanceOf(CallNotPermittedException.class);
        assertThat(invocations).hasValue(0);

        release.countDown();
        assertThat(trial.get(2, TimeUnit.SECONDS)).isEqualTo("recovered");
        await().atMost(Duration.ofSeconds(2))
            .untilAsserted(() -> assertThat(guard.state(DEPENDENCY)).isEqualTo(CircuitBreaker.State.CLOSED));
    }

    @Test
    @DisplayName("A call exceeding its time limit should fail with a timeout")
    void shouldTimeOutSlowCalls() {
        CircuitBreakerGuard impatient = new CircuitBreakerGuard(
            CircuitBreakerRegistry.ofDefaults(),
            TimeLimiterRegistry.of(TimeLimiterConfig.custom().timeoutDuration(Duration.ofMillis(100)).build()),
            executor);

        assertThatThrownBy(() -> impatient.call(DEPENDENCY, () -> {
            awaitQuietly(new CountDownLatch(1));
            return "too late";
        }))
            .isInstanceOf(DependencyTimeoutException.class)
            .hasMessageContaining(DEPENDENCY);
    }

    @Test
    @DisplayName("States should list every guarded dependency")
    void shouldReportStates() {
        assertThat(guard.states())
            .containsKeys(CircuitBreakerGuard.SEARCH_ENGINE, CircuitBreakerGuard.CACHE_STORE);
    }

    private void tripBreaker() {
        for (int i = 0; i < 4; i++) {
            try {
                guard.run(DEPENDENCY, () -> {
                    throw new IllegalStateException("failure " + System.nanoTime());
                });
            } catch (IllegalStateException expected) {
                // recorded by the breaker
            }
        }
        assertThat(guard.state(DEPENDENCY)).isEqualTo(CircuitBreaker.State.OPEN);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
