package com.nevis.docsearch.infra;

import com.nevis.docsearch.exception.DependencyTimeoutException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls to unreliable dependencies through a named circuit breaker and a per-call time limit.
 * <p>
 * Breaker configuration (volume, failure rate, sleep window, half-open trial calls, recorded
 * exceptions) lives under {@code resilience4j.circuitbreaker.instances.<name>}; timeouts under
 * {@code resilience4j.timelimiter.instances.<name>}. An open breaker raises
 * {@link io.github.resilience4j.circuitbreaker.CallNotPermittedException} without running the call.
 */
@Slf4j
@Component
public class CircuitBreakerGuard {

    public static final String SEARCH_ENGINE = "search-engine";
    public static final String CACHE_STORE = "cache-store";

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final Executor executor;

    public CircuitBreakerGuard(
        CircuitBreakerRegistry circuitBreakerRegistry,
        TimeLimiterRegistry timeLimiterRegistry,
        @Qualifier("dependencyCallExecutor") Executor executor
    ) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.executor = executor;
    }

    public <T> T call(String dependency, Supplier<T> operation) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(dependency);
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(dependency);

        try {
            return circuitBreaker.executeCallable(() ->
                timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(operation, executor))
            );
        } catch (TimeoutException e) {
            log.warn("Call to {} exceeded {}", dependency, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new DependencyTimeoutException(dependency, e);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected checked exception from " + dependency, e);
        }
    }

    public void run(String dependency, Runnable operation) {
        call(dependency, () -> {
            operation.run();
            return null;
        });
    }

    public CircuitBreaker.State state(String dependency) {
        return circuitBreakerRegistry.circuitBreaker(dependency).getState();
    }

    public Map<String, CircuitBreaker.State> states() {
        Map<String, CircuitBreaker.State> states = new LinkedHashMap<>();
        for (String name : List.of(SEARCH_ENGINE, CACHE_STORE)) {
            states.put(name, state(name));
        }
        return states;
    }
}
