package com.nevis.docsearch.infra;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process variant of the fixed-window limiter, for local runs and tests.
 */
public class InMemoryRateLimiter implements RateLimiter {

    private final Cache<String, AtomicLong> counters = Caffeine.newBuilder()
        .expireAfterWrite(Duration.ofSeconds(COUNTER_TTL_SECONDS))
        .build();

    private final Clock clock;

    public InMemoryRateLimiter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long check(long tenantId) {
        String key = RateLimiter.key(tenantId, RateLimiter.window(clock.instant().getEpochSecond()));
        return counters.get(key, k -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void reset(long tenantId) {
        String prefix = RateLimiter.keyPrefix(tenantId);
        counters.asMap().keySet().removeIf(key -> key.startsWith(prefix));
    }
}
