package com.nevis.docsearch.infra;

/**
 * Fixed-window request counter per tenant. The limiter only counts; comparing the
 * count with the tenant's configured limit is up to the caller.
 */
public interface RateLimiter {

    long WINDOW_SECONDS = 60;
    long COUNTER_TTL_SECONDS = WINDOW_SECONDS * 2;

    /**
     * Increments the counter of the current window and returns the post-increment value.
     * Returns 0 when the backing store is unavailable (fail-open).
     */
    long check(long tenantId);

    /**
     * Removes the counters of every window of the tenant.
     */
    void reset(long tenantId);

    static String key(long tenantId, long window) {
        return keyPrefix(tenantId) + window;
    }

    static String keyPrefix(long tenantId) {
        return "rate_limit:" + tenantId + ":";
    }

    static long window(long epochSecond) {
        return Math.floorDiv(epochSecond, WINDOW_SECONDS);
    }
}
