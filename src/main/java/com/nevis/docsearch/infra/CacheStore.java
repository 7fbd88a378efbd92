package com.nevis.docsearch.infra;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value cache used by the search path. Implementations treat store errors as misses
 * and never let them reach the caller.
 */
public interface CacheStore {

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value, Duration ttl);

    void delete(String key);

    /**
     * Deletes every key matching a glob-style pattern ({@code *} wildcard only).
     */
    long scanDelete(String pattern);

    boolean ping();
}
