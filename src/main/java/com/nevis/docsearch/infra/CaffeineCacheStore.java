package com.nevis.docsearch.infra;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * In-process cache store with per-entry TTL, used when no shared cache is configured.
 */
public class CaffeineCacheStore implements CacheStore {

    private record Entry(Object value, Duration ttl) {}

    private final Cache<String, Entry> cache;

    public CaffeineCacheStore(long maximumSize) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new Expiry<String, Entry>() {
                @Override
                public long expireAfterCreate(String key, Entry entry, long currentTime) {
                    return entry.ttl().toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                    return entry.ttl().toNanos();
                }

                @Override
                public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null || !type.isInstance(entry.value())) {
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.value()));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        cache.put(key, new Entry(value, ttl));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public long scanDelete(String pattern) {
        Pattern regex = globToRegex(pattern);
        AtomicLong removed = new AtomicLong();
        cache.asMap().keySet().removeIf(key -> {
            boolean matches = regex.matcher(key).matches();
            if (matches) {
                removed.incrementAndGet();
            }
            return matches;
        });
        return removed.get();
    }

    @Override
    public boolean ping() {
        return true;
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (String part : glob.split("\\*", -1)) {
            if (!regex.isEmpty()) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.compile(regex.toString());
    }
}
