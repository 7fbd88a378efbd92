package com.nevis.docsearch.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
public class RedisCacheStore implements CacheStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final CircuitBreakerGuard circuitBreaker;
    private final String namespace;

    public RedisCacheStore(
        StringRedisTemplate redisTemplate,
        ObjectMapper objectMapper,
        CircuitBreakerGuard circuitBreaker,
        String namespace
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.namespace = namespace;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            String raw = circuitBreaker.call(CircuitBreakerGuard.CACHE_STORE,
                () -> redisTemplate.opsForValue().get(namespaced(key)));
            if (raw == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(raw, type));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.getMessage());
            delete(key);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Cache read error for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        try {
            String raw = objectMapper.writeValueAsString(value);
            circuitBreaker.run(CircuitBreakerGuard.CACHE_STORE,
                () -> redisTemplate.opsForValue().set(namespaced(key), raw, ttl));
        } catch (JsonProcessingException e) {
            log.warn("Value for {} is not serializable, skipping cache write: {}", key, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Cache write error for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void delete(String key) {
        try {
            circuitBreaker.call(CircuitBreakerGuard.CACHE_STORE, () -> redisTemplate.delete(namespaced(key)));
        } catch (RuntimeException e) {
            log.error("Cache delete error for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public long scanDelete(String pattern) {
        ScanOptions options = ScanOptions.scanOptions().match(namespaced(pattern)).count(500).build();
        try {
            return circuitBreaker.call(CircuitBreakerGuard.CACHE_STORE, () -> {
                List<String> keys = new ArrayList<>();
                try (Cursor<String> cursor = redisTemplate.scan(options)) {
                    cursor.forEachRemaining(keys::add);
                }
                if (keys.isEmpty()) {
                    return 0L;
                }
                Long deleted = redisTemplate.delete(keys);
                return deleted != null ? deleted : 0L;
            });
        } catch (RuntimeException e) {
            log.error("Cache scan-delete error for {}: {}", pattern, e.getMessage());
            return 0L;
        }
    }

    @Override
    public boolean ping() {
        try {
            String pong = circuitBreaker.call(CircuitBreakerGuard.CACHE_STORE,
                () -> redisTemplate.execute((RedisCallback<String>) RedisConnection::ping));
            return "PONG".equalsIgnoreCase(pong);
        } catch (RuntimeException e) {
            log.warn("Cache ping failed: {}", e.getMessage());
            return false;
        }
    }

    private String namespaced(String key) {
        return namespace + ":" + key;
    }
}
