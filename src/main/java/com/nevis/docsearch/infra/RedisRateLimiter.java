package com.nevis.docsearch.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class RedisRateLimiter implements RateLimiter {

    // INCR and EXPIRE run as one script so a crash between them cannot leave an immortal counter
    static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>("""
        local count = redis.call('INCR', KEYS[1])
        if count == 1 then
            redis.call('EXPIRE', KEYS[1], ARGV[1])
        end
        return count
        """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public long check(long tenantId) {
        String key = RateLimiter.key(tenantId, RateLimiter.window(clock.instant().getEpochSecond()));
        try {
            Long count = redisTemplate.execute(INCREMENT_SCRIPT, List.of(key), String.valueOf(COUNTER_TTL_SECONDS));
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            log.error("Rate limiter store error for tenant {}, allowing request: {}", tenantId, e.getMessage());
            return 0L;
        }
    }

    @Override
    public void reset(long tenantId) {
        ScanOptions options = ScanOptions.scanOptions()
            .match(RateLimiter.keyPrefix(tenantId) + "*")
            .count(500)
            .build();

        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
            if (!keys.isEmpty()) {
                redisTemplate.delete(keys);
            }
            log.info("Reset {} rate limit counters for tenant {}", keys.size(), tenantId);
        } catch (DataAccessException e) {
            log.error("Rate limiter reset failed for tenant {}: {}", tenantId, e.getMessage());
        }
    }
}
