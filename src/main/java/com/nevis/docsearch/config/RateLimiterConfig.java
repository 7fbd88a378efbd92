package com.nevis.docsearch.config;

import com.nevis.docsearch.infra.InMemoryRateLimiter;
import com.nevis.docsearch.infra.RateLimiter;
import com.nevis.docsearch.infra.RedisRateLimiter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class RateLimiterConfig {

    @Bean
    @ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "redis", matchIfMissing = true)
    public RateLimiter redisRateLimiter(StringRedisTemplate redisTemplate, Clock clock) {
        return new RedisRateLimiter(redisTemplate, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "memory")
    public RateLimiter inMemoryRateLimiter(Clock clock) {
        return new InMemoryRateLimiter(clock);
    }
}
