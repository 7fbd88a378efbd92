package com.nevis.docsearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.docsearch.infra.CacheStore;
import com.nevis.docsearch.infra.CaffeineCacheStore;
import com.nevis.docsearch.infra.CircuitBreakerGuard;
import com.nevis.docsearch.infra.RedisCacheStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "app.cache.store", havingValue = "redis", matchIfMissing = true)
    public CacheStore redisCacheStore(
        StringRedisTemplate redisTemplate,
        ObjectMapper objectMapper,
        CircuitBreakerGuard circuitBreakerGuard,
        @Value("${app.cache.namespace:docsearch}") String namespace
    ) {
        return new RedisCacheStore(redisTemplate, objectMapper, circuitBreakerGuard, namespace);
    }

    @Bean
    @ConditionalOnProperty(name = "app.cache.store", havingValue = "memory")
    public CacheStore caffeineCacheStore(@Value("${app.cache.maximum-size:10000}") long maximumSize) {
        return new CaffeineCacheStore(maximumSize);
    }
}
