package com.nevis.docsearch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
public class AsyncConfig {

    /**
     * Runs claimed indexing tasks. On overflow the task row simply stays PENDING and the
     * retry worker dispatches it again later, so nothing is lost.
     */
    @Bean(name = "indexingTaskExecutor")
    public ThreadPoolTaskExecutor indexingTaskExecutor(
        @Value("${app.async.indexing.pool-size:8}") int poolSize,
        @Value("${app.async.indexing.queue-capacity:500}") int queueCapacity
    ) {
        return executor("indexing-", poolSize, queueCapacity,
            (task, pool) -> log.warn("Indexing executor saturated; task left for the retry worker"));
    }

    /**
     * Analytics records are best effort and dropped on overflow.
     */
    @Bean(name = "analyticsTaskExecutor")
    public ThreadPoolTaskExecutor analyticsTaskExecutor(
        @Value("${app.async.analytics.pool-size:2}") int poolSize,
        @Value("${app.async.analytics.queue-capacity:1000}") int queueCapacity
    ) {
        return executor("analytics-", poolSize, queueCapacity,
            (task, pool) -> log.debug("Analytics executor saturated; record dropped"));
    }

    /**
     * Carries breaker-guarded calls so the time limiter can abandon them. Rejections
     * surface to the caller and count as failures.
     */
    @Bean(name = "dependencyCallExecutor")
    public ThreadPoolTaskExecutor dependencyCallExecutor(
        @Value("${app.async.dependency.pool-size:32}") int poolSize,
        @Value("${app.async.dependency.queue-capacity:200}") int queueCapacity
    ) {
        return executor("dependency-", poolSize, queueCapacity, new ThreadPoolExecutor.AbortPolicy());
    }

    private ThreadPoolTaskExecutor executor(String prefix, int poolSize, int queueCapacity,
                                            RejectedExecutionHandler rejectionHandler) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(rejectionHandler);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
