package com.nevis.docsearch.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingAnalyticsSink implements AnalyticsSink {

    @Override
    @Async("analyticsTaskExecutor")
    public void record(long tenantId, String query, long resultCount, long tookMs) {
        log.info("Search analytics: tenant={} query='{}' results={} took_ms={}", tenantId, query, resultCount, tookMs);
    }
}
