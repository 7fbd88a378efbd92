package com.nevis.docsearch.service;

public interface AnalyticsSink {

    void record(long tenantId, String query, long resultCount, long tookMs);
}
