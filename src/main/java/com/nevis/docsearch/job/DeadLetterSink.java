package com.nevis.docsearch.job;

/**
 * Durable record of work that exhausted its retries, kept for operator follow-up.
 */
public interface DeadLetterSink {

    void record(String jobKind, Long subjectId, Long tenantId, String errorMessage);
}
