package com.nevis.docsearch.model;

import java.time.OffsetDateTime;

public record IndexingTask(
    Long id,
    IndexAction action,
    Long documentId,
    Long tenantId,
    TaskStatus status,
    int attempts,
    OffsetDateTime nextAttemptAt,
    String lastError,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
