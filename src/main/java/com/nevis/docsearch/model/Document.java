package com.nevis.docsearch.model;

import java.time.OffsetDateTime;
import java.util.Map;

public record Document(
    Long id,
    Long tenantId,
    String title,
    String content,
    Map<String, Object> metadata,
    String contentHash,
    OffsetDateTime indexedAt,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    /**
     * A document counts as indexed only when the search engine has seen it after its latest change.
     */
    public boolean indexed() {
        return indexedAt != null && updatedAt != null && indexedAt.isAfter(updatedAt);
    }

    public String indexingJobId() {
        return "job_" + id + "_" + (updatedAt != null ? updatedAt.toEpochSecond() : 0);
    }
}
