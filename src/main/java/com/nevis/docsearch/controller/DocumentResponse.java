package com.nevis.docsearch.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.docsearch.model.Document;

import java.time.OffsetDateTime;
import java.util.Map;

public record DocumentResponse(
    Long id,

    @JsonProperty("tenant_id")
    Long tenantId,

    String title,

    String content,

    Map<String, Object> metadata,

    boolean indexed,

    @JsonProperty("indexing_job_id")
    String indexingJobId,

    @JsonProperty("indexed_at")
    OffsetDateTime indexedAt,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {
    public static DocumentResponse from(Document document) {
        return new DocumentResponse(
            document.id(),
            document.tenantId(),
            document.title(),
            document.content(),
            document.metadata(),
            document.indexed(),
            document.indexingJobId(),
            document.indexedAt(),
            document.createdAt(),
            document.updatedAt()
        );
    }
}
