package com.nevis.docsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

public record DeadLetter(
    Long id,
    @JsonProperty("job_kind") String jobKind,
    @JsonProperty("subject_id") Long subjectId,
    @JsonProperty("tenant_id") Long tenantId,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("created_at") OffsetDateTime createdAt
) {}
