package com.nevis.docsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

public record SearchHit(
    Long id,
    String title,
    String snippet,
    Double score,
    @JsonProperty("created_at") OffsetDateTime createdAt
) {}
