package com.nevis.docsearch.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.docsearch.model.SearchHit;

import java.util.List;

public record SearchResponse(
    String query,

    long total,

    int page,

    @JsonProperty("per_page")
    int perPage,

    @JsonProperty("took_ms")
    long tookMs,

    List<SearchHit> results
) {}
