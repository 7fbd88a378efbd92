package com.nevis.docsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SearchResult(
    long total,
    @JsonProperty("took_ms") long tookMs,
    List<SearchHit> results,
    SearchSource source
) {
    public SearchResult withTiming(long tookMs, SearchSource source) {
        return new SearchResult(total, tookMs, results, source);
    }
}
