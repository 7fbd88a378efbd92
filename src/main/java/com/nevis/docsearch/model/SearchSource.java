package com.nevis.docsearch.model;

public enum SearchSource {
    CACHE,
    ENGINE,
    FALLBACK
}
