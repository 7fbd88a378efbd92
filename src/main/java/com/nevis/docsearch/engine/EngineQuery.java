package com.nevis.docsearch.engine;

public record EngineQuery(
    String collection,
    String text,
    long tenantId,
    int limit,
    int offset
) {}
