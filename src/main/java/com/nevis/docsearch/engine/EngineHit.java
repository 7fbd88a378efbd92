package com.nevis.docsearch.engine;

import java.util.List;
import java.util.Map;

public record EngineHit(
    Long documentId,
    String title,
    Double score,
    Map<String, Object> fields,
    List<String> highlights
) {}
