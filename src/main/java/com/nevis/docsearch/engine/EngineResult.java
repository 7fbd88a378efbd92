package com.nevis.docsearch.engine;

import java.util.List;

public record EngineResult(
    long total,
    List<EngineHit> hits
) {}
