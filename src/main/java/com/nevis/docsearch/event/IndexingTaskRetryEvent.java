package com.nevis.docsearch.event;

public record IndexingTaskRetryEvent(Long taskId) {}
