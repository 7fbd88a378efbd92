package com.nevis.docsearch.event;

public record IndexingTaskScheduledEvent(Long taskId) {}
