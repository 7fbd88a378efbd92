package com.nevis.docsearch.model;

public enum TaskStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    DEAD
}
