package com.nevis.docsearch.exception;

import lombok.Getter;

@Getter
public class QuotaExceededException extends RuntimeException {
    private final long current;
    private final long limit;

    public QuotaExceededException(long current, long limit) {
        super("Document quota exceeded");
        this.current = current;
        this.limit = limit;
    }
}
