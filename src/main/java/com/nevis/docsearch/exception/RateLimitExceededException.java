package com.nevis.docsearch.exception;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {
    private final Long tenantId;
    private final long retryAfterSeconds;

    public RateLimitExceededException(Long tenantId, long retryAfterSeconds) {
        super("Rate limit exceeded");
        this.tenantId = tenantId;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
