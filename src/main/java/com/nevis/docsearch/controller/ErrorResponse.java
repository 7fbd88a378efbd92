package com.nevis.docsearch.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String message,
    int status,
    long timestamp,
    List<String> details,
    @JsonProperty("retry_after") Long retryAfter,
    Long current,
    Long limit
) {
    public static ErrorResponse of(String error, String message, HttpStatus status) {
        return new ErrorResponse(error, message, status.value(), Instant.now().toEpochMilli(), null, null, null, null);
    }

    public ErrorResponse withDetails(List<String> details) {
        return new ErrorResponse(error, message, status, timestamp, details, retryAfter, current, limit);
    }

    public ErrorResponse withRetryAfter(long seconds) {
        return new ErrorResponse(error, message, status, timestamp, details, seconds, current, limit);
    }

    public ErrorResponse withUsage(long current, long limit) {
        return new ErrorResponse(error, message, status, timestamp, details, retryAfter, current, limit);
    }
}
