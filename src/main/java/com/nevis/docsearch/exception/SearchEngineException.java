package com.nevis.docsearch.exception;

/**
 * Raised by search engine adapters for any backend failure, so the circuit breaker
 * can record a single exception type regardless of the configured backend.
 */
public class SearchEngineException extends RuntimeException {

    public SearchEngineException(String message) {
        super(message);
    }

    public SearchEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
