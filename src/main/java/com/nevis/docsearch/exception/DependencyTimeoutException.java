package com.nevis.docsearch.exception;

public class DependencyTimeoutException extends RuntimeException {

    public DependencyTimeoutException(String dependency, Throwable cause) {
        super("Call to " + dependency + " timed out", cause);
    }
}
