package com.nevis.docsearch.exception;

public class WrongQueryException extends RuntimeException {

    public WrongQueryException(String message) {
        super(message);
    }
}
