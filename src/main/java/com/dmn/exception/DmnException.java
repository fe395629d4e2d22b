package com.dmn.exception;

/**
 * Base exception for the DMN engine.
 */
public class DmnException extends RuntimeException {

    public DmnException(String message) {
        super(message);
    }

    public DmnException(String message, Throwable cause) {
        super(message, cause);
    }
}
