package com.dmn.exception;

/**
 * Exception thrown when a business knowledge model cannot be invoked.
 */
public class BkmInvocationException extends DmnException {

    public BkmInvocationException(String message) {
        super(message);
    }

    public BkmInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
