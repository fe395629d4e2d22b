package com.dmn.exception;

/**
 * Exception thrown when a decision model is structurally invalid.
 * Covers malformed model files, rule shape mismatches and input values
 * outside an input clause's allowed values.
 */
public class ModelException extends DmnException {

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
