package com.dmn.exception;

/**
 * Exception raised while walking a FEEL expression tree.
 * Callers map it to null wherever DMN semantics ask for a null result.
 */
public class EvaluationException extends DmnException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
