package com.dmn.exception;

/**
 * Exception thrown when FEEL text cannot be tokenized or parsed.
 */
public class FeelSyntaxException extends DmnException {

    private final int position;
    private final String expression;

    public FeelSyntaxException(String message, int position, String expression) {
        super("Invalid FEEL expression at position " + position + ": " + message + " in '" + expression + "'");
        this.position = position;
        this.expression = expression;
    }

    public FeelSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1;
        this.expression = null;
    }

    /**
     * Offset in the source text where the problem was detected, or -1 if unknown.
     */
    public int getPosition() {
        return position;
    }

    public String getExpression() {
        return expression;
    }
}
