package com.dmn.feel.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Binary operators, grouped by precedence level.
 */
public enum BinaryOperator {
    // Logical
    OR("or"),
    AND("and"),

    // Comparison
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">="),
    EQUAL("="),
    NOT_EQUAL("!="),

    // Arithmetic
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    POWER("**");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Look up an operator by its source symbol. {@code ==} is an alias for {@code =}.
     */
    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        String normalized = "==".equals(symbol) ? "=" : symbol;
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
