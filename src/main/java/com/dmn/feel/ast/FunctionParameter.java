package com.dmn.feel.ast;

import java.util.Objects;

/**
 * Actual parameter of a function call. An empty name marks a positional parameter.
 */
public record FunctionParameter(String name, AstNode value) {

    public FunctionParameter {
        name = name == null ? "" : name;
        Objects.requireNonNull(value, "value");
    }

    public static FunctionParameter positional(AstNode value) {
        return new FunctionParameter("", value);
    }

    public static FunctionParameter named(String name, AstNode value) {
        return new FunctionParameter(name, value);
    }

    public boolean isNamed() {
        return !name.isEmpty();
    }
}
