package com.dmn.feel.ast;

import java.util.List;
import java.util.Objects;

/**
 * Call of a built-in function or business knowledge model.
 *
 * @param name       Function name, may contain spaces ({@code string length})
 * @param parameters Actual parameters in source order, all positional or all named
 */
public record FunctionCall(String name, List<FunctionParameter> parameters) implements AstNode {

    public FunctionCall {
        Objects.requireNonNull(name, "name");
        parameters = List.copyOf(parameters);
    }

    public boolean hasNamedParameters() {
        return parameters.stream().anyMatch(FunctionParameter::isNamed);
    }

    public boolean hasPositionalParameters() {
        return parameters.stream().anyMatch(p -> !p.isNamed());
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCall(this, context);
    }
}
