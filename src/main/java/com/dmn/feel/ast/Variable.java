package com.dmn.feel.ast;

import java.util.Objects;

/**
 * Reference to a context variable. The name may contain spaces.
 */
public record Variable(String name) implements AstNode {

    public Variable {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }
}
