package com.dmn.feel.ast;

import java.util.Objects;

/**
 * {@code object.property}. Chains nest to the left: {@code a.b.c} is {@code (a.b).c}.
 */
public record PropertyAccess(AstNode object, String property) implements AstNode {

    public PropertyAccess {
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(property, "property");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPropertyAccess(this, context);
    }
}
