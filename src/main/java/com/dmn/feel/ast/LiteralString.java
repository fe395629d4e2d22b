package com.dmn.feel.ast;

import java.util.Objects;

/**
 * String literal, already unquoted and unescaped.
 */
public record LiteralString(String value) implements AstNode {

    public LiteralString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitString(this, context);
    }
}
