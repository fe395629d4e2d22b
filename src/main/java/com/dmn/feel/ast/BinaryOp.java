package com.dmn.feel.ast;

import java.util.Objects;

public record BinaryOp(BinaryOperator operator, AstNode left, AstNode right) implements AstNode {

    public BinaryOp {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }
}
