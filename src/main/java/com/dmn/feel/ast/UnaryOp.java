package com.dmn.feel.ast;

import java.util.Objects;

public record UnaryOp(UnaryOperator operator, AstNode operand) implements AstNode {

    public UnaryOp {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnary(this, context);
    }
}
