package com.dmn.feel.ast;

public record LiteralNumber(double value) implements AstNode {

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNumber(this, context);
    }
}
