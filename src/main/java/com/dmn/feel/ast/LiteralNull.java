package com.dmn.feel.ast;

public record LiteralNull() implements AstNode {

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNull(this, context);
    }
}
