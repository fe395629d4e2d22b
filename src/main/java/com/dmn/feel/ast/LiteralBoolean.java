package com.dmn.feel.ast;

public record LiteralBoolean(boolean value) implements AstNode {

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBoolean(this, context);
    }
}
