package com.dmn.feel.ast;

import java.util.List;

public record LiteralList(List<AstNode> elements) implements AstNode {

    public LiteralList {
        elements = List.copyOf(elements);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitList(this, context);
    }
}
