package com.dmn.feel.ast;

import java.util.Objects;

public record Conditional(AstNode condition, AstNode thenBranch, AstNode elseBranch) implements AstNode {

    public Conditional {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(thenBranch, "thenBranch");
        Objects.requireNonNull(elseBranch, "elseBranch");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConditional(this, context);
    }
}
