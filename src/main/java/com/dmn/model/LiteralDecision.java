package com.dmn.model;

import com.dmn.feel.ast.AstNode;
import com.dmn.feel.expression.FeelExpressions;

import java.util.Optional;

/**
 * Decision whose logic is a single FEEL expression.
 */
public record LiteralDecision(String name, String expression, AstNode ast) {

    public static LiteralDecision of(String name, String expression) {
        return new LiteralDecision(name, expression, FeelExpressions.tryParse(expression).orElse(null));
    }

    public Optional<AstNode> parsed() {
        return Optional.ofNullable(ast);
    }
}
