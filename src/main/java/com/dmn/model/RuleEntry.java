package com.dmn.model;

import com.dmn.feel.ast.AstNode;
import com.dmn.feel.expression.FeelExpressions;

import java.util.Optional;

/**
 * One cell of a rule: the source text and, when it parsed as FEEL, its tree.
 */
public record RuleEntry(String text, AstNode ast) {

    public RuleEntry {
        text = text == null ? "" : text.trim();
    }

    public static RuleEntry of(String text) {
        return new RuleEntry(text, null);
    }

    /**
     * Input cell, pre-parsed as FEEL unless it is written in unary-test syntax.
     */
    public static RuleEntry input(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (isUnaryTestSyntax(trimmed)) {
            return new RuleEntry(trimmed, null);
        }
        return new RuleEntry(trimmed, FeelExpressions.tryParse(trimmed).orElse(null));
    }

    /**
     * Output cell, pre-parsed as FEEL when it parses.
     */
    public static RuleEntry output(String text) {
        String trimmed = text == null ? "" : text.trim();
        return new RuleEntry(trimmed, FeelExpressions.tryParse(trimmed).orElse(null));
    }

    private static boolean isUnaryTestSyntax(String text) {
        return text.isEmpty() || "-".equals(text)
                || text.contains(">=") || text.contains("<=") || text.contains("..")
                || text.contains("[") || text.contains("(");
    }

    public Optional<AstNode> parsed() {
        return Optional.ofNullable(ast);
    }

    public boolean isWildcard() {
        return text.isEmpty() || "-".equals(text);
    }
}
