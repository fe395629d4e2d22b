package com.dmn.model;

import com.dmn.feel.ast.AstNode;
import com.dmn.feel.expression.FeelExpressions;

import java.util.List;
import java.util.Optional;

/**
 * Decision table input column.
 *
 * @param label           Column label, also the context key the input is read from
 * @param typeRef         Declared type, informational
 * @param inputExpression FEEL expression producing the input value, or null to read by label
 * @param expressionAst   Parsed input expression, or null
 * @param allowedValues   Permitted values as written (quotes allowed), empty for no restriction
 */
public record InputClause(String label, String typeRef, String inputExpression, AstNode expressionAst,
                          List<String> allowedValues) {

    public InputClause {
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    public static InputClause of(String label) {
        return new InputClause(label, null, null, null, List.of());
    }

    /**
     * Input read through a FEEL expression, for example {@code Applicant.Age}.
     */
    public static InputClause withExpression(String label, String inputExpression) {
        return new InputClause(label, null, inputExpression,
                FeelExpressions.tryParse(inputExpression).orElse(null), List.of());
    }

    public static InputClause withAllowedValues(String label, List<String> allowedValues) {
        return new InputClause(label, null, null, null, allowedValues);
    }

    public Optional<AstNode> parsedExpression() {
        return Optional.ofNullable(expressionAst);
    }
}
