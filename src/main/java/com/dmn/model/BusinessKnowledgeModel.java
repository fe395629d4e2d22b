package com.dmn.model;

import com.dmn.feel.ast.AstNode;
import com.dmn.feel.expression.FeelExpressions;

import java.util.List;
import java.util.Optional;

/**
 * Named, parameterized FEEL function.
 *
 * @param name       BKM name, also the name it is called by from FEEL
 * @param parameters Parameter names in positional order
 * @param expression FEEL body text
 * @param ast        Body parsed at load time, or null if it did not parse
 */
public record BusinessKnowledgeModel(String name, List<String> parameters, String expression, AstNode ast) {

    public BusinessKnowledgeModel {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * BKM with its body pre-parsed; a body that does not parse is reported when invoked.
     */
    public static BusinessKnowledgeModel of(String name, List<String> parameters, String expression) {
        return new BusinessKnowledgeModel(name, parameters, expression,
                FeelExpressions.tryParse(expression).orElse(null));
    }

    public Optional<AstNode> parsed() {
        return Optional.ofNullable(ast);
    }
}
