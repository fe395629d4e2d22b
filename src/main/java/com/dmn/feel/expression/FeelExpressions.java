package com.dmn.feel.expression;

import com.dmn.exception.FeelSyntaxException;
import com.dmn.feel.ast.AstNode;

import java.util.List;
import java.util.Optional;

/**
 * Facade for turning FEEL text into an expression tree.
 * <p>
 * Supports:
 * <ul>
 *   <li>Conditionals: if / then / else</li>
 *   <li>Logical operators: and, or (three-valued)</li>
 *   <li>Comparisons: =, ==, !=, &lt;, &lt;=, &gt;, &gt;=</li>
 *   <li>Arithmetic: +, -, *, /, ** and unary minus</li>
 *   <li>Function calls with positional or named arguments</li>
 *   <li>List literals and property chains</li>
 * </ul>
 */
public final class FeelExpressions {

    private FeelExpressions() {
    }

    /**
     * Parse a FEEL expression.
     *
     * @param expression Expression text
     * @return Root of the parsed tree
     * @throws FeelSyntaxException if the text is empty or malformed
     */
    public static AstNode parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new FeelSyntaxException("Empty expression", 0, expression == null ? "" : expression);
        }

        // Tokenize
        FeelTokenizer tokenizer = new FeelTokenizer(expression);
        List<Token> tokens = tokenizer.tokenize();

        // Parse
        FeelParser parser = new FeelParser(expression, tokens);
        return parser.parse();
    }

    /**
     * Parse a FEEL expression, returning empty instead of throwing on malformed text.
     */
    public static Optional<AstNode> tryParse(String expression) {
        try {
            return Optional.of(parse(expression));
        } catch (FeelSyntaxException e) {
            return Optional.empty();
        }
    }
}
