package com.dmn.feel.expression;

/**
 * Represents a token in a FEEL expression.
 *
 * @param type     Token type
 * @param text     Source text (keywords and operators verbatim, identifiers trimmed)
 * @param literal  Parsed literal value: Double for numbers, unescaped text for strings
 * @param position Offset of the first character in the input string
 */
public record Token(TokenType type, String text, Object literal, int position) {

    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenType.KEYWORD, keyword);
    }

    public boolean isOperator(String operator) {
        return is(TokenType.OPERATOR, operator);
    }

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
