package com.dmn.feel.expression;

/**
 * Token kinds produced by {@link FeelTokenizer}.
 */
public enum TokenType {
    // Literals
    NUMBER,
    STRING,

    // Names
    IDENTIFIER,
    KEYWORD,

    // Operators: + - * / ** < > <= >= = == != !
    OPERATOR,

    // Punctuation
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    DOT,
    COLON,

    // Special
    END_OF_INPUT,
    UNKNOWN
}
