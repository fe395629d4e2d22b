package com.dmn.feel.expression;

import java.util.List;
import java.util.Set;

/**
 * Keywords, operators and punctuation of the FEEL grammar.
 */
public final class FeelConfig {

    private FeelConfig() {
    }

    /**
     * Reserved words. An identifier whose full text is one of these becomes a KEYWORD token.
     */
    public static final Set<String> KEYWORDS = Set.of(
            // Literals
            "true", "false", "null",

            // Logical
            "and", "or", "not",

            // Conditional
            "if", "then", "else",

            // Iteration and quantifiers
            "in", "for", "some", "every", "return",

            // Range and type tests
            "between", "instance", "of"
    );

    /**
     * Built-in names that contain a keyword and are read as one identifier.
     */
    public static final List<String> KEYWORD_NAMES = List.of(
            "date and time", "years and months duration",
            "index of", "day of year", "day of week", "month of year", "week of year");

    /**
     * Operators that may be followed by a second character to form a two-character operator.
     */
    public static final Set<String> TWO_CHAR_OPERATORS = Set.of("**", "<=", ">=", "!=", "==");

    /**
     * Comparison operators accepted at the comparison precedence level.
     */
    public static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "<=", ">=", "=", "!=");

    /**
     * Characters that end a space-containing identifier when they follow the space.
     */
    public static final String IDENTIFIER_TERMINATORS = "+-*/<>=!()[],.";

    /**
     * Operator and punctuation symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char COMMA = ',';
        public static final char COLON = ':';
        public static final char DOT = '.';
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char LESS = '<';
        public static final char GREATER = '>';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char QUOTE_DOUBLE = '"';
        public static final char BACKSLASH = '\\';
        public static final char UNDERSCORE = '_';
        public static final char SPACE = ' ';

        private Operators() {
        }
    }

    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }
}
