package com.dmn.feel.expression;

import com.dmn.exception.FeelSyntaxException;

import java.util.ArrayList;
import java.util.List;

import static com.dmn.feel.expression.FeelConfig.*;

/**
 * Tokenizer for FEEL expressions.
 * Converts input string into a sequence of tokens terminated by END_OF_INPUT.
 * <p>
 * Identifiers may contain spaces ({@code Monthly Salary}, {@code round up}). A space is kept
 * inside an identifier unless the text so far is a keyword, or what follows the space is the
 * end of input, an operator, punctuation, or a keyword.
 * <p>
 * A {@code -} directly followed by a digit becomes part of a NUMBER token only in unary context:
 * at stream start or after an operator, {@code (}, {@code [} or {@code ,}. Anywhere else it is an
 * OPERATOR token and the parser applies negation.
 */
public final class FeelTokenizer {

    private final String input;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    public FeelTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always ending with END_OF_INPUT
     * @throws FeelSyntaxException on an unrecognized character or malformed literal
     */
    public List<Token> tokenize() {
        tokens.clear();
        pos = 0;

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            if (startsNumber(c)) {
                tokens.add(readNumber());
                continue;
            }

            switch (c) {
                case Operators.LEFT_PAREN -> addPunctuation(TokenType.LPAREN, start);
                case Operators.RIGHT_PAREN -> addPunctuation(TokenType.RPAREN, start);
                case Operators.LEFT_BRACKET -> addPunctuation(TokenType.LBRACKET, start);
                case Operators.RIGHT_BRACKET -> addPunctuation(TokenType.RBRACKET, start);
                case Operators.COMMA -> addPunctuation(TokenType.COMMA, start);
                case Operators.COLON -> addPunctuation(TokenType.COLON, start);
                case Operators.DOT -> addPunctuation(TokenType.DOT, start);
                case Operators.PLUS, Operators.MINUS, Operators.STAR, Operators.SLASH,
                        Operators.LESS, Operators.GREATER, Operators.EQUALS, Operators.BANG ->
                        tokens.add(readOperator());
                case Operators.QUOTE_DOUBLE -> tokens.add(readString());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.END_OF_INPUT, "", null, pos));
        return List.copyOf(tokens);
    }

    private void addPunctuation(TokenType type, int start) {
        char c = advance();
        tokens.add(new Token(type, String.valueOf(c), null, start));
    }

    private Token readOperator() {
        int start = pos;
        advance();
        if (!isAtEnd() && TWO_CHAR_OPERATORS.contains(input.substring(start, pos + 1))) {
            advance();
        }
        String text = input.substring(start, pos);
        return new Token(TokenType.OPERATOR, text, null, start);
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;
        for (String name : KEYWORD_NAMES) {
            int end = start + name.length();
            if (input.startsWith(name, start) && (end >= length || !isWordChar(input.charAt(end)))) {
                pos = end;
                return new Token(TokenType.IDENTIFIER, name, null, start);
            }
        }

        StringBuilder text = new StringBuilder();
        text.append(advance());

        while (!isAtEnd() && isIdentifierPart(peek())) {
            if (peek() == Operators.SPACE && shouldStopAtSpace(text.toString())) {
                break;
            }
            text.append(advance());
        }

        String identifier = text.toString().stripTrailing();
        TokenType type = isKeyword(identifier) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        return new Token(type, identifier, null, start);
    }

    private boolean shouldStopAtSpace(String current) {
        if (isKeyword(current.stripTrailing())) {
            return true;
        }

        int lookahead = skipWhitespaceFrom(pos + 1);
        if (lookahead >= length) {
            return true;
        }
        if (IDENTIFIER_TERMINATORS.indexOf(input.charAt(lookahead)) >= 0) {
            return true;
        }

        String nextWord = wordAt(lookahead);
        return !nextWord.isEmpty() && isKeyword(nextWord);
    }

    private Token readNumber() {
        int start = pos;

        if (peek() == Operators.MINUS) {
            advance();
        }

        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }

        if (!isAtEnd() && peek() == Operators.DOT) {
            advance();
            while (!isAtEnd() && Character.isDigit(peek())) {
                advance();
            }
        }

        // Exponent
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            advance();
            if (!isAtEnd() && (peek() == Operators.PLUS || peek() == Operators.MINUS)) {
                advance();
            }
            while (!isAtEnd() && Character.isDigit(peek())) {
                advance();
            }
        }

        String text = input.substring(start, pos);
        double number;
        try {
            number = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }

        return new Token(TokenType.NUMBER, text, number, start);
    }

    private Token readString() {
        int start = pos;
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != Operators.QUOTE_DOUBLE) {
            char c = advance();

            if (c == Operators.BACKSLASH && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", start);
        }

        advance(); // closing quote
        return new Token(TokenType.STRING, input.substring(start, pos), sb.toString(), start);
    }

    private boolean startsNumber(char c) {
        if (Character.isDigit(c)) {
            return true;
        }
        if (c == Operators.DOT) {
            return isDigitAt(pos + 1);
        }
        if (c == Operators.MINUS && isUnaryContext()) {
            return isDigitAt(pos + 1)
                    || (charAt(pos + 1) == Operators.DOT && isDigitAt(pos + 2));
        }
        return false;
    }

    private boolean isUnaryContext() {
        if (tokens.isEmpty()) {
            return true;
        }
        TokenType last = tokens.get(tokens.size() - 1).type();
        return last == TokenType.OPERATOR
                || last == TokenType.LPAREN
                || last == TokenType.LBRACKET
                || last == TokenType.COMMA;
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE || c == Operators.SPACE;
    }

    private boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE;
    }

    private int skipWhitespaceFrom(int from) {
        int i = from;
        while (i < length && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i;
    }

    private String wordAt(int from) {
        int i = from;
        while (i < length && isWordChar(input.charAt(i))) {
            i++;
        }
        return input.substring(from, i);
    }

    private boolean isDigitAt(int index) {
        return index < length && Character.isDigit(input.charAt(index));
    }

    private char charAt(int index) {
        return index < length ? input.charAt(index) : '\0';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private FeelSyntaxException error(String message, int position) {
        return new FeelSyntaxException(message, position, input);
    }
}
