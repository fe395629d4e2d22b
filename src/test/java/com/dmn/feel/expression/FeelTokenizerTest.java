package com.dmn.feel.expression;

import com.dmn.exception.FeelSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FeelTokenizer.
 */
class FeelTokenizerTest {

    private static List<Token> tokenize(String input) {
        return new FeelTokenizer(input).tokenize();
    }

    private static List<TokenType> types(String input) {
        return tokenize(input).stream().map(Token::type).toList();
    }

    // =====================================================================
    // Literals
    // =====================================================================

    @Nested
    @DisplayName("Literals")
    class Literals {

        @ParameterizedTest
        @CsvSource({
                "42, 42.0",
                "3.14, 3.14",
                ".5, 0.5",
                "1.5e3, 1500.0",
                "2E-2, 0.02"
        })
        @DisplayName("Should read numbers including decimals and exponents")
        void shouldReadNumbers(String input, double expected) {
            List<Token> tokens = tokenize(input);
            assertEquals(TokenType.NUMBER, tokens.get(0).type());
            assertEquals(expected, (Double) tokens.get(0).literal(), 1e-12);
            assertEquals(TokenType.END_OF_INPUT, tokens.get(1).type());
        }

        @Test
        @DisplayName("Should unescape string literals and keep source text")
        void shouldReadStrings() {
            Token token = tokenize("\"say \\\"hi\\\"\\n\"").get(0);
            assertEquals(TokenType.STRING, token.type());
            assertEquals("say \"hi\"\n", token.literal());
            assertEquals("\"say \\\"hi\\\"\\n\"", token.text());
        }

        @Test
        @DisplayName("Should fail on unterminated string with its position")
        void shouldFailOnUnterminatedString() {
            FeelSyntaxException e = assertThrows(FeelSyntaxException.class, () -> tokenize("1 + \"abc"));
            assertEquals(4, e.getPosition());
            assertTrue(e.getMessage().contains("Unterminated string"));
        }

        @Test
        @DisplayName("Should fail on unrecognized character")
        void shouldFailOnUnknownCharacter() {
            FeelSyntaxException e = assertThrows(FeelSyntaxException.class, () -> tokenize("a # b"));
            assertEquals(2, e.getPosition());
        }
    }

    // =====================================================================
    // Identifiers and keywords
    // =====================================================================

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        @DisplayName("Should keep spaces inside identifiers")
        void shouldReadIdentifierWithSpaces() {
            List<Token> tokens = tokenize("Monthly Salary * 12");
            assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
            assertEquals("Monthly Salary", tokens.get(0).text());
            assertTrue(tokens.get(1).isOperator("*"));
        }

        @Test
        @DisplayName("Should stop identifier before a keyword")
        void shouldStopBeforeKeyword() {
            List<Token> tokens = tokenize("age and score");
            assertEquals("age", tokens.get(0).text());
            assertTrue(tokens.get(1).isKeyword("and"));
            assertEquals("score", tokens.get(2).text());
        }

        @Test
        @DisplayName("Should read multi-word function names")
        void shouldReadFunctionNames() {
            List<Token> tokens = tokenize("round half up(x, 2)");
            assertEquals("round half up", tokens.get(0).text());
            assertEquals(TokenType.LPAREN, tokens.get(1).type());
        }

        @Test
        @DisplayName("Should read 'date and time' as a single identifier")
        void shouldReadDateAndTime() {
            List<Token> tokens = tokenize("date and time(\"2024-01-01\")");
            assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
            assertEquals("date and time", tokens.get(0).text());
        }

        @Test
        @DisplayName("Should classify reserved words as keywords")
        void shouldClassifyKeywords() {
            assertEquals(List.of(TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.KEYWORD,
                            TokenType.NUMBER, TokenType.KEYWORD, TokenType.NUMBER, TokenType.END_OF_INPUT),
                    types("if flag then 1 else 2"));
        }
    }

    // =====================================================================
    // Operators and unary minus
    // =====================================================================

    @Nested
    @DisplayName("Operators")
    class OperatorTokens {

        @ParameterizedTest
        @CsvSource({"**", "<=", ">=", "!=", "=="})
        @DisplayName("Should read two-character operators")
        void shouldReadTwoCharOperators(String operator) {
            List<Token> tokens = tokenize("a " + operator + " b");
            assertTrue(tokens.get(1).isOperator(operator));
        }

        @Test
        @DisplayName("Should fold minus into number at stream start")
        void shouldFoldLeadingMinus() {
            List<Token> tokens = tokenize("-5");
            assertEquals(TokenType.NUMBER, tokens.get(0).type());
            assertEquals(-5.0, (Double) tokens.get(0).literal());
        }

        @Test
        @DisplayName("Should fold minus into number after an operator")
        void shouldFoldMinusAfterOperator() {
            List<Token> tokens = tokenize("5 - -3");
            assertTrue(tokens.get(1).isOperator("-"));
            assertEquals(TokenType.NUMBER, tokens.get(2).type());
            assertEquals("-3", tokens.get(2).text());
        }

        @Test
        @DisplayName("Should keep binary minus as operator after an operand")
        void shouldKeepBinaryMinus() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.END_OF_INPUT),
                    types("a-1"));
            assertEquals(List.of(TokenType.RPAREN, TokenType.OPERATOR, TokenType.NUMBER),
                    types("(2)-1").subList(2, 5));
        }

        @Test
        @DisplayName("Should not fold minus after a colon")
        void shouldNotFoldMinusAfterColon() {
            List<Token> tokens = tokenize("abs(n: -1)");
            assertEquals(TokenType.COLON, tokens.get(3).type());
            assertTrue(tokens.get(4).isOperator("-"));
            assertEquals(TokenType.NUMBER, tokens.get(5).type());
        }

        @Test
        @DisplayName("Should produce punctuation tokens with positions")
        void shouldTrackPositions() {
            List<Token> tokens = tokenize("[1, 2]");
            assertEquals(TokenType.LBRACKET, tokens.get(0).type());
            assertEquals(0, tokens.get(0).position());
            assertEquals(TokenType.COMMA, tokens.get(2).type());
            assertEquals(2, tokens.get(2).position());
            assertEquals(TokenType.RBRACKET, tokens.get(4).type());
            assertEquals(5, tokens.get(4).position());
        }
    }
}
