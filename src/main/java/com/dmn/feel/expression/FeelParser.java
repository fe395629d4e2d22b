package com.dmn.feel.expression;

import com.dmn.exception.FeelSyntaxException;
import com.dmn.feel.ast.AstNode;
import com.dmn.feel.ast.BinaryOp;
import com.dmn.feel.ast.BinaryOperator;
import com.dmn.feel.ast.Conditional;
import com.dmn.feel.ast.FunctionCall;
import com.dmn.feel.ast.FunctionParameter;
import com.dmn.feel.ast.LiteralBoolean;
import com.dmn.feel.ast.LiteralList;
import com.dmn.feel.ast.LiteralNull;
import com.dmn.feel.ast.LiteralNumber;
import com.dmn.feel.ast.LiteralString;
import com.dmn.feel.ast.PropertyAccess;
import com.dmn.feel.ast.UnaryOp;
import com.dmn.feel.ast.UnaryOperator;
import com.dmn.feel.ast.Variable;

import java.util.ArrayList;
import java.util.List;

import static com.dmn.feel.expression.FeelConfig.COMPARISON_OPERATORS;

/**
 * Parser for FEEL expressions.
 * Converts tokens into an {@link AstNode} tree using recursive descent parsing.
 * <p>
 * Grammar (lowest precedence first):
 * <pre>
 * expression  := conditional
 * conditional := 'if' or 'then' conditional 'else' conditional | or
 * or          := and ('or' and)*
 * and         := comparison ('and' comparison)*
 * comparison  := additive (('&lt;'|'&gt;'|'&lt;='|'&gt;='|'='|'=='|'!=') additive)*
 * additive    := multiplicative (('+'|'-') multiplicative)*
 * multiplicative := power (('*'|'/') power)*
 * power       := primary ('**' power)?
 * primary     := NUMBER | STRING | 'true' | 'false' | 'null'
 *              | IDENT '(' arguments? ')' | 'not' '(' arguments ')'
 *              | IDENT ('.' IDENT)*
 *              | '(' expression ')' ('.' IDENT)*
 *              | '[' (expression (',' expression)* ','?)? ']'
 *              | '-' primary
 * arguments   := argument (',' argument)*
 * argument    := (IDENT ':')? expression
 * </pre>
 * Binary levels are left-associative except {@code **}.
 */
public final class FeelParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public FeelParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root node
     * @throws FeelSyntaxException if the stream is empty, a grammar rule is violated,
     *                             or tokens remain after the expression
     */
    public AstNode parse() {
        if (tokens.isEmpty() || isAtEnd()) {
            throw error("Empty expression");
        }
        AstNode result = parseExpression();
        if (!isAtEnd()) {
            throw error("Unexpected token after expression: '" + peek().text() + "'");
        }
        return result;
    }

    private AstNode parseExpression() {
        return parseConditional();
    }

    private AstNode parseConditional() {
        if (matchKeyword("if")) {
            AstNode condition = parseOr();
            expectKeyword("then", "Expected 'then' after if condition");
            AstNode thenBranch = parseConditional();
            expectKeyword("else", "Expected 'else' after then expression");
            AstNode elseBranch = parseConditional();
            return new Conditional(condition, thenBranch, elseBranch);
        }
        return parseOr();
    }

    private AstNode parseOr() {
        AstNode left = parseAnd();
        while (matchKeyword("or")) {
            left = new BinaryOp(BinaryOperator.OR, left, parseAnd());
        }
        return left;
    }

    private AstNode parseAnd() {
        AstNode left = parseComparison();
        while (matchKeyword("and")) {
            left = new BinaryOp(BinaryOperator.AND, left, parseComparison());
        }
        return left;
    }

    private AstNode parseComparison() {
        AstNode left = parseAdditive();
        while (check(TokenType.OPERATOR) && isComparison(peek().text())) {
            BinaryOperator operator = toOperator(advance());
            left = new BinaryOp(operator, left, parseAdditive());
        }
        return left;
    }

    private AstNode parseAdditive() {
        AstNode left = parseMultiplicative();
        while (checkOperator("+") || checkOperator("-")) {
            BinaryOperator operator = toOperator(advance());
            left = new BinaryOp(operator, left, parseMultiplicative());
        }
        return left;
    }

    private AstNode parseMultiplicative() {
        AstNode left = parsePower();
        while (checkOperator("*") || checkOperator("/")) {
            BinaryOperator operator = toOperator(advance());
            left = new BinaryOp(operator, left, parsePower());
        }
        return left;
    }

    private AstNode parsePower() {
        AstNode left = parsePrimary();
        if (checkOperator("**")) {
            advance();
            // right-associative
            return new BinaryOp(BinaryOperator.POWER, left, parsePower());
        }
        return left;
    }

    private AstNode parsePrimary() {
        if (match(TokenType.NUMBER)) {
            return new LiteralNumber((Double) previous().literal());
        }
        if (match(TokenType.STRING)) {
            return new LiteralString((String) previous().literal());
        }
        if (check(TokenType.KEYWORD)) {
            return parseKeyword();
        }
        if (match(TokenType.IDENTIFIER)) {
            String name = previous().text();
            if (check(TokenType.LPAREN)) {
                return parseFunctionCall(name);
            }
            return parsePropertyChain(new Variable(name));
        }
        if (match(TokenType.LPAREN)) {
            AstNode inner = parseExpression();
            consume(TokenType.RPAREN, "Expected ')' after expression");
            return parsePropertyChain(inner);
        }
        if (match(TokenType.LBRACKET)) {
            return parseList();
        }
        if (checkOperator("-")) {
            advance();
            return new UnaryOp(UnaryOperator.NEGATE, parsePrimary());
        }
        throw error("Unexpected token '" + peek().text() + "'");
    }

    private AstNode parseKeyword() {
        Token keyword = peek();
        switch (keyword.text()) {
            case "true" -> {
                advance();
                return new LiteralBoolean(true);
            }
            case "false" -> {
                advance();
                return new LiteralBoolean(false);
            }
            case "null" -> {
                advance();
                return new LiteralNull();
            }
            case "not" -> {
                if (peekNext().type() == TokenType.LPAREN) {
                    advance();
                    return parseFunctionCall("not");
                }
                throw error("Expected '(' after 'not'");
            }
            default -> throw error("Unexpected keyword '" + keyword.text() + "'");
        }
    }

    private AstNode parseFunctionCall(String name) {
        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<FunctionParameter> parameters = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            parameters = parseArguments(name);
        }
        consume(TokenType.RPAREN, "Expected ')' after function arguments");
        return new FunctionCall(name, parameters);
    }

    private List<FunctionParameter> parseArguments(String functionName) {
        List<FunctionParameter> parameters = new ArrayList<>();
        boolean named = false;
        boolean positional = false;

        do {
            String parameterName = null;
            // IDENT ':' marks a named argument; otherwise rewind
            if (check(TokenType.IDENTIFIER) && peekNext().type() == TokenType.COLON) {
                parameterName = advance().text();
                advance();
            }

            if (parameterName != null) {
                named = true;
            } else {
                positional = true;
            }
            if (named && positional) {
                throw error("Cannot mix named and positional parameters in function call '" + functionName + "'");
            }

            parameters.add(new FunctionParameter(parameterName, parseExpression()));
        } while (match(TokenType.COMMA));

        return parameters;
    }

    private AstNode parsePropertyChain(AstNode target) {
        AstNode node = target;
        while (match(TokenType.DOT)) {
            Token property = consume(TokenType.IDENTIFIER, "Expected property name after '.'");
            node = new PropertyAccess(node, property.text());
        }
        return node;
    }

    private AstNode parseList() {
        List<AstNode> elements = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            elements.add(parseExpression());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RBRACKET, "Expected ']' after list elements");
        return new LiteralList(elements);
    }

    private BinaryOperator toOperator(Token token) {
        return BinaryOperator.fromSymbol(token.text())
                .orElseThrow(() -> new FeelSyntaxException(
                        "Unknown operator '" + token.text() + "'", token.position(), input));
    }

    private boolean isComparison(String symbol) {
        return COMPARISON_OPERATORS.contains(symbol) || "==".equals(symbol);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private void expectKeyword(String keyword, String message) {
        if (!matchKeyword(keyword)) {
            throw error(message);
        }
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkOperator(String symbol) {
        return peek().isOperator(symbol);
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_INPUT;
    }

    private Token peek() {
        if (index >= tokens.size()) {
            return tokens.isEmpty()
                    ? new Token(TokenType.END_OF_INPUT, "", null, 0)
                    : tokens.get(tokens.size() - 1);
        }
        return tokens.get(index);
    }

    private Token peekNext() {
        if (index + 1 >= tokens.size()) {
            return peek();
        }
        return tokens.get(index + 1);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private FeelSyntaxException error(String message) {
        return new FeelSyntaxException(message, peek().position(), input);
    }
}
