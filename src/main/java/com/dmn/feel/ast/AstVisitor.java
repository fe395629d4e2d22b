package com.dmn.feel.ast;

/**
 * Visitor over {@link AstNode} kinds, one method per node record.
 *
 * @param <R> Result type
 * @param <C> Context type passed explicitly through the walk
 */
public interface AstVisitor<R, C> {

    R visitNumber(LiteralNumber node, C context);

    R visitString(LiteralString node, C context);

    R visitBoolean(LiteralBoolean node, C context);

    R visitNull(LiteralNull node, C context);

    R visitList(LiteralList node, C context);

    R visitVariable(Variable node, C context);

    R visitBinary(BinaryOp node, C context);

    R visitUnary(UnaryOp node, C context);

    R visitFunctionCall(FunctionCall node, C context);

    R visitPropertyAccess(PropertyAccess node, C context);

    R visitConditional(Conditional node, C context);
}
