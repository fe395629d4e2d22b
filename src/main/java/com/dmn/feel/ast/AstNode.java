package com.dmn.feel.ast;

/**
 * Node of a parsed FEEL expression.
 * <p>
 * Trees are immutable once built: every node owns its children exclusively, so a parsed
 * expression can be cached and evaluated concurrently.
 */
public sealed interface AstNode
        permits LiteralNumber, LiteralString, LiteralBoolean, LiteralNull, LiteralList,
                Variable, BinaryOp, UnaryOp, FunctionCall, PropertyAccess, Conditional {

    /**
     * Dispatches to the visitor method for this node kind.
     *
     * @param visitor The visitor
     * @param context Caller state threaded through the walk
     * @param <R>     Result type
     * @param <C>     Context type
     * @return The visitor's result
     */
    <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
