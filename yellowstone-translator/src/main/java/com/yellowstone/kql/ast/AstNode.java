package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;

/**
 * Root of the closed syntax tree produced by the parser.
 *
 * <p>Every node is an immutable record that validates its invariants in its
 * canonical constructor, so a tree that exists is structurally well-formed.
 * Traversal goes through {@link AstVisitor}.</p>
 */
public sealed interface AstNode permits Query, MatchClause, PathExpression,
        NodePattern, RelationshipPattern, WhereClause, ReturnClause,
        ReturnItem, OrderItem, Expression {

    /**
     * Dispatch to the visitor method for this node type.
     *
     * @param visitor the visitor
     * @param <R> visitor result type
     * @return the visitor's result
     */
    <R> R accept(AstVisitor<R> visitor);
}
