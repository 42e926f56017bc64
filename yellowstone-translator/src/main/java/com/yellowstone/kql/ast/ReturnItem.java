package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;

/**
 * One item of a RETURN clause: an expression with optional alias, or the
 * {@code *} wildcard.
 *
 * @param expression returned expression, null for the wildcard
 * @param alias alias from {@code AS}, may be null
 * @param wildcard whether this is {@code *}
 */
public record ReturnItem(Expression expression, String alias,
        boolean wildcard) implements AstNode {

    public ReturnItem {
        if (wildcard && (expression != null || alias != null)) {
            throw new IllegalArgumentException(
                "A wildcard item has no expression or alias");
        }
        if (!wildcard && expression == null) {
            throw new IllegalArgumentException(
                "A return item needs an expression");
        }
    }

    /**
     * Create an item for an expression.
     *
     * @param expression the expression
     * @param alias alias, may be null
     * @return the item
     */
    public static ReturnItem of(final Expression expression,
            final String alias) {
        return new ReturnItem(expression, alias, false);
    }

    /**
     * Create the wildcard item.
     *
     * @return the item
     */
    public static ReturnItem all() {
        return new ReturnItem(null, null, true);
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitReturnItem(this);
    }
}
