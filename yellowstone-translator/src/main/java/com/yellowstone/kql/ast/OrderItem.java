package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Objects;

/**
 * One ORDER BY key.
 *
 * @param expression sort key
 * @param direction sort direction
 */
public record OrderItem(Expression expression, SortDirection direction)
        implements AstNode {

    public OrderItem {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(direction, "direction");
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitOrderItem(this);
    }
}
