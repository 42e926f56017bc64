package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.List;
import java.util.Objects;

/**
 * The RETURN clause with its ordering and paging modifiers.
 *
 * @param items returned items, never empty
 * @param distinct whether RETURN DISTINCT was used
 * @param orderBy ORDER BY items, possibly empty
 * @param limit LIMIT value, may be null
 * @param skip SKIP value, may be null
 */
public record ReturnClause(List<ReturnItem> items, boolean distinct,
        List<OrderItem> orderBy, Long limit, Long skip) implements AstNode {

    public ReturnClause {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(orderBy, "orderBy");
        if (items.isEmpty()) {
            throw new IllegalArgumentException(
                "RETURN needs at least one item");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("LIMIT must be non-negative");
        }
        if (skip != null && skip < 0) {
            throw new IllegalArgumentException("SKIP must be non-negative");
        }
        items = List.copyOf(items);
        orderBy = List.copyOf(orderBy);
    }

    /**
     * Create a plain RETURN of the given items.
     *
     * @param items the items
     * @return the clause
     */
    public static ReturnClause of(final ReturnItem... items) {
        return new ReturnClause(List.of(items), false, List.of(), null, null);
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitReturnClause(this);
    }
}
