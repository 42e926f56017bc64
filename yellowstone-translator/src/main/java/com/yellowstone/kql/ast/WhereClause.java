package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Objects;

/**
 * The WHERE clause.
 *
 * @param condition the filter condition
 */
public record WhereClause(Expression condition) implements AstNode {

    public WhereClause {
        Objects.requireNonNull(condition, "condition");
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitWhereClause(this);
    }
}
