package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Objects;

/**
 * Logical disjunction.
 *
 * @param left left operand
 * @param right right operand
 */
public record Or(Expression left, Expression right) implements Expression {

    public Or {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
