package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Objects;

/**
 * A binary comparison.
 *
 * @param operator the operator
 * @param left left operand
 * @param right right operand
 */
public record Comparison(ComparisonOperator operator, Expression left,
        Expression right) implements Expression {

    public Comparison {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }
}
