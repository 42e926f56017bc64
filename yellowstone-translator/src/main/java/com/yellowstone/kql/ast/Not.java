package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Objects;

/**
 * Logical negation.
 *
 * @param operand the negated expression
 */
public record Not(Expression operand) implements Expression {

    public Not {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitNot(this);
    }
}
