package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Objects;

/**
 * {@code IS NULL} or {@code IS NOT NULL}.
 *
 * @param operand tested expression
 * @param negated true for IS NOT NULL
 */
public record NullCheck(Expression operand, boolean negated)
        implements Expression {

    public NullCheck {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitNullCheck(this);
    }
}
