package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Objects;

/**
 * A literal in a condition or projection.
 *
 * @param value the value
 */
public record Literal(LiteralValue value) implements Expression {

    public Literal {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
