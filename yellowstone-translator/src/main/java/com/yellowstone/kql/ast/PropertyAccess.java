package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Objects;

/**
 * {@code variable.property}.
 *
 * @param variable the variable
 * @param property the logical property name
 * @param position offset of the variable
 */
public record PropertyAccess(String variable, String property, int position)
        implements Expression {

    public PropertyAccess {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(property, "property");
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitPropertyAccess(this);
    }
}
