package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Objects;

/**
 * A bare variable reference.
 *
 * @param name the variable
 * @param position offset of the reference
 */
public record VariableRef(String name, int position) implements Expression {

    public VariableRef {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitVariableRef(this);
    }
}
