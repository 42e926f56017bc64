package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A scalar or aggregate function call.
 *
 * @param name function name as written
 * @param distinct whether {@code DISTINCT} preceded the arguments
 * @param star whether the sole argument is {@code *}
 * @param arguments arguments in order, empty when {@code star} is set
 * @param position offset of the function name
 */
public record FunctionCall(String name, boolean distinct, boolean star,
        List<Expression> arguments, int position) implements Expression {

    private static final Set<String> AGGREGATES =
        Set.of("count", "sum", "avg", "min", "max", "collect");

    public FunctionCall {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(arguments, "arguments");
        if (star && !arguments.isEmpty()) {
            throw new IllegalArgumentException(
                name + "(*) takes no further arguments");
        }
        arguments = List.copyOf(arguments);
    }

    /**
     * Whether this call is one of the aggregate functions.
     *
     * @return true for count, sum, avg, min, max and collect
     */
    public boolean isAggregate() {
        return AGGREGATES.contains(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
