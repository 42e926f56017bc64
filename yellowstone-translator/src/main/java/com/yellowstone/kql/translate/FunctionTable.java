package com.yellowstone.kql.translate;

import com.yellowstone.kql.ast.FunctionCall;
import com.yellowstone.kql.error.UnsupportedPatternException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Mapping of Cypher functions to KQL functions.
 *
 * <p>Scalar functions render either as calls ({@code toupper(x)}) or as
 * infix operators ({@code a contains b}). Names are matched ignoring case.
 * A name missing from the table is an error, never passed through.</p>
 */
public final class FunctionTable {

    /** How a scalar function renders. */
    public enum Style {
        /** {@code name(arg, ...)}. */
        CALL,
        /** {@code left name right}. */
        INFIX
    }

    /**
     * A mapped scalar function.
     *
     * @param kqlName target function or operator name
     * @param style rendering style
     * @param minArgs minimum argument count
     * @param maxArgs maximum argument count
     */
    public record ScalarFunction(String kqlName, Style style, int minArgs,
            int maxArgs) {
    }

    /** Aggregates and their KQL forms. */
    public enum Aggregate {
        COUNT,
        SUM,
        AVG,
        MIN,
        MAX,
        COLLECT
    }

    private static final int VARARGS = Integer.MAX_VALUE;

    private static final Map<String, ScalarFunction> SCALARS = Map.ofEntries(
        Map.entry("size", call("array_length", 1, 1)),
        Map.entry("length", call("array_length", 1, 1)),
        Map.entry("toupper", call("toupper", 1, 1)),
        Map.entry("upper", call("toupper", 1, 1)),
        Map.entry("tolower", call("tolower", 1, 1)),
        Map.entry("lower", call("tolower", 1, 1)),
        Map.entry("trim", call("trim", 1, 1)),
        Map.entry("substring", call("substring", 2, 3)),
        Map.entry("tostring", call("tostring", 1, 1)),
        Map.entry("tointeger", call("toint", 1, 1)),
        Map.entry("tofloat", call("todouble", 1, 1)),
        Map.entry("contains", infix("contains")),
        Map.entry("startswith", infix("startswith")),
        Map.entry("endswith", infix("endswith")),
        Map.entry("coalesce", call("coalesce", 1, VARARGS)),
        Map.entry("abs", call("abs", 1, 1)));

    private FunctionTable() {
        throw new AssertionError("No instances");
    }

    private static ScalarFunction call(final String name, final int min,
            final int max) {
        return new ScalarFunction(name, Style.CALL, min, max);
    }

    private static ScalarFunction infix(final String name) {
        return new ScalarFunction(name, Style.INFIX, 2, 2);
    }

    /**
     * Look up a scalar function and check its arity.
     *
     * @param call the call
     * @return the mapping
     * @throws UnsupportedPatternException if the function is unmapped or the
     *         argument count is wrong
     */
    public static ScalarFunction scalar(final FunctionCall call)
            throws UnsupportedPatternException {
        ScalarFunction function = SCALARS.get(
            call.name().toLowerCase(Locale.ROOT));
        if (function == null) {
            throw new UnsupportedPatternException("Function " + call.name()
                + "() has no KQL equivalent; supported: "
                + String.join(", ", new TreeSet<>(SCALARS.keySet())),
                UnsupportedPatternException.UNMAPPED_FUNCTION, call.name(),
                call.position());
        }
        if (call.star() || call.distinct()) {
            throw new UnsupportedPatternException("Function " + call.name()
                + "() does not accept " + (call.star() ? "*" : "DISTINCT"),
                UnsupportedPatternException.FUNCTION_ARITY, call.name(),
                call.position());
        }
        int count = call.arguments().size();
        if (count < function.minArgs() || count > function.maxArgs()) {
            throw new UnsupportedPatternException("Function " + call.name()
                + "() called with " + count + " arguments",
                UnsupportedPatternException.FUNCTION_ARITY, call.name(),
                call.position());
        }
        return function;
    }

    /**
     * Render a scalar function over already rendered arguments.
     *
     * @param function the mapping
     * @param arguments rendered arguments
     * @return KQL text
     */
    public static String renderScalar(final ScalarFunction function,
            final List<String> arguments) {
        if (function.style() == Style.INFIX) {
            return arguments.get(0) + " " + function.kqlName() + " "
                + arguments.get(1);
        }
        return function.kqlName() + "(" + String.join(", ", arguments) + ")";
    }

    /**
     * Identify an aggregate function.
     *
     * @param call the call
     * @return the aggregate
     * @throws UnsupportedPatternException if the call is not an aggregate or
     *         its arguments do not fit
     */
    public static Aggregate aggregate(final FunctionCall call)
            throws UnsupportedPatternException {
        Aggregate aggregate;
        try {
            aggregate = Aggregate.valueOf(call.name().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedPatternException("Aggregate " + call.name()
                + "() has no KQL equivalent",
                UnsupportedPatternException.UNMAPPED_FUNCTION, call.name(),
                call.position());
        }
        if (call.star() && aggregate != Aggregate.COUNT) {
            throw new UnsupportedPatternException(call.name()
                + "(*) is not supported",
                UnsupportedPatternException.FUNCTION_ARITY, call.name(),
                call.position());
        }
        if (!call.star() && call.arguments().size() != 1) {
            throw new UnsupportedPatternException(call.name()
                + "() takes exactly one argument",
                UnsupportedPatternException.FUNCTION_ARITY, call.name(),
                call.position());
        }
        if (call.distinct() && aggregate != Aggregate.COUNT
                && aggregate != Aggregate.COLLECT) {
            throw new UnsupportedPatternException(call.name()
                + "(DISTINCT ...) has no KQL equivalent",
                UnsupportedPatternException.UNMAPPED_FUNCTION, call.name(),
                call.position());
        }
        return aggregate;
    }

    /**
     * Render an aggregate.
     *
     * @param aggregate the aggregate
     * @param call the original call, for its distinct and star flags
     * @param argument rendered argument, null for {@code count(*)}
     * @param argumentIsNode whether the argument is a node variable, which
     *        is never null inside a match
     * @return KQL text
     */
    public static String renderAggregate(final Aggregate aggregate,
            final FunctionCall call, final String argument,
            final boolean argumentIsNode) {
        return switch (aggregate) {
            case COUNT -> {
                if (call.star()) {
                    yield "count()";
                }
                if (call.distinct()) {
                    yield "dcount(" + argument + ")";
                }
                yield argumentIsNode ? "count()"
                    : "countif(isnotnull(" + argument + "))";
            }
            case SUM -> "sum(" + argument + ")";
            case AVG -> "avg(" + argument + ")";
            case MIN -> "min(" + argument + ")";
            case MAX -> "max(" + argument + ")";
            case COLLECT -> (call.distinct() ? "make_set(" : "make_list(")
                + argument + ")";
        };
    }
}
