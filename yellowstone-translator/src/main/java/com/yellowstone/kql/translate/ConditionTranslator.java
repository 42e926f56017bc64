package com.yellowstone.kql.translate;

import com.yellowstone.kql.ast.And;
import com.yellowstone.kql.ast.Comparison;
import com.yellowstone.kql.ast.Expression;
import com.yellowstone.kql.ast.FunctionCall;
import com.yellowstone.kql.ast.Literal;
import com.yellowstone.kql.ast.Not;
import com.yellowstone.kql.ast.NullCheck;
import com.yellowstone.kql.ast.Or;
import com.yellowstone.kql.ast.PropertyAccess;
import com.yellowstone.kql.ast.VariableRef;
import com.yellowstone.kql.error.UnsupportedPatternException;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates condition and scalar expressions to KQL.
 *
 * <h2>Operators:</h2>
 * <pre>{@code
 * =  -> ==      <>, != -> !=     < > <= >= unchanged
 * AND -> and    OR -> or         NOT x -> not(x)
 * CONTAINS -> contains   STARTS WITH -> startswith   ENDS WITH -> endswith
 * x IS NULL -> isnull(x)          x IS NOT NULL -> isnotnull(x)
 * }</pre>
 *
 * <p>Parentheses are emitted only where KQL precedence differs from the tree
 * shape. Aggregates are rejected; {@link ProjectionTranslator} handles them
 * at the top of RETURN items.</p>
 */
public final class ConditionTranslator {

    private static final int OR = 1;
    private static final int AND = 2;
    private static final int COMPARISON = 4;
    private static final int ATOM = 5;

    private ConditionTranslator() {
        throw new AssertionError("No instances");
    }

    /**
     * Translate an expression.
     *
     * @param expression the expression
     * @param context the resolved query context
     * @return KQL text
     * @throws UnsupportedPatternException if a function is unmapped or an
     *         aggregate appears
     */
    public static String translate(final Expression expression,
            final TranslationContext context)
            throws UnsupportedPatternException {
        return render(expression, 0, context);
    }

    private static String render(final Expression expression,
            final int minPrecedence, final TranslationContext context)
            throws UnsupportedPatternException {
        String text;
        int precedence;
        if (expression instanceof Or or) {
            text = render(or.left(), OR, context) + " or "
                + render(or.right(), OR, context);
            precedence = OR;
        } else if (expression instanceof And and) {
            text = render(and.left(), AND, context) + " and "
                + render(and.right(), AND, context);
            precedence = AND;
        } else if (expression instanceof Not not) {
            text = "not(" + render(not.operand(), 0, context) + ")";
            precedence = ATOM;
        } else if (expression instanceof NullCheck check) {
            text = (check.negated() ? "isnotnull(" : "isnull(")
                + render(check.operand(), 0, context) + ")";
            precedence = ATOM;
        } else if (expression instanceof Comparison comparison) {
            text = render(comparison.left(), ATOM, context) + " "
                + operator(comparison) + " "
                + render(comparison.right(), ATOM, context);
            precedence = COMPARISON;
        } else if (expression instanceof FunctionCall call) {
            return renderFunction(call, minPrecedence, context);
        } else if (expression instanceof PropertyAccess access) {
            text = access.variable() + "."
                + context.physicalProperty(access.variable(),
                    access.property());
            precedence = ATOM;
        } else if (expression instanceof VariableRef ref) {
            text = ref.name();
            precedence = ATOM;
        } else if (expression instanceof Literal literal) {
            text = KqlLiterals.render(literal.value());
            precedence = ATOM;
        } else {
            throw new IllegalArgumentException("Unknown expression "
                + expression);
        }
        return precedence < minPrecedence ? "(" + text + ")" : text;
    }

    private static String renderFunction(final FunctionCall call,
            final int minPrecedence, final TranslationContext context)
            throws UnsupportedPatternException {
        if (call.isAggregate()) {
            throw new UnsupportedPatternException("Aggregate " + call.name()
                + "() may only appear at the top of a RETURN item",
                UnsupportedPatternException.MISPLACED_AGGREGATE, call.name(),
                call.position());
        }
        FunctionTable.ScalarFunction function = FunctionTable.scalar(call);
        boolean infix = function.style() == FunctionTable.Style.INFIX;
        List<String> arguments = new ArrayList<>();
        for (Expression argument : call.arguments()) {
            arguments.add(render(argument, infix ? ATOM : 0, context));
        }
        String text = FunctionTable.renderScalar(function, arguments);
        return infix && COMPARISON < minPrecedence ? "(" + text + ")" : text;
    }

    private static String operator(final Comparison comparison) {
        return switch (comparison.operator()) {
            case EQUALS -> "==";
            case NOT_EQUALS -> "!=";
            case LESS_THAN -> "<";
            case GREATER_THAN -> ">";
            case LESS_THAN_OR_EQUAL -> "<=";
            case GREATER_THAN_OR_EQUAL -> ">=";
            case CONTAINS -> "contains";
            case STARTS_WITH -> "startswith";
            case ENDS_WITH -> "endswith";
        };
    }
}
