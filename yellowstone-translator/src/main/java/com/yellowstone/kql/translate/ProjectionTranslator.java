package com.yellowstone.kql.translate;

import com.yellowstone.kql.ast.Expression;
import com.yellowstone.kql.ast.FunctionCall;
import com.yellowstone.kql.ast.OrderItem;
import com.yellowstone.kql.ast.PropertyAccess;
import com.yellowstone.kql.ast.ReturnClause;
import com.yellowstone.kql.ast.ReturnItem;
import com.yellowstone.kql.ast.SortDirection;
import com.yellowstone.kql.ast.VariableRef;
import com.yellowstone.kql.error.UnsupportedPatternException;
import com.yellowstone.kql.visitor.IdentifierCollector.VariableKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Translates RETURN with its modifiers into the trailing stages of the
 * query.
 *
 * <h2>Stage order:</h2>
 * <ol>
 *   <li>{@code sort by} over source expressions, only when an ORDER BY key
 *       is not projected</li>
 *   <li>{@code project} or {@code summarize ... by ...}, followed by
 *       {@code project-reorder} when grouping changed the column order</li>
 *   <li>{@code distinct *}</li>
 *   <li>{@code sort by} over projected columns</li>
 *   <li>{@code skip} then {@code take}, whatever order the query used</li>
 * </ol>
 */
public final class ProjectionTranslator {

    private static final String ASC = " asc";
    private static final String DESC = " desc";
    private static final int NO_POSITION = -1;

    /**
     * Result of translating a RETURN clause.
     *
     * @param stages stages in order
     * @param columns output column names in RETURN order
     * @param aggregating whether the projection groups rows
     */
    public record ProjectionTranslation(List<String> stages,
            List<String> columns, boolean aggregating) {

        public ProjectionTranslation {
            stages = List.copyOf(stages);
            columns = List.copyOf(columns);
        }
    }

    /** A rendered RETURN item. */
    private record Column(String name, String kql, boolean aggregate) {

        String assignment() {
            return name.equals(kql) ? name : name + " = " + kql;
        }
    }

    private ProjectionTranslator() {
        throw new AssertionError("No instances");
    }

    /**
     * Translate a RETURN clause.
     *
     * @param clause the clause
     * @param context the resolved query context
     * @return stages and column names
     * @throws UnsupportedPatternException if a function is unmapped, an
     *         aggregate is misplaced or an ORDER BY key cannot be sorted on
     */
    public static ProjectionTranslation translate(final ReturnClause clause,
            final TranslationContext context)
            throws UnsupportedPatternException {
        List<Column> columns = columns(clause, context);
        boolean aggregating = columns.stream().anyMatch(Column::aggregate);

        List<String> stages = new ArrayList<>();
        String postSort = null;
        if (!clause.orderBy().isEmpty()) {
            postSort = postSort(clause.orderBy(), columns, context);
            if (postSort == null) {
                if (aggregating || clause.distinct()) {
                    throw new UnsupportedPatternException("ORDER BY keys must"
                        + " be returned when RETURN aggregates or is DISTINCT",
                        UnsupportedPatternException.UNSUPPORTED_ORDER_KEY,
                        "ORDER BY", NO_POSITION);
                }
                stages.add(preSort(clause.orderBy(), columns, context));
            }
        }

        if (aggregating) {
            stages.addAll(summarize(columns));
        } else {
            List<String> assignments = new ArrayList<>();
            for (Column column : columns) {
                assignments.add(column.assignment());
            }
            stages.add("project " + String.join(", ", assignments));
        }
        if (clause.distinct()) {
            stages.add("distinct *");
        }
        if (postSort != null) {
            stages.add(postSort);
        }
        if (clause.skip() != null) {
            stages.add("skip " + clause.skip());
        }
        if (clause.limit() != null) {
            stages.add("take " + clause.limit());
        }
        List<String> names = new ArrayList<>();
        for (Column column : columns) {
            names.add(column.name());
        }
        return new ProjectionTranslation(stages, names, aggregating);
    }

    private static List<Column> columns(final ReturnClause clause,
            final TranslationContext context)
            throws UnsupportedPatternException {
        List<Column> columns = new ArrayList<>();
        Set<String> used = new HashSet<>();
        int index = 0;
        for (ReturnItem item : clause.items()) {
            if (item.wildcard()) {
                for (VariableBinding binding : context.getBindings().values()) {
                    if (!binding.generated()) {
                        columns.add(new Column(unique(binding.name(), used),
                            binding.name(), false));
                    }
                }
                continue;
            }
            index++;
            String name = item.alias() != null ? item.alias()
                : derivedName(item.expression(), index);
            columns.add(new Column(unique(name, used),
                render(item.expression(), context),
                isAggregate(item.expression())));
        }
        return columns;
    }

    private static List<String> summarize(final List<Column> columns) {
        List<String> aggregates = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        List<String> grouped = new ArrayList<>();
        List<String> ordered = new ArrayList<>();
        for (Column column : columns) {
            ordered.add(column.name());
            if (column.aggregate()) {
                aggregates.add(column.assignment());
            } else {
                keys.add(column.assignment());
                grouped.add(column.name());
            }
        }
        List<String> stages = new ArrayList<>();
        stages.add("summarize " + String.join(", ", aggregates)
            + (keys.isEmpty() ? "" : " by " + String.join(", ", keys)));
        List<String> produced = new ArrayList<>(grouped);
        for (Column column : columns) {
            if (column.aggregate()) {
                produced.add(column.name());
            }
        }
        if (!produced.equals(ordered)) {
            stages.add("project-reorder " + String.join(", ", ordered));
        }
        return stages;
    }

    /*
     * Every key must name a column, by alias or by the same rendered
     * expression. Returns null when one does not.
     */
    private static String postSort(final List<OrderItem> orderBy,
            final List<Column> columns, final TranslationContext context)
            throws UnsupportedPatternException {
        List<String> keys = new ArrayList<>();
        for (OrderItem item : orderBy) {
            Column column = projected(item.expression(), columns, context);
            if (column == null) {
                return null;
            }
            keys.add(column.name() + direction(item));
        }
        return "sort by " + String.join(", ", keys);
    }

    private static String preSort(final List<OrderItem> orderBy,
            final List<Column> columns, final TranslationContext context)
            throws UnsupportedPatternException {
        List<String> keys = new ArrayList<>();
        for (OrderItem item : orderBy) {
            String kql;
            Column alias = aliasColumn(item.expression(), columns);
            if (alias != null) {
                kql = alias.kql();
            } else if (isAggregate(item.expression())) {
                throw new UnsupportedPatternException("ORDER BY on an"
                    + " aggregate requires returning it",
                    UnsupportedPatternException.UNSUPPORTED_ORDER_KEY,
                    "ORDER BY", NO_POSITION);
            } else {
                kql = ConditionTranslator.translate(item.expression(),
                    context);
            }
            keys.add(kql + direction(item));
        }
        return "sort by " + String.join(", ", keys);
    }

    private static Column projected(final Expression expression,
            final List<Column> columns, final TranslationContext context)
            throws UnsupportedPatternException {
        Column alias = aliasColumn(expression, columns);
        if (alias != null) {
            return alias;
        }
        String kql = render(expression, context);
        for (Column column : columns) {
            if (column.kql().equals(kql)
                    && column.aggregate() == isAggregate(expression)) {
                return column;
            }
        }
        return null;
    }

    /*
     * A bare name that is a column refers to that column, even when a
     * MATCH variable has the same name.
     */
    private static Column aliasColumn(final Expression expression,
            final List<Column> columns) {
        if (expression instanceof VariableRef ref) {
            for (Column column : columns) {
                if (column.name().equals(ref.name())) {
                    return column;
                }
            }
        }
        return null;
    }

    private static String direction(final OrderItem item) {
        return item.direction() == SortDirection.DESC ? DESC : ASC;
    }

    private static boolean isAggregate(final Expression expression) {
        return expression instanceof FunctionCall call && call.isAggregate();
    }

    private static String render(final Expression expression,
            final TranslationContext context)
            throws UnsupportedPatternException {
        if (expression instanceof FunctionCall call && call.isAggregate()) {
            FunctionTable.Aggregate aggregate = FunctionTable.aggregate(call);
            if (call.star()) {
                return FunctionTable.renderAggregate(aggregate, call, null,
                    false);
            }
            Expression argument = call.arguments().get(0);
            boolean node = argument instanceof VariableRef ref
                && context.binding(ref.name()) != null
                && context.binding(ref.name()).kind() == VariableKind.NODE;
            return FunctionTable.renderAggregate(aggregate, call,
                ConditionTranslator.translate(argument, context), node);
        }
        return ConditionTranslator.translate(expression, context);
    }

    /**
     * Column name for an unaliased item: the variable, {@code var_prop} for
     * a property, {@code fn_arg} for a function and {@code ColumnN}
     * otherwise.
     *
     * @param expression the item expression
     * @param index one-based position among the RETURN items
     * @return the name
     */
    static String derivedName(final Expression expression, final int index) {
        if (expression instanceof VariableRef ref) {
            return ref.name();
        }
        if (expression instanceof PropertyAccess access) {
            return access.variable() + "_" + access.property();
        }
        if (expression instanceof FunctionCall call) {
            String name = call.name().toLowerCase(Locale.ROOT);
            if (call.star() || call.arguments().isEmpty()) {
                return name;
            }
            Expression first = call.arguments().get(0);
            if (first instanceof VariableRef || first instanceof PropertyAccess
                    || first instanceof FunctionCall) {
                return name + "_" + derivedName(first, index);
            }
            return name;
        }
        return "Column" + index;
    }

    private static String unique(final String name, final Set<String> used) {
        String candidate = name;
        int suffix = 2;
        while (!used.add(candidate)) {
            candidate = name + "_" + suffix++;
        }
        return candidate;
    }
}
