package com.yellowstone.kql.translate;

import com.yellowstone.kql.ast.CypherText;
import com.yellowstone.kql.ast.LiteralValue;
import com.yellowstone.kql.ast.MatchClause;
import com.yellowstone.kql.ast.NodePattern;
import com.yellowstone.kql.ast.PathExpression;
import com.yellowstone.kql.ast.PathFunction;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.error.EscalationRequiredException;
import com.yellowstone.kql.error.UnsupportedPatternException;
import com.yellowstone.kql.paths.ShortestPathTranslator;
import com.yellowstone.kql.paths.VariableLengthPathTranslator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translates MATCH clauses into graph operator stages.
 *
 * <p>Plain patterns of one clause become a single
 * {@code graph-match} stage ({@code graph-match(optional)} for OPTIONAL
 * MATCH). Each shortestPath or allShortestPaths pattern becomes its own
 * {@code graph-shortest-paths} stage. Property maps of required clauses
 * become equality filters, returned separately so they can be merged ahead
 * of the WHERE condition.</p>
 *
 * <pre>{@code
 * MATCH (u:User {name: 'alice'})-[:LOGGED_IN]->(d:Device)
 *
 * graph-match (u:IdentityInfo)-[:SigninLogs]->(d:DeviceInfo)
 * filters: u.AccountName == 'alice'
 * }</pre>
 *
 * <p>Property maps of an OPTIONAL MATCH constrain only the optional part,
 * so they stay inside its stage. A row whose optional part does not match
 * is kept with null columns:</p>
 *
 * <pre>{@code
 * OPTIONAL MATCH (u)-[:LOGGED_IN]->(d:Device {os: 'linux'})
 *
 * graph-match(optional) (u)-[:SigninLogs]->(d:DeviceInfo) where d.OSPlatform == 'linux'
 * }</pre>
 */
public final class MatchTranslator {

    /**
     * Result of translating the MATCH clauses of a query.
     *
     * @param stages operator stages in order
     * @param filters equality predicates from property maps of required
     *        clauses
     * @param enumeratesPaths whether a stage enumerates all shortest paths
     */
    public record MatchTranslation(List<String> stages, List<String> filters,
            boolean enumeratesPaths) {

        public MatchTranslation {
            stages = List.copyOf(stages);
            filters = List.copyOf(filters);
        }
    }

    private MatchTranslator() {
        throw new AssertionError("No instances");
    }

    /**
     * Translate MATCH clauses.
     *
     * @param clauses the clauses in source order
     * @param context the resolved query context
     * @return stages and filters
     * @throws UnsupportedPatternException if a pattern cannot be rendered
     * @throws EscalationRequiredException if a pattern needs assisted
     *         translation
     */
    public static MatchTranslation translate(final List<MatchClause> clauses,
            final TranslationContext context)
            throws UnsupportedPatternException, EscalationRequiredException {
        List<String> stages = new ArrayList<>();
        List<String> filters = new ArrayList<>();
        boolean enumeratesPaths = false;
        for (MatchClause clause : clauses) {
            List<String> patterns = new ArrayList<>();
            List<String> clauseFilters = new ArrayList<>();
            for (PathExpression path : clause.paths()) {
                if (path.function() == PathFunction.NONE) {
                    patterns.add(renderPath(path, context));
                } else {
                    if (clause.optional()) {
                        throw new UnsupportedPatternException(
                            path.function().cypherName()
                                + " inside OPTIONAL MATCH is not supported",
                            UnsupportedPatternException.OPTIONAL_PATH_FUNCTION,
                            CypherText.of(path),
                            path.nodes().get(0).position());
                    }
                    stages.add(ShortestPathTranslator.fromMatch(path,
                        context));
                    enumeratesPaths |= path.function()
                        == PathFunction.ALL_SHORTEST_PATHS;
                }
                clauseFilters.addAll(propertyFilters(path, context));
            }
            if (!clause.optional()) {
                filters.addAll(clauseFilters);
                if (!patterns.isEmpty()) {
                    stages.add("graph-match " + String.join(", ", patterns));
                }
            } else if (!patterns.isEmpty()) {
                String stage = "graph-match(optional) "
                    + String.join(", ", patterns);
                if (!clauseFilters.isEmpty()) {
                    stage += " where " + String.join(" and ", clauseFilters);
                }
                stages.add(stage);
            }
        }
        return new MatchTranslation(stages, filters, enumeratesPaths);
    }

    /**
     * Render a plain path: {@code p=(a:T)-[r:E*1..3]->(b:T)}.
     *
     * @param path the path
     * @param context the resolved query context
     * @return KQL text
     * @throws UnsupportedPatternException if a repetition cannot be rendered
     * @throws EscalationRequiredException if a repetition needs assisted
     *         translation
     */
    public static String renderPath(final PathExpression path,
            final TranslationContext context)
            throws UnsupportedPatternException, EscalationRequiredException {
        StringBuilder sb = new StringBuilder();
        if (path.pathVariable() != null) {
            sb.append(path.pathVariable()).append('=');
        }
        sb.append(PatternRenderer.node(path.nodes().get(0), context));
        for (int i = 0; i < path.relationships().size(); i++) {
            RelationshipPattern rel = path.relationships().get(i);
            String length = VariableLengthPathTranslator.render(rel,
                context.getConfig());
            sb.append(PatternRenderer.relationship(rel, length, context));
            sb.append(PatternRenderer.node(path.nodes().get(i + 1), context));
        }
        return sb.toString();
    }

    /**
     * Equality predicates for the property maps of a path.
     *
     * @param path the path
     * @param context the resolved query context
     * @return predicates in source order
     * @throws UnsupportedPatternException if a variable-length relationship
     *         carries a property map
     */
    public static List<String> propertyFilters(final PathExpression path,
            final TranslationContext context)
            throws UnsupportedPatternException {
        List<String> filters = new ArrayList<>();
        for (int i = 0; i < path.nodes().size(); i++) {
            NodePattern node = path.nodes().get(i);
            addFilters(context.variableOf(node), node.properties(), context,
                filters);
            if (i < path.relationships().size()) {
                RelationshipPattern rel = path.relationships().get(i);
                if (rel.isVariableLength() && !rel.properties().isEmpty()) {
                    throw new UnsupportedPatternException(
                        "Property maps on variable-length relationships are"
                            + " not supported",
                        UnsupportedPatternException.VARIABLE_PATH_PROPERTIES,
                        CypherText.of(rel), rel.position());
                }
                addFilters(context.variableOf(rel), rel.properties(), context,
                    filters);
            }
        }
        return filters;
    }

    private static void addFilters(final String variable,
            final Map<String, LiteralValue> properties,
            final TranslationContext context, final List<String> filters) {
        properties.forEach((property, value) -> filters.add(variable + "."
            + context.physicalProperty(variable, property) + " == "
            + KqlLiterals.render(value)));
    }
}
