package com.yellowstone.kql.visitor;

import com.yellowstone.kql.ast.AstNode;
import com.yellowstone.kql.ast.Comparison;
import com.yellowstone.kql.ast.FunctionCall;
import com.yellowstone.kql.ast.NullCheck;
import com.yellowstone.kql.ast.PathExpression;
import com.yellowstone.kql.ast.PathFunction;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.ast.WhereClause;

/**
 * Summarizes the shape of a query: hop count, variable-length and
 * aggregation use, condition count and an overall complexity rating.
 *
 * <p>Score: two points per hop (at most 6), three for any variable-length
 * relationship, one per WHERE condition (at most 4) and two for aggregation.
 * A score of 8 or more is {@link Complexity#HIGH}, 4 or more
 * {@link Complexity#MEDIUM}.</p>
 */
public final class QueryComplexityAnalyzer extends DefaultAstVisitor<Void> {

    /** Coarse complexity rating. */
    public enum Complexity {
        LOW,
        MEDIUM,
        HIGH
    }

    /**
     * Result of the analysis.
     *
     * @param hops number of relationship patterns
     * @param variableLength whether any relationship repeats
     * @param pathFunctions number of shortestPath/allShortestPaths uses
     * @param conditions number of comparisons and null checks in WHERE
     * @param aggregation whether RETURN aggregates
     * @param score the numeric score
     * @param complexity the rating
     */
    public record QuerySummary(int hops, boolean variableLength,
            int pathFunctions, int conditions, boolean aggregation, int score,
            Complexity complexity) {
    }

    private static final int MAX_HOP_POINTS = 6;
    private static final int VARIABLE_LENGTH_POINTS = 3;
    private static final int MAX_CONDITION_POINTS = 4;
    private static final int AGGREGATION_POINTS = 2;
    private static final int HIGH_THRESHOLD = 8;
    private static final int MEDIUM_THRESHOLD = 4;

    private int hops;
    private boolean variableLength;
    private int pathFunctions;
    private int conditions;
    private boolean aggregation;
    private boolean inWhere;

    private QueryComplexityAnalyzer() {
    }

    /**
     * Analyze a query or any subtree of one.
     *
     * @param node the root, usually a query
     * @return the summary
     */
    public static QuerySummary analyze(final AstNode node) {
        QueryComplexityAnalyzer analyzer = new QueryComplexityAnalyzer();
        node.accept(analyzer);
        return analyzer.summary();
    }

    private QuerySummary summary() {
        int score = Math.min(hops * 2, MAX_HOP_POINTS)
            + (variableLength ? VARIABLE_LENGTH_POINTS : 0)
            + Math.min(conditions, MAX_CONDITION_POINTS)
            + (aggregation ? AGGREGATION_POINTS : 0);
        Complexity complexity = score >= HIGH_THRESHOLD ? Complexity.HIGH
            : score >= MEDIUM_THRESHOLD ? Complexity.MEDIUM : Complexity.LOW;
        return new QuerySummary(hops, variableLength, pathFunctions,
            conditions, aggregation, score, complexity);
    }

    @Override
    public Void visitPathExpression(final PathExpression path) {
        if (path.function() != PathFunction.NONE) {
            pathFunctions++;
        }
        return super.visitPathExpression(path);
    }

    @Override
    public Void visitRelationshipPattern(final RelationshipPattern rel) {
        hops++;
        if (rel.isVariableLength()) {
            variableLength = true;
        }
        return null;
    }

    @Override
    public Void visitWhereClause(final WhereClause clause) {
        inWhere = true;
        super.visitWhereClause(clause);
        inWhere = false;
        return null;
    }

    @Override
    public Void visitComparison(final Comparison comparison) {
        if (inWhere) {
            conditions++;
        }
        return super.visitComparison(comparison);
    }

    @Override
    public Void visitNullCheck(final NullCheck check) {
        if (inWhere) {
            conditions++;
        }
        return super.visitNullCheck(check);
    }

    @Override
    public Void visitFunctionCall(final FunctionCall call) {
        if (!inWhere && call.isAggregate()) {
            aggregation = true;
        }
        return super.visitFunctionCall(call);
    }
}
