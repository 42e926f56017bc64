package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.List;
import java.util.Objects;

/**
 * A chain of alternating node and relationship patterns, optionally bound to
 * a path variable and optionally wrapped in a path function.
 *
 * @param pathVariable path variable ({@code p = ...}), may be null
 * @param function path function, {@link PathFunction#NONE} for a plain chain
 * @param nodes node patterns, one more than relationships
 * @param relationships relationship patterns between consecutive nodes
 */
public record PathExpression(String pathVariable, PathFunction function,
        List<NodePattern> nodes, List<RelationshipPattern> relationships)
        implements AstNode {

    public PathExpression {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(relationships, "relationships");
        if (nodes.size() != relationships.size() + 1) {
            throw new IllegalArgumentException("A path with "
                + relationships.size() + " relationships needs "
                + (relationships.size() + 1) + " nodes, got " + nodes.size());
        }
        if (function != PathFunction.NONE && relationships.size() != 1) {
            throw new IllegalArgumentException(function.cypherName()
                + " requires exactly one relationship pattern");
        }
        nodes = List.copyOf(nodes);
        relationships = List.copyOf(relationships);
    }

    /**
     * Create a plain chain without path variable or function.
     *
     * @param nodes node patterns
     * @param relationships relationship patterns
     * @return the path
     */
    public static PathExpression of(final List<NodePattern> nodes,
            final List<RelationshipPattern> relationships) {
        return new PathExpression(null, PathFunction.NONE, nodes,
            relationships);
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitPathExpression(this);
    }
}
