package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.List;
import java.util.Objects;

/**
 * A {@code MATCH} or {@code OPTIONAL MATCH} clause.
 *
 * @param paths comma separated path expressions, never empty
 * @param optional whether the clause was written as OPTIONAL MATCH
 */
public record MatchClause(List<PathExpression> paths, boolean optional)
        implements AstNode {

    public MatchClause {
        Objects.requireNonNull(paths, "paths");
        if (paths.isEmpty()) {
            throw new IllegalArgumentException(
                "A MATCH clause needs at least one pattern");
        }
        paths = List.copyOf(paths);
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitMatchClause(this);
    }
}
