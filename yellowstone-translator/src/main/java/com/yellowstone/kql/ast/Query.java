package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.List;
import java.util.Objects;

/**
 * A complete read query: one or more MATCH clauses in source order, an
 * optional WHERE clause and a RETURN clause.
 *
 * @param matchClauses MATCH clauses, never empty
 * @param whereClause WHERE clause, may be null
 * @param returnClause RETURN clause
 */
public record Query(List<MatchClause> matchClauses, WhereClause whereClause,
        ReturnClause returnClause) implements AstNode {

    public Query {
        Objects.requireNonNull(matchClauses, "matchClauses");
        Objects.requireNonNull(returnClause, "returnClause");
        if (matchClauses.isEmpty()) {
            throw new IllegalArgumentException(
                "A query needs at least one MATCH clause");
        }
        matchClauses = List.copyOf(matchClauses);
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitQuery(this);
    }
}
