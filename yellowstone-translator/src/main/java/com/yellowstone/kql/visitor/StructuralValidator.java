package com.yellowstone.kql.visitor;

import com.yellowstone.kql.ast.FunctionCall;
import com.yellowstone.kql.ast.PathExpression;
import com.yellowstone.kql.ast.PathFunction;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.ast.ReturnClause;
import com.yellowstone.kql.ast.WhereClause;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks the structural rules a parsed query must satisfy before it is
 * resolved against a schema.
 *
 * <ul>
 *   <li>every variable used in WHERE, RETURN or ORDER BY is bound by MATCH
 *       (ORDER BY may also name a RETURN alias)</li>
 *   <li>a name is not bound as two different kinds</li>
 *   <li>a relationship variable is bound by a single pattern</li>
 *   <li>WHERE contains no aggregate function</li>
 *   <li>a path function wraps exactly one relationship</li>
 * </ul>
 */
public final class StructuralValidator extends DefaultAstVisitor<Void> {

    /** Category of a violation. */
    public enum ViolationKind {
        UNBOUND_IDENTIFIER,
        VARIABLE_KIND_CONFLICT,
        RELATIONSHIP_REBOUND,
        AGGREGATE_IN_WHERE,
        PATH_FUNCTION_MISUSE
    }

    /**
     * One rule violation.
     *
     * @param kind the rule broken
     * @param subject the offending name
     * @param message human readable description
     * @param clause clause of the offence, e.g. RETURN
     * @param position offset in the query text, or -1
     */
    public record Violation(ViolationKind kind, String subject,
            String message, String clause, int position) {
    }

    private final List<Violation> violations = new ArrayList<>();

    private boolean inWhere;

    private StructuralValidator() {
    }

    /**
     * Validate a query.
     *
     * @param query the query
     * @return violations in discovery order, empty when the query is valid
     */
    public static List<Violation> validate(final Query query) {
        StructuralValidator validator = new StructuralValidator();
        IdentifierCollector ids = IdentifierCollector.collect(query);
        for (IdentifierCollector.Reference ref : ids.getReferences()) {
            boolean bound = ids.getBindings().containsKey(ref.name())
                || (ref.clause() == IdentifierCollector.Clause.ORDER_BY
                    && ids.getAliases().contains(ref.name()));
            if (!bound) {
                validator.violations.add(new Violation(
                    ViolationKind.UNBOUND_IDENTIFIER, ref.name(),
                    "Variable '" + ref.name() + "' is not bound",
                    ref.clause().name().replace('_', ' '), ref.position()));
            }
        }
        for (IdentifierCollector.KindConflict conflict : ids.getConflicts()) {
            validator.violations.add(new Violation(
                ViolationKind.VARIABLE_KIND_CONFLICT, conflict.name(),
                "Variable '" + conflict.name() + "' is bound as "
                    + conflict.first() + " and as " + conflict.second(),
                "MATCH", -1));
        }
        for (String name : ids.getReboundRelationships()) {
            validator.violations.add(new Violation(
                ViolationKind.RELATIONSHIP_REBOUND, name,
                "Relationship variable '" + name
                    + "' is bound by more than one pattern", "MATCH", -1));
        }
        query.accept(validator);
        return Collections.unmodifiableList(validator.violations);
    }

    @Override
    public Void visitPathExpression(final PathExpression path) {
        if (path.function() != PathFunction.NONE
                && path.relationships().size() != 1) {
            violations.add(new Violation(ViolationKind.PATH_FUNCTION_MISUSE,
                path.function().cypherName(), path.function().cypherName()
                    + " requires exactly one relationship", "MATCH",
                path.nodes().get(0).position()));
        }
        return super.visitPathExpression(path);
    }

    @Override
    public Void visitWhereClause(final WhereClause clause) {
        inWhere = true;
        super.visitWhereClause(clause);
        inWhere = false;
        return null;
    }

    @Override
    public Void visitReturnClause(final ReturnClause clause) {
        return null;
    }

    @Override
    public Void visitFunctionCall(final FunctionCall call) {
        if (inWhere && call.isAggregate()) {
            violations.add(new Violation(ViolationKind.AGGREGATE_IN_WHERE,
                call.name(), "Aggregate function " + call.name()
                    + "() is not allowed in WHERE", "WHERE",
                call.position()));
        }
        return super.visitFunctionCall(call);
    }
}
