package com.yellowstone.kql.visitor;

import com.yellowstone.kql.ast.AstNode;
import com.yellowstone.kql.ast.Literal;
import com.yellowstone.kql.ast.LiteralValue;
import com.yellowstone.kql.ast.NodePattern;
import com.yellowstone.kql.ast.OrderItem;
import com.yellowstone.kql.ast.PathExpression;
import com.yellowstone.kql.ast.PropertyAccess;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.ast.ReturnClause;
import com.yellowstone.kql.ast.ReturnItem;
import com.yellowstone.kql.ast.VariableRef;
import com.yellowstone.kql.ast.WhereClause;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the identifiers a query binds and references, together with its
 * literals, labels and relationship types.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * IdentifierCollector ids = IdentifierCollector.collect(query);
 * ids.getBindings();    // {u=NODE, r=RELATIONSHIP, p=PATH}
 * ids.getReferences();  // [u in WHERE, u in RETURN]
 * }</pre>
 *
 * <p>A variable keeps the kind of its first binding. Later bindings of the
 * same name with a different kind are recorded as conflicts.</p>
 */
public final class IdentifierCollector extends DefaultAstVisitor<Void> {

    /** What a variable is bound to. */
    public enum VariableKind {
        NODE,
        RELATIONSHIP,
        PATH
    }

    /** Clause in which a reference occurs. */
    public enum Clause {
        WHERE,
        RETURN,
        ORDER_BY
    }

    /**
     * A use of a variable outside MATCH.
     *
     * @param name the variable
     * @param clause clause of the use
     * @param position offset of the use
     */
    public record Reference(String name, Clause clause, int position) {
    }

    /**
     * A variable bound twice with different kinds.
     *
     * @param name the variable
     * @param first kind of the first binding
     * @param second kind of the conflicting binding
     */
    public record KindConflict(String name, VariableKind first,
            VariableKind second) {
    }

    private final Map<String, VariableKind> bindings = new LinkedHashMap<>();
    private final Map<String, Integer> relationshipBindingCounts =
        new LinkedHashMap<>();
    private final List<Reference> references = new ArrayList<>();
    private final List<KindConflict> conflicts = new ArrayList<>();
    private final List<LiteralValue> literals = new ArrayList<>();
    private final Set<String> labels = new LinkedHashSet<>();
    private final Set<String> relationshipTypes = new LinkedHashSet<>();
    private final Set<String> aliases = new LinkedHashSet<>();

    private Clause currentClause;

    /**
     * Collect identifiers of a tree.
     *
     * @param node the root, usually a query
     * @return the populated collector
     */
    public static IdentifierCollector collect(final AstNode node) {
        IdentifierCollector collector = new IdentifierCollector();
        node.accept(collector);
        return collector;
    }

    @Override
    public Void visitPathExpression(final PathExpression path) {
        if (path.pathVariable() != null) {
            bind(path.pathVariable(), VariableKind.PATH);
        }
        return super.visitPathExpression(path);
    }

    @Override
    public Void visitNodePattern(final NodePattern node) {
        if (node.variable() != null) {
            bind(node.variable(), VariableKind.NODE);
        }
        labels.addAll(node.labels());
        literals.addAll(node.properties().values());
        return null;
    }

    @Override
    public Void visitRelationshipPattern(final RelationshipPattern rel) {
        if (rel.variable() != null) {
            bind(rel.variable(), VariableKind.RELATIONSHIP);
            relationshipBindingCounts.merge(rel.variable(), 1, Integer::sum);
        }
        relationshipTypes.addAll(rel.types());
        literals.addAll(rel.properties().values());
        return null;
    }

    @Override
    public Void visitWhereClause(final WhereClause clause) {
        currentClause = Clause.WHERE;
        return super.visitWhereClause(clause);
    }

    @Override
    public Void visitReturnClause(final ReturnClause clause) {
        currentClause = Clause.RETURN;
        for (ReturnItem item : clause.items()) {
            item.accept(this);
            if (item.alias() != null) {
                aliases.add(item.alias());
            }
        }
        currentClause = Clause.ORDER_BY;
        for (OrderItem item : clause.orderBy()) {
            item.accept(this);
        }
        return null;
    }

    @Override
    public Void visitPropertyAccess(final PropertyAccess access) {
        references.add(new Reference(access.variable(), currentClause,
            access.position()));
        return null;
    }

    @Override
    public Void visitVariableRef(final VariableRef ref) {
        references.add(new Reference(ref.name(), currentClause,
            ref.position()));
        return null;
    }

    @Override
    public Void visitLiteral(final Literal literal) {
        literals.add(literal.value());
        return null;
    }

    private void bind(final String name, final VariableKind kind) {
        VariableKind existing = bindings.putIfAbsent(name, kind);
        if (existing != null && existing != kind) {
            conflicts.add(new KindConflict(name, existing, kind));
        }
    }

    /**
     * Bound variables by kind, in order of first binding.
     *
     * @return unmodifiable bindings
     */
    public Map<String, VariableKind> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * Variable uses in WHERE, RETURN and ORDER BY, in source order.
     *
     * @return unmodifiable references
     */
    public List<Reference> getReferences() {
        return Collections.unmodifiableList(references);
    }

    /**
     * Variables bound with two different kinds.
     *
     * @return unmodifiable conflicts
     */
    public List<KindConflict> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    /**
     * Relationship variables bound by more than one pattern.
     *
     * @return names of rebound relationship variables
     */
    public Set<String> getReboundRelationships() {
        Set<String> rebound = new LinkedHashSet<>();
        relationshipBindingCounts.forEach((name, count) -> {
            if (count > 1) {
                rebound.add(name);
            }
        });
        return rebound;
    }

    /**
     * Literal values in source order.
     *
     * @return unmodifiable literals
     */
    public List<LiteralValue> getLiterals() {
        return Collections.unmodifiableList(literals);
    }

    /**
     * Node labels in order of first use.
     *
     * @return unmodifiable labels
     */
    public Set<String> getLabels() {
        return Collections.unmodifiableSet(labels);
    }

    /**
     * Relationship types in order of first use.
     *
     * @return unmodifiable types
     */
    public Set<String> getRelationshipTypes() {
        return Collections.unmodifiableSet(relationshipTypes);
    }

    /**
     * Aliases introduced by RETURN ... AS.
     *
     * @return unmodifiable aliases
     */
    public Set<String> getAliases() {
        return Collections.unmodifiableSet(aliases);
    }
}
