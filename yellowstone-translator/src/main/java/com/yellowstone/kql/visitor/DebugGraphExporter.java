package com.yellowstone.kql.visitor;

import com.yellowstone.kql.ast.And;
import com.yellowstone.kql.ast.AstNode;
import com.yellowstone.kql.ast.Comparison;
import com.yellowstone.kql.ast.CypherText;
import com.yellowstone.kql.ast.FunctionCall;
import com.yellowstone.kql.ast.Literal;
import com.yellowstone.kql.ast.MatchClause;
import com.yellowstone.kql.ast.NodePattern;
import com.yellowstone.kql.ast.Not;
import com.yellowstone.kql.ast.NullCheck;
import com.yellowstone.kql.ast.Or;
import com.yellowstone.kql.ast.OrderItem;
import com.yellowstone.kql.ast.PathExpression;
import com.yellowstone.kql.ast.PropertyAccess;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.ast.ReturnClause;
import com.yellowstone.kql.ast.ReturnItem;
import com.yellowstone.kql.ast.VariableRef;
import com.yellowstone.kql.ast.WhereClause;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Renders a syntax tree as a Graphviz DOT digraph for debugging.
 *
 * <pre>{@code
 * digraph ast {
 *   n0 [label="Query"];
 *   n1 [label="MATCH"];
 *   n0 -> n1;
 *   ...
 * }
 * }</pre>
 */
public final class DebugGraphExporter extends DefaultAstVisitor<Void> {

    private final StringBuilder dot = new StringBuilder();
    private final Deque<Integer> parents = new ArrayDeque<>();
    private int nextId;

    private DebugGraphExporter() {
    }

    /**
     * Export a tree as DOT text.
     *
     * @param root the root node
     * @return DOT source
     */
    public static String export(final AstNode root) {
        DebugGraphExporter exporter = new DebugGraphExporter();
        exporter.dot.append("digraph ast {\n");
        root.accept(exporter);
        exporter.dot.append("}\n");
        return exporter.dot.toString();
    }

    private Void node(final String label, final Supplier<Void> children) {
        int id = nextId++;
        dot.append("  n").append(id).append(" [label=\"")
            .append(escape(label)).append("\"];\n");
        if (!parents.isEmpty()) {
            dot.append("  n").append(parents.peek()).append(" -> n")
                .append(id).append(";\n");
        }
        parents.push(id);
        children.get();
        parents.pop();
        return null;
    }

    private static String escape(final String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    @Override
    public Void visitQuery(final Query query) {
        return node("Query", () -> super.visitQuery(query));
    }

    @Override
    public Void visitMatchClause(final MatchClause clause) {
        return node(clause.optional() ? "OPTIONAL MATCH" : "MATCH",
            () -> super.visitMatchClause(clause));
    }

    @Override
    public Void visitPathExpression(final PathExpression path) {
        String label = "Path";
        if (path.pathVariable() != null) {
            label += " " + path.pathVariable();
        }
        if (path.function().cypherName() != null) {
            label += " " + path.function().cypherName();
        }
        return node(label, () -> super.visitPathExpression(path));
    }

    @Override
    public Void visitNodePattern(final NodePattern node) {
        return node("Node " + CypherText.of(node), () -> null);
    }

    @Override
    public Void visitRelationshipPattern(final RelationshipPattern rel) {
        return node("Rel " + CypherText.of(rel), () -> null);
    }

    @Override
    public Void visitWhereClause(final WhereClause clause) {
        return node("WHERE", () -> super.visitWhereClause(clause));
    }

    @Override
    public Void visitReturnClause(final ReturnClause clause) {
        StringBuilder label = new StringBuilder(clause.distinct()
            ? "RETURN DISTINCT" : "RETURN");
        if (clause.skip() != null) {
            label.append(" SKIP ").append(clause.skip());
        }
        if (clause.limit() != null) {
            label.append(" LIMIT ").append(clause.limit());
        }
        return node(label.toString(), () -> super.visitReturnClause(clause));
    }

    @Override
    public Void visitReturnItem(final ReturnItem item) {
        String label = item.wildcard() ? "*"
            : item.alias() == null ? "Item" : "Item AS " + item.alias();
        return node(label, () -> super.visitReturnItem(item));
    }

    @Override
    public Void visitOrderItem(final OrderItem item) {
        return node("ORDER BY " + item.direction(),
            () -> super.visitOrderItem(item));
    }

    @Override
    public Void visitPropertyAccess(final PropertyAccess access) {
        return node(access.variable() + "." + access.property(), () -> null);
    }

    @Override
    public Void visitVariableRef(final VariableRef ref) {
        return node(ref.name(), () -> null);
    }

    @Override
    public Void visitLiteral(final Literal literal) {
        return node(CypherText.of(literal.value()), () -> null);
    }

    @Override
    public Void visitFunctionCall(final FunctionCall call) {
        String label = call.name() + (call.star() ? "(*)"
            : call.distinct() ? "(DISTINCT)" : "()");
        return node(label, () -> super.visitFunctionCall(call));
    }

    @Override
    public Void visitComparison(final Comparison comparison) {
        return node(comparison.operator().symbol(),
            () -> super.visitComparison(comparison));
    }

    @Override
    public Void visitAnd(final And and) {
        return node("AND", () -> super.visitAnd(and));
    }

    @Override
    public Void visitOr(final Or or) {
        return node("OR", () -> super.visitOr(or));
    }

    @Override
    public Void visitNot(final Not not) {
        return node("NOT", () -> super.visitNot(not));
    }

    @Override
    public Void visitNullCheck(final NullCheck check) {
        return node(check.negated() ? "IS NOT NULL" : "IS NULL",
            () -> super.visitNullCheck(check));
    }
}
