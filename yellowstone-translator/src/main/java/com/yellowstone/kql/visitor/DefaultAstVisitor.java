package com.yellowstone.kql.visitor;

import com.yellowstone.kql.ast.And;
import com.yellowstone.kql.ast.AstNode;
import com.yellowstone.kql.ast.Comparison;
import com.yellowstone.kql.ast.Expression;
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
import java.util.ArrayList;
import java.util.List;

/**
 * Visitor that walks every child of every node in source order.
 *
 * <p>Each method visits the node's children and folds their results with
 * {@link #aggregateResult(Object, Object)}, starting from
 * {@link #defaultResult()}. Subclasses override the node types they are
 * interested in and call the {@code super} method to keep descending.</p>
 *
 * @param <R> result type
 */
public abstract class DefaultAstVisitor<R> implements AstVisitor<R> {

    /**
     * Result for a leaf and the seed of the fold over children.
     *
     * @return the default result, null unless overridden
     */
    protected R defaultResult() {
        return null;
    }

    /**
     * Combine the result so far with the result of the next child.
     *
     * @param aggregate the result so far
     * @param next the next child's result
     * @return the combined result; the next child's result unless overridden
     */
    protected R aggregateResult(final R aggregate, final R next) {
        return next;
    }

    /**
     * Visit the given children in order and fold their results.
     *
     * @param children child nodes, null entries are skipped
     * @return the folded result
     */
    protected R visitChildren(final List<? extends AstNode> children) {
        R result = defaultResult();
        for (AstNode child : children) {
            if (child != null) {
                result = aggregateResult(result, child.accept(this));
            }
        }
        return result;
    }

    @Override
    public R visitQuery(final Query query) {
        List<AstNode> children = new ArrayList<>(query.matchClauses());
        children.add(query.whereClause());
        children.add(query.returnClause());
        return visitChildren(children);
    }

    @Override
    public R visitMatchClause(final MatchClause clause) {
        return visitChildren(clause.paths());
    }

    @Override
    public R visitPathExpression(final PathExpression path) {
        List<AstNode> children = new ArrayList<>();
        children.add(path.nodes().get(0));
        for (int i = 0; i < path.relationships().size(); i++) {
            children.add(path.relationships().get(i));
            children.add(path.nodes().get(i + 1));
        }
        return visitChildren(children);
    }

    @Override
    public R visitNodePattern(final NodePattern node) {
        return defaultResult();
    }

    @Override
    public R visitRelationshipPattern(final RelationshipPattern relationship) {
        return defaultResult();
    }

    @Override
    public R visitWhereClause(final WhereClause clause) {
        return visitChildren(List.of(clause.condition()));
    }

    @Override
    public R visitReturnClause(final ReturnClause clause) {
        List<AstNode> children = new ArrayList<>(clause.items());
        children.addAll(clause.orderBy());
        return visitChildren(children);
    }

    @Override
    public R visitReturnItem(final ReturnItem item) {
        return item.wildcard() ? defaultResult()
            : visitChildren(List.of(item.expression()));
    }

    @Override
    public R visitOrderItem(final OrderItem item) {
        return visitChildren(List.of(item.expression()));
    }

    @Override
    public R visitPropertyAccess(final PropertyAccess access) {
        return defaultResult();
    }

    @Override
    public R visitVariableRef(final VariableRef ref) {
        return defaultResult();
    }

    @Override
    public R visitLiteral(final Literal literal) {
        return defaultResult();
    }

    @Override
    public R visitFunctionCall(final FunctionCall call) {
        return visitChildren(call.arguments());
    }

    @Override
    public R visitComparison(final Comparison comparison) {
        return visitChildren(List.<Expression>of(comparison.left(),
            comparison.right()));
    }

    @Override
    public R visitAnd(final And and) {
        return visitChildren(List.of(and.left(), and.right()));
    }

    @Override
    public R visitOr(final Or or) {
        return visitChildren(List.of(or.left(), or.right()));
    }

    @Override
    public R visitNot(final Not not) {
        return visitChildren(List.of(not.operand()));
    }

    @Override
    public R visitNullCheck(final NullCheck check) {
        return visitChildren(List.of(check.operand()));
    }
}
