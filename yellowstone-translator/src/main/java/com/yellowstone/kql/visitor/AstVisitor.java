package com.yellowstone.kql.visitor;

import com.yellowstone.kql.ast.And;
import com.yellowstone.kql.ast.Comparison;
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

/**
 * Visitor over the syntax tree, one method per node type.
 *
 * <p>Most implementations extend {@link DefaultAstVisitor} and override only
 * the nodes they care about.</p>
 *
 * @param <R> result type
 */
public interface AstVisitor<R> {

    R visitQuery(Query query);

    R visitMatchClause(MatchClause clause);

    R visitPathExpression(PathExpression path);

    R visitNodePattern(NodePattern node);

    R visitRelationshipPattern(RelationshipPattern relationship);

    R visitWhereClause(WhereClause clause);

    R visitReturnClause(ReturnClause clause);

    R visitReturnItem(ReturnItem item);

    R visitOrderItem(OrderItem item);

    R visitPropertyAccess(PropertyAccess access);

    R visitVariableRef(VariableRef ref);

    R visitLiteral(Literal literal);

    R visitFunctionCall(FunctionCall call);

    R visitComparison(Comparison comparison);

    R visitAnd(And and);

    R visitOr(Or or);

    R visitNot(Not not);

    R visitNullCheck(NullCheck check);
}
