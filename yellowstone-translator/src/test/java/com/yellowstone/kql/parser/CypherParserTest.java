package com.yellowstone.kql.parser;

import com.yellowstone.kql.ast.And;
import com.yellowstone.kql.ast.Comparison;
import com.yellowstone.kql.ast.ComparisonOperator;
import com.yellowstone.kql.ast.Direction;
import com.yellowstone.kql.ast.FunctionCall;
import com.yellowstone.kql.ast.Literal;
import com.yellowstone.kql.ast.LiteralValue;
import com.yellowstone.kql.ast.NodePattern;
import com.yellowstone.kql.ast.Not;
import com.yellowstone.kql.ast.NullCheck;
import com.yellowstone.kql.ast.Or;
import com.yellowstone.kql.ast.PathExpression;
import com.yellowstone.kql.ast.PathFunction;
import com.yellowstone.kql.ast.PathLength;
import com.yellowstone.kql.ast.PropertyAccess;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.ast.ReturnClause;
import com.yellowstone.kql.ast.SortDirection;
import com.yellowstone.kql.error.CypherSyntaxException;
import com.yellowstone.kql.error.TranslationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CypherParser.
 */
public class CypherParserTest {

    @Test
    @DisplayName("Test node pattern with label, properties and projection")
    public void testSimpleMatch() throws TranslationException {
        Query query = CypherParser.parse(
            "MATCH (u:User {name: 'Alice', age: 30}) RETURN u.name AS who");

        assertEquals(1, query.matchClauses().size());
        assertFalse(query.matchClauses().get(0).optional());
        NodePattern node = query.matchClauses().get(0).paths().get(0)
            .nodes().get(0);
        assertEquals("u", node.variable());
        assertEquals(java.util.List.of("User"), node.labels());
        assertEquals(new LiteralValue.StringValue("Alice"),
            node.properties().get("name"));
        assertEquals(new LiteralValue.IntegerValue(30),
            node.properties().get("age"));
        assertNull(query.whereClause());

        ReturnClause ret = query.returnClause();
        assertEquals("who", ret.items().get(0).alias());
        assertEquals(new PropertyAccess("u", "name", 47),
            ret.items().get(0).expression());
    }

    @Test
    @DisplayName("Test relationship directions, types and lengths")
    public void testRelationships() throws TranslationException {
        Query query = CypherParser.parse(
            "MATCH (a)-[r:KNOWS|:LIKES*1..3]->(b)<-[:RAISED]-(c)-[*2]-(d) "
                + "RETURN a");
        PathExpression path = query.matchClauses().get(0).paths().get(0);
        assertEquals(4, path.nodes().size());

        RelationshipPattern first = path.relationships().get(0);
        assertEquals("r", first.variable());
        assertEquals(java.util.List.of("KNOWS", "LIKES"), first.types());
        assertEquals(Direction.OUTGOING, first.direction());
        assertEquals(PathLength.between(1, 3), first.length());

        RelationshipPattern second = path.relationships().get(1);
        assertEquals(Direction.INCOMING, second.direction());
        assertFalse(second.isVariableLength());

        RelationshipPattern third = path.relationships().get(2);
        assertEquals(Direction.EITHER, third.direction());
        assertEquals(PathLength.fixed(2), third.length());
    }

    @Test
    @DisplayName("Test open-ended lengths")
    public void testUnboundedLengths() throws TranslationException {
        RelationshipPattern star = CypherParser.parse(
            "MATCH (a)-[:KNOWS*]->(b) RETURN b").matchClauses().get(0)
            .paths().get(0).relationships().get(0);
        assertTrue(star.length().isUnbounded());
        assertEquals(1, star.length().effectiveMin());

        RelationshipPattern from = CypherParser.parse(
            "MATCH (a)-[:KNOWS*2..]->(b) RETURN b").matchClauses().get(0)
            .paths().get(0).relationships().get(0);
        assertEquals(new PathLength(2, null), from.length());
    }

    @Test
    @DisplayName("Test reversed range is a syntax error")
    public void testReversedRange() {
        assertThrows(CypherSyntaxException.class, () -> CypherParser.parse(
            "MATCH (a)-[:KNOWS*3..1]->(b) RETURN b"));
    }

    @Test
    @DisplayName("Test shortestPath with path variable")
    public void testShortestPath() throws TranslationException {
        Query query = CypherParser.parse("MATCH p = shortestPath("
            + "(a:User)-[:KNOWS*]-(b:User)) RETURN p");
        PathExpression path = query.matchClauses().get(0).paths().get(0);
        assertEquals("p", path.pathVariable());
        assertEquals(PathFunction.SHORTEST_PATH, path.function());

        Query all = CypherParser.parse("MATCH p = allShortestPaths("
            + "(a)-[:KNOWS*]->(b)) RETURN p");
        assertEquals(PathFunction.ALL_SHORTEST_PATHS,
            all.matchClauses().get(0).paths().get(0).function());
    }

    @Test
    @DisplayName("Test shortestPath needs exactly one relationship")
    public void testShortestPathHopCount() {
        CypherSyntaxException e = assertThrows(CypherSyntaxException.class,
            () -> CypherParser.parse("MATCH p = shortestPath("
                + "(a)-->(b)-->(c)) RETURN p"));
        assertTrue(e.getExpected().contains("exactly one relationship"));
    }

    @Test
    @DisplayName("Test unknown path function is rejected")
    public void testUnknownPathFunction() {
        assertThrows(CypherSyntaxException.class,
            () -> CypherParser.parse("MATCH p = longestPath((a)-->(b)) "
                + "RETURN p"));
    }

    @Test
    @DisplayName("Test WHERE precedence: NOT binds tighter than AND, AND tighter than OR")
    public void testConditionPrecedence() throws TranslationException {
        Query query = CypherParser.parse("MATCH (u:User) "
            + "WHERE NOT u.age > 30 AND u.name = 'a' OR u.name IS NOT NULL "
            + "RETURN u");
        Or or = assertInstanceOf(Or.class, query.whereClause().condition());
        And and = assertInstanceOf(And.class, or.left());
        Not not = assertInstanceOf(Not.class, and.left());
        Comparison gt = assertInstanceOf(Comparison.class, not.operand());
        assertEquals(ComparisonOperator.GREATER_THAN, gt.operator());
        NullCheck check = assertInstanceOf(NullCheck.class, or.right());
        assertTrue(check.negated());
    }

    @Test
    @DisplayName("Test string predicates and negative literals")
    public void testStringOperators() throws TranslationException {
        Query query = CypherParser.parse("MATCH (u:User) "
            + "WHERE u.name STARTS WITH 'adm' AND u.age >= -5 RETURN u");
        And and = (And) query.whereClause().condition();
        assertEquals(ComparisonOperator.STARTS_WITH,
            ((Comparison) and.left()).operator());
        Comparison right = (Comparison) and.right();
        assertEquals(new Literal(new LiteralValue.IntegerValue(-5)),
            right.right());
    }

    @Test
    @DisplayName("Test aggregates, wildcard, ORDER BY, SKIP and LIMIT")
    public void testReturnClause() throws TranslationException {
        Query query = CypherParser.parse("MATCH (u:User) "
            + "RETURN DISTINCT u.department, count(*) AS n, "
            + "count(DISTINCT u.name) "
            + "ORDER BY n DESC, u.department SKIP 5 LIMIT 10");
        ReturnClause ret = query.returnClause();
        assertTrue(ret.distinct());
        assertEquals(3, ret.items().size());

        FunctionCall countStar = (FunctionCall) ret.items().get(1)
            .expression();
        assertTrue(countStar.star());
        assertTrue(countStar.isAggregate());
        FunctionCall countDistinct = (FunctionCall) ret.items().get(2)
            .expression();
        assertTrue(countDistinct.distinct());

        assertEquals(2, ret.orderBy().size());
        assertEquals(SortDirection.DESC, ret.orderBy().get(0).direction());
        assertEquals(SortDirection.ASC, ret.orderBy().get(1).direction());
        assertEquals(5L, ret.skip());
        assertEquals(10L, ret.limit());

        Query star = CypherParser.parse("MATCH (a)-->(b) RETURN *");
        assertTrue(star.returnClause().items().get(0).wildcard());
    }

    @Test
    @DisplayName("Test OPTIONAL MATCH and multiple patterns")
    public void testOptionalMatch() throws TranslationException {
        Query query = CypherParser.parse("MATCH (u:User), (d:Device) "
            + "OPTIONAL MATCH (u)-[:LOGGED_IN]->(d) RETURN u, d;");
        assertEquals(2, query.matchClauses().size());
        assertEquals(2, query.matchClauses().get(0).paths().size());
        assertTrue(query.matchClauses().get(1).optional());
    }

    @Test
    @DisplayName("Test a query without MATCH is rejected")
    public void testMissingMatch() {
        CypherSyntaxException e = assertThrows(CypherSyntaxException.class,
            () -> CypherParser.parse("RETURN u.name"));
        assertEquals("MATCH", e.getExpected());
        assertEquals(0, e.getPosition().getAsInt());
        assertEquals(CypherSyntaxException.REASON, e.getReasonCode());
    }

    @Test
    @DisplayName("Test trailing tokens and duplicate property keys are rejected")
    public void testTrailingInput() {
        assertThrows(CypherSyntaxException.class,
            () -> CypherParser.parse("MATCH (n) RETURN n n"));
        assertThrows(CypherSyntaxException.class,
            () -> CypherParser.parse("MATCH (n {a: 1, a: 2}) RETURN n"));
        assertThrows(CypherSyntaxException.class,
            () -> CypherParser.parse("MATCH (a)<-[:X]->(b) RETURN a"));
    }
}
