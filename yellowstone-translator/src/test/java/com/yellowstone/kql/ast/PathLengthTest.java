package com.yellowstone.kql.ast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PathLength and CypherText.
 */
public class PathLengthTest {

    @Test
    @DisplayName("Test Cypher spelling of the length forms")
    public void testToCypher() {
        assertEquals("*", PathLength.unbounded().toCypher());
        assertEquals("*2", PathLength.fixed(2).toCypher());
        assertEquals("*1..3", PathLength.between(1, 3).toCypher());
        assertEquals("*2..", new PathLength(2, null).toCypher());
        assertEquals("*..4", new PathLength(null, 4).toCypher());
    }

    @Test
    @DisplayName("Test effective minimum and unboundedness")
    public void testBounds() {
        assertEquals(1, PathLength.unbounded().effectiveMin());
        assertEquals(0, PathLength.between(0, 2).effectiveMin());
        assertTrue(new PathLength(3, null).isUnbounded());
        assertFalse(PathLength.fixed(3).isUnbounded());
    }

    @Test
    @DisplayName("Test invalid bounds are rejected")
    public void testInvalid() {
        assertThrows(IllegalArgumentException.class,
            () -> PathLength.between(3, 1));
        assertThrows(IllegalArgumentException.class,
            () -> new PathLength(-1, null));
    }

    @Test
    @DisplayName("Test CypherText renders patterns back to Cypher")
    public void testCypherText() {
        NodePattern a = new NodePattern("a", java.util.List.of("User"),
            java.util.Map.of("name", new LiteralValue.StringValue("O'Neil")),
            0);
        NodePattern b = new NodePattern(null, java.util.List.of(),
            java.util.Map.of(), 0);
        RelationshipPattern rel = new RelationshipPattern(null,
            java.util.List.of("KNOWS"), Direction.INCOMING,
            java.util.Map.of(), PathLength.between(1, 2), 0);
        assertEquals("(a:User {name: 'O\\'Neil'})<-[:KNOWS*1..2]-()",
            CypherText.of(PathExpression.of(java.util.List.of(a, b),
                java.util.List.of(rel))));
    }
}
