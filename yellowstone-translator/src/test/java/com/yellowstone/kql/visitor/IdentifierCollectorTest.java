package com.yellowstone.kql.visitor;

import com.yellowstone.kql.ast.LiteralValue;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.parser.CypherParser;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IdentifierCollector.
 */
public class IdentifierCollectorTest {

    @Test
    @DisplayName("Test bindings record node, relationship and path kinds")
    public void testBindings() throws TranslationException {
        Query query = CypherParser.parse(
            "MATCH p = (u:User)-[r:LOGGED_IN]->(d:Device) RETURN p");
        IdentifierCollector ids = IdentifierCollector.collect(query);

        assertEquals(IdentifierCollector.VariableKind.PATH,
            ids.getBindings().get("p"));
        assertEquals(IdentifierCollector.VariableKind.NODE,
            ids.getBindings().get("u"));
        assertEquals(IdentifierCollector.VariableKind.RELATIONSHIP,
            ids.getBindings().get("r"));
        assertEquals(Set.of("User", "Device"), ids.getLabels());
        assertEquals(Set.of("LOGGED_IN"), ids.getRelationshipTypes());
        assertTrue(ids.getConflicts().isEmpty());
    }

    @Test
    @DisplayName("Test references carry the clause they appear in")
    public void testReferences() throws TranslationException {
        Query query = CypherParser.parse("MATCH (u:User) WHERE u.age > 3 "
            + "RETURN u.name AS n ORDER BY n");
        IdentifierCollector ids = IdentifierCollector.collect(query);

        List<IdentifierCollector.Reference> refs = ids.getReferences();
        assertEquals(3, refs.size());
        assertEquals(IdentifierCollector.Clause.WHERE, refs.get(0).clause());
        assertEquals(IdentifierCollector.Clause.RETURN, refs.get(1).clause());
        assertEquals(IdentifierCollector.Clause.ORDER_BY,
            refs.get(2).clause());
        assertEquals(Set.of("n"), ids.getAliases());
    }

    @Test
    @DisplayName("Test literals are collected from patterns and conditions")
    public void testLiterals() throws TranslationException {
        Query query = CypherParser.parse("MATCH (u:User {name: 'a'}) "
            + "WHERE u.age > 3 RETURN u");
        IdentifierCollector ids = IdentifierCollector.collect(query);
        assertEquals(List.of(new LiteralValue.StringValue("a"),
                new LiteralValue.IntegerValue(3)),
            ids.getLiterals());
    }

    @Test
    @DisplayName("Test kind conflicts and rebound relationships are reported")
    public void testConflicts() throws TranslationException {
        Query query = CypherParser.parse("MATCH (x)-[x]->(b), "
            + "(c)-[r]->(d), (e)-[r]->(f) RETURN b");
        IdentifierCollector ids = IdentifierCollector.collect(query);

        assertEquals(1, ids.getConflicts().size());
        assertEquals("x", ids.getConflicts().get(0).name());
        assertEquals(Set.of("r"), ids.getReboundRelationships());
    }
}
