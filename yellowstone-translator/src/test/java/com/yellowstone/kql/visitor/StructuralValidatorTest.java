package com.yellowstone.kql.visitor;

import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.parser.CypherParser;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StructuralValidator.
 */
public class StructuralValidatorTest {

    private static List<StructuralValidator.Violation> validate(
            final String cypher) throws TranslationException {
        return StructuralValidator.validate(CypherParser.parse(cypher));
    }

    @Test
    @DisplayName("Test a well-formed query has no violations")
    public void testValidQuery() throws TranslationException {
        assertTrue(validate("MATCH (u:User)-[:LOGGED_IN]->(d:Device) "
            + "WHERE u.age > 30 RETURN u.name AS n, count(d) "
            + "ORDER BY n").isEmpty());
    }

    @Test
    @DisplayName("Test unbound identifier in RETURN is reported with its position")
    public void testUnboundIdentifier() throws TranslationException {
        List<StructuralValidator.Violation> violations =
            validate("MATCH (n:User) RETURN u.name");
        assertEquals(1, violations.size());
        StructuralValidator.Violation v = violations.get(0);
        assertEquals(StructuralValidator.ViolationKind.UNBOUND_IDENTIFIER,
            v.kind());
        assertEquals("u", v.subject());
        assertEquals("RETURN", v.clause());
        assertEquals(22, v.position());
    }

    @Test
    @DisplayName("Test ORDER BY may use a RETURN alias but WHERE may not")
    public void testAliasScope() throws TranslationException {
        assertTrue(validate("MATCH (u:User) RETURN u.age AS a ORDER BY a")
            .isEmpty());
        List<StructuralValidator.Violation> violations = validate(
            "MATCH (u:User) WHERE a > 1 RETURN u.age AS a");
        assertEquals(1, violations.size());
        assertEquals("WHERE", violations.get(0).clause());
    }

    @Test
    @DisplayName("Test aggregate inside WHERE is reported")
    public void testAggregateInWhere() throws TranslationException {
        List<StructuralValidator.Violation> violations = validate(
            "MATCH (u:User) WHERE count(u) > 1 RETURN u");
        assertEquals(1, violations.size());
        assertEquals(StructuralValidator.ViolationKind.AGGREGATE_IN_WHERE,
            violations.get(0).kind());
        assertEquals("count", violations.get(0).subject());
    }

    @Test
    @DisplayName("Test kind conflicts and rebound relationships are reported")
    public void testBindingViolations() throws TranslationException {
        List<StructuralValidator.Violation> violations = validate(
            "MATCH (a)-[r]->(b), (b)-[r]->(c), (r) RETURN a");
        assertTrue(violations.stream().anyMatch(v -> v.kind()
            == StructuralValidator.ViolationKind.VARIABLE_KIND_CONFLICT));
        assertTrue(violations.stream().anyMatch(v -> v.kind()
            == StructuralValidator.ViolationKind.RELATIONSHIP_REBOUND));
    }
}
