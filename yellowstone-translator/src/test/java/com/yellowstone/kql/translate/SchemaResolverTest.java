package com.yellowstone.kql.translate;

import com.yellowstone.kql.TestSchemas;
import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.NodePattern;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.error.UnboundIdentifierException;
import com.yellowstone.kql.error.UnresolvedSchemaReferenceException;
import com.yellowstone.kql.error.UnsupportedPatternException;
import com.yellowstone.kql.parser.CypherParser;
import com.yellowstone.kql.schema.BackingEntityRef;
import com.yellowstone.kql.schema.MultiEntityPolicy;
import com.yellowstone.kql.schema.SchemaMapper;
import com.yellowstone.kql.visitor.IdentifierCollector.VariableKind;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SchemaResolver.
 */
public class SchemaResolverTest {

    private static SchemaMapper mapper;

    @BeforeAll
    public static void setUpClass() {
        mapper = TestSchemas.testSchema();
    }

    private static TranslationContext resolve(final String cypher,
            final TranslatorConfig config) throws TranslationException {
        return SchemaResolver.resolve(CypherParser.parse(cypher), mapper,
            config);
    }

    private static TranslationContext resolve(final String cypher)
            throws TranslationException {
        return resolve(cypher, TranslatorConfig.defaults());
    }

    @Test
    @DisplayName("Test bindings carry kind, labels and backing tables")
    public void testBindings() throws TranslationException {
        TranslationContext context = resolve("MATCH p = (u:User)"
            + "-[r:LOGGED_IN]->(d:Device) RETURN p, u.name");

        VariableBinding u = context.binding("u");
        assertEquals(VariableKind.NODE, u.kind());
        assertEquals(List.of("User"), u.labels());
        assertEquals("IdentityInfo", u.entities().get(0).entityId());
        assertFalse(u.generated());
        assertEquals(VariableKind.RELATIONSHIP, context.binding("r").kind());
        assertEquals(VariableKind.PATH, context.binding("p").kind());
        assertEquals("AccountName", context.physicalProperty("u", "name"));
        assertTrue(context.getApproximations().isEmpty());
        assertTrue(context.getSecondAttempts().isEmpty());
    }

    @Test
    @DisplayName("Test anonymous nodes with properties get generated names")
    public void testGeneratedNames() throws TranslationException {
        Query query = CypherParser.parse("MATCH (:User {name: 'a'})"
            + "-[:LOGGED_IN]->(d:Device) RETURN d");
        TranslationContext context = SchemaResolver.resolve(query, mapper,
            TranslatorConfig.defaults());
        NodePattern anonymous = query.matchClauses().get(0).paths().get(0)
            .nodes().get(0);

        assertEquals("_n0", context.variableOf(anonymous));
        assertTrue(context.binding("_n0").generated());
        assertEquals("AccountName", context.physicalProperty("_n0", "name"));
    }

    @Test
    @DisplayName("Test generated names avoid user variables")
    public void testGeneratedNameCollision() throws TranslationException {
        TranslationContext context = resolve("MATCH (_n0:User), "
            + "(:Device {name: 'x'}) RETURN _n0");
        assertTrue(context.getBindings().containsKey("_n1"));
        assertFalse(context.binding("_n0").generated());
    }

    @Test
    @DisplayName("Test multi-table labels follow the multi-entity policy")
    public void testMultiEntityPolicy() throws TranslationException {
        String cypher = "MATCH (a:Alert) RETURN a.title";
        Query query = CypherParser.parse(cypher);
        NodePattern node = query.matchClauses().get(0).paths().get(0)
            .nodes().get(0);

        TranslationContext union = SchemaResolver.resolve(query, mapper,
            TranslatorConfig.defaults());
        assertEquals(List.of("SecurityAlert", "AlertInfo"),
            union.entitiesOf(node).stream().map(BackingEntityRef::entityId)
                .toList());
        assertEquals(1, union.getApproximations().size());

        TranslationContext primary = SchemaResolver.resolve(query, mapper,
            TranslatorConfig.builder()
                .multiEntityPolicy(MultiEntityPolicy.PRIMARY).build());
        assertEquals(1, primary.entitiesOf(node).size());
        assertEquals(1, primary.getApproximations().size());

        UnsupportedPatternException e = assertThrows(
            UnsupportedPatternException.class,
            () -> resolve(cypher, TranslatorConfig.builder()
                .multiEntityPolicy(MultiEntityPolicy.REJECT).build()));
        assertEquals(UnsupportedPatternException.MULTI_ENTITY,
            e.getReasonCode());
    }

    @Test
    @DisplayName("Test case-insensitive fallback is recorded and can be disabled")
    public void testCaseInsensitive() throws TranslationException {
        TranslationContext context = resolve(
            "MATCH (u:user)-[:logged_in]->(d) RETURN u.NAME");
        assertEquals(3, context.getSecondAttempts().size());
        assertEquals("AccountName", context.physicalProperty("u", "NAME"));

        assertThrows(UnresolvedSchemaReferenceException.class,
            () -> resolve("MATCH (u:user) RETURN u", TranslatorConfig
                .builder().caseInsensitiveLookup(false).build()));
    }

    @Test
    @DisplayName("Test unknown labels, relationship types and properties")
    public void testUnresolved() {
        UnresolvedSchemaReferenceException label = assertThrows(
            UnresolvedSchemaReferenceException.class,
            () -> resolve("MATCH (g:Ghost) RETURN g"));
        assertEquals("Ghost", label.getReference());

        UnresolvedSchemaReferenceException type = assertThrows(
            UnresolvedSchemaReferenceException.class,
            () -> resolve("MATCH (a)-[:HAUNTS]->(b) RETURN a"));
        assertEquals(UnresolvedSchemaReferenceException.ReferenceKind
            .RELATIONSHIP_TYPE, type.getKind());

        assertThrows(UnresolvedSchemaReferenceException.class,
            () -> resolve("MATCH (u:User) RETURN u.shoeSize"));
    }

    @Test
    @DisplayName("Test unlabeled property lookups fail when ambiguous")
    public void testUnlabeledProperty() throws TranslationException {
        assertEquals("Age", resolve("MATCH (n) RETURN n.age")
            .physicalProperty("n", "age"));
        UnresolvedSchemaReferenceException e = assertThrows(
            UnresolvedSchemaReferenceException.class,
            () -> resolve("MATCH (n) RETURN n.name"));
        assertEquals(2, e.getAlternatives().size());
    }

    @Test
    @DisplayName("Test labels backed by different tables conflict")
    public void testConflictingLabels() {
        UnsupportedPatternException e = assertThrows(
            UnsupportedPatternException.class,
            () -> resolve("MATCH (x:User:Device) RETURN x"));
        assertEquals(UnsupportedPatternException.CONFLICTING_LABELS,
            e.getReasonCode());
    }

    @Test
    @DisplayName("Test path variables have no properties")
    public void testPathProperty() {
        UnsupportedPatternException e = assertThrows(
            UnsupportedPatternException.class,
            () -> resolve("MATCH p = (a:User)-[:KNOWS]->(b) RETURN p.length"));
        assertEquals(UnsupportedPatternException.PATH_PROPERTY,
            e.getReasonCode());
    }

    @Test
    @DisplayName("Test unbound property access names its clause")
    public void testUnboundAccess() {
        UnboundIdentifierException e = assertThrows(
            UnboundIdentifierException.class,
            () -> resolve("MATCH (n:User) WHERE u.age > 1 RETURN n"));
        assertEquals("u", e.getIdentifier());
        assertTrue(e.getMessage().contains("WHERE"));
    }
}
