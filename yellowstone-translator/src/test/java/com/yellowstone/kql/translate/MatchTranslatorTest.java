package com.yellowstone.kql.translate;

import com.yellowstone.kql.TestSchemas;
import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.error.EscalationRequiredException;
import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.error.UnsupportedPatternException;
import com.yellowstone.kql.parser.CypherParser;
import com.yellowstone.kql.schema.SchemaMapper;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MatchTranslator.
 */
public class MatchTranslatorTest {

    private static SchemaMapper mapper;

    @BeforeAll
    public static void setUpClass() {
        mapper = TestSchemas.testSchema();
    }

    private static MatchTranslator.MatchTranslation translate(
            final String cypher)
            throws TranslationException, EscalationRequiredException {
        Query query = CypherParser.parse(cypher);
        TranslationContext context = SchemaResolver.resolve(query, mapper,
            TranslatorConfig.defaults());
        return MatchTranslator.translate(query.matchClauses(), context);
    }

    @Test
    @DisplayName("Test patterns of one clause share a graph-match stage")
    public void testSingleClause() throws Exception {
        MatchTranslator.MatchTranslation match = translate(
            "MATCH (u:User)-[:LOGGED_IN]->(d:Device), "
                + "(d)-[:RAISED]->(a:Alert) RETURN a");
        assertEquals(List.of("graph-match (u:IdentityInfo)-[:SigninLogs]->"
                + "(d:DeviceInfo), (d)-[:SecurityAlert]->"
                + "(a:SecurityAlert|AlertInfo)"),
            match.stages());
        assertTrue(match.filters().isEmpty());
    }

    @Test
    @DisplayName("Test incoming, undirected and untyped relationships")
    public void testDirections() throws Exception {
        assertEquals(List.of("graph-match (d:DeviceInfo)<-[:SigninLogs]-"
                + "(u:IdentityInfo)"),
            translate("MATCH (d:Device)<-[:LOGGED_IN]-(u:User) RETURN d")
                .stages());
        assertEquals(List.of("graph-match (a)-[:UserRelationships]-(b)"),
            translate("MATCH (a)-[:KNOWS]-(b) RETURN a").stages());
        assertEquals(List.of("graph-match (a)-->(b)"),
            translate("MATCH (a)-->(b) RETURN a").stages());
    }

    @Test
    @DisplayName("Test OPTIONAL MATCH gets its own optional stage")
    public void testOptional() throws Exception {
        MatchTranslator.MatchTranslation match = translate(
            "MATCH (u:User) OPTIONAL MATCH (u)-[:LOGGED_IN]->(d:Device) "
                + "RETURN u, d");
        assertEquals(List.of("graph-match (u:IdentityInfo)",
                "graph-match(optional) (u)-[:SigninLogs]->(d:DeviceInfo)"),
            match.stages());
        assertFalse(match.enumeratesPaths());
    }

    @Test
    @DisplayName("Test OPTIONAL MATCH property maps stay inside the optional stage")
    public void testOptionalPropertyFilters() throws Exception {
        MatchTranslator.MatchTranslation match = translate(
            "MATCH (u:User {name: 'Alice'}) OPTIONAL MATCH "
                + "(u)-[:LOGGED_IN]->(d:Device {os: 'linux'}) "
                + "RETURN u.name, d.name");
        assertEquals(List.of("graph-match (u:IdentityInfo)",
                "graph-match(optional) (u)-[:SigninLogs]->(d:DeviceInfo)"
                    + " where d.OSPlatform == 'linux'"),
            match.stages());
        assertEquals(List.of("u.AccountName == 'Alice'"), match.filters());
    }

    @Test
    @DisplayName("Test property maps become filters")
    public void testPropertyFilters() throws Exception {
        MatchTranslator.MatchTranslation match = translate(
            "MATCH (u:User {name: 'Alice'})-[r:LOGGED_IN {result: '0'}]->"
                + "(d) RETURN d");
        assertEquals(List.of("graph-match (u:IdentityInfo)-[r:SigninLogs]->"
            + "(d)"), match.stages());
        assertEquals(List.of("u.AccountName == 'Alice'",
            "r.ResultType == '0'"), match.filters());

        MatchTranslator.MatchTranslation anonymous = translate(
            "MATCH (:User {age: 40})-->(d) RETURN d");
        assertEquals(List.of("graph-match (_n0:IdentityInfo)-->(d)"),
            anonymous.stages());
        assertEquals(List.of("_n0.Age == 40"), anonymous.filters());
    }

    @Test
    @DisplayName("Test bounded repetition and path variables")
    public void testVariableLength() throws Exception {
        assertEquals(List.of("graph-match p=(a:IdentityInfo)"
                + "-[k:UserRelationships*2..4]->(b)"),
            translate("MATCH p = (a:User)-[k:KNOWS*2..4]->(b) RETURN p")
                .stages());
    }

    @Test
    @DisplayName("Test shortestPath becomes its own stage")
    public void testShortestPathStage() throws Exception {
        MatchTranslator.MatchTranslation match = translate(
            "MATCH p = allShortestPaths((a:User {name: 'x'})-[:KNOWS*..3]->"
                + "(b:User)) RETURN p");
        assertEquals(List.of("graph-shortest-paths output=all "
                + "p=(a:IdentityInfo)-[:UserRelationships*1..3]->"
                + "(b:IdentityInfo)"),
            match.stages());
        assertEquals(List.of("a.AccountName == 'x'"), match.filters());
        assertTrue(match.enumeratesPaths());
    }

    @Test
    @DisplayName("Test allShortestPaths needs a bounded repetition")
    public void testAllShortestPathsBounds() throws Exception {
        assertThrows(EscalationRequiredException.class,
            () -> translate("MATCH p = allShortestPaths((a:User)-[:KNOWS*]->"
                + "(b:User)) RETURN p"));

        UnsupportedPatternException tooDeep = assertThrows(
            UnsupportedPatternException.class,
            () -> translate("MATCH p = allShortestPaths((a:User)-[:KNOWS*1..50]"
                + "->(b:User)) RETURN p"));
        assertEquals(UnsupportedPatternException.DEPTH_CEILING_EXCEEDED,
            tooDeep.getReasonCode());

        MatchTranslator.MatchTranslation single = translate(
            "MATCH p = shortestPath((a:User)-[:KNOWS*]->(b:User)) RETURN p");
        assertEquals(List.of("graph-shortest-paths output=any "
                + "p=(a:IdentityInfo)-[:UserRelationships*1..]->"
                + "(b:IdentityInfo)"),
            single.stages());
        assertFalse(single.enumeratesPaths());
    }

    @Test
    @DisplayName("Test unsupported pattern shapes")
    public void testRejected() {
        UnsupportedPatternException optional = assertThrows(
            UnsupportedPatternException.class,
            () -> translate("MATCH (a:User) OPTIONAL MATCH p = shortestPath("
                + "(a)-[:KNOWS*]-(b:User)) RETURN p"));
        assertEquals(UnsupportedPatternException.OPTIONAL_PATH_FUNCTION,
            optional.getReasonCode());

        UnsupportedPatternException properties = assertThrows(
            UnsupportedPatternException.class,
            () -> translate("MATCH (a)-[r:KNOWS*1..2 {weight: 1}]->(b) "
                + "RETURN b"));
        assertEquals(UnsupportedPatternException.VARIABLE_PATH_PROPERTIES,
            properties.getReasonCode());

        assertThrows(EscalationRequiredException.class,
            () -> translate("MATCH (a)-[:KNOWS*]->(b) RETURN b"));
    }
}
