package com.yellowstone.kql.translate;

import com.yellowstone.kql.TestSchemas;
import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.Literal;
import com.yellowstone.kql.ast.LiteralValue;
import com.yellowstone.kql.ast.Query;
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
 * Unit tests for ProjectionTranslator.
 */
public class ProjectionTranslatorTest {

    private static SchemaMapper mapper;

    @BeforeAll
    public static void setUpClass() {
        mapper = TestSchemas.testSchema();
    }

    private static ProjectionTranslator.ProjectionTranslation project(
            final String cypher) throws TranslationException {
        Query query = CypherParser.parse(cypher);
        TranslationContext context = SchemaResolver.resolve(query, mapper,
            TranslatorConfig.defaults());
        return ProjectionTranslator.translate(query.returnClause(), context);
    }

    @Test
    @DisplayName("Test plain projection with derived and explicit names")
    public void testProject() throws TranslationException {
        ProjectionTranslator.ProjectionTranslation projection = project(
            "MATCH (u:User)-[:LOGGED_IN]->(d:Device) "
                + "RETURN u.name, d.os AS platform, d");
        assertEquals(List.of("project u_name = u.AccountName, "
            + "platform = d.OSPlatform, d"), projection.stages());
        assertEquals(List.of("u_name", "platform", "d"),
            projection.columns());
        assertFalse(projection.aggregating());
    }

    @Test
    @DisplayName("Test duplicate column names get numeric suffixes")
    public void testDuplicateNames() throws TranslationException {
        assertEquals(List.of("project u_name = u.AccountName, "
                + "u_name_2 = u.AccountName"),
            project("MATCH (u:User) RETURN u.name, u.name").stages());
    }

    @Test
    @DisplayName("Test wildcard projects the bound variables")
    public void testWildcard() throws TranslationException {
        assertEquals(List.of("project a, b, r"),
            project("MATCH (a:User)-[r:KNOWS]->(b) RETURN *").stages());
    }

    @Test
    @DisplayName("Test aggregation becomes summarize with grouping keys")
    public void testSummarize() throws TranslationException {
        ProjectionTranslator.ProjectionTranslation projection = project(
            "MATCH (u:User) RETURN u.department, count(*) AS n "
                + "ORDER BY n DESC LIMIT 5");
        assertEquals(List.of("summarize n = count() by "
                + "u_department = u.Department",
                "sort by n desc", "take 5"),
            projection.stages());
        assertTrue(projection.aggregating());
    }

    @Test
    @DisplayName("Test summarize is reordered back to the RETURN order")
    public void testReorder() throws TranslationException {
        assertEquals(List.of("summarize n = count() by dept = u.Department",
                "project-reorder n, dept"),
            project("MATCH (u:User) RETURN count(*) AS n, "
                + "u.department AS dept").stages());
    }

    @Test
    @DisplayName("Test aggregate variants")
    public void testAggregateVariants() throws TranslationException {
        assertEquals(List.of("summarize count_u_name = dcount(u.AccountName), "
                + "count_d = count(), collect_d_os = make_list(d.OSPlatform)"),
            project("MATCH (u:User)-[:LOGGED_IN]->(d:Device) "
                + "RETURN count(DISTINCT u.name), count(d), collect(d.os)")
                .stages());
    }

    @Test
    @DisplayName("Test ORDER BY on a returned expression sorts after projection")
    public void testPostSort() throws TranslationException {
        assertEquals(List.of("project u_name = u.AccountName",
                "sort by u_name desc", "skip 2", "take 3"),
            project("MATCH (u:User) RETURN u.name ORDER BY u.name DESC "
                + "SKIP 2 LIMIT 3").stages());
    }

    @Test
    @DisplayName("Test ORDER BY on a dropped expression sorts before projection")
    public void testPreSort() throws TranslationException {
        assertEquals(List.of("sort by u.Age asc",
                "project u_name = u.AccountName", "take 3"),
            project("MATCH (u:User) RETURN u.name ORDER BY u.age LIMIT 3")
                .stages());
    }

    @Test
    @DisplayName("Test explicit ASC and mixed sort directions")
    public void testExplicitAscending() throws TranslationException {
        assertEquals(List.of("project u_department = u.Department, "
                + "u_name = u.AccountName",
                "sort by u_department asc, u_name desc"),
            project("MATCH (u:User) RETURN u.department, u.name "
                + "ORDER BY u.department ASC, u.name DESC").stages());
    }

    @Test
    @DisplayName("Test ORDER BY prefers a RETURN alias over a variable of the same name")
    public void testAliasShadowsVariable() throws TranslationException {
        assertEquals(List.of("project n = u.AccountName", "sort by n asc"),
            project("MATCH (u:User), (n:Device) RETURN u.name AS n "
                + "ORDER BY n").stages());
        assertEquals(List.of("project n = u.AccountName, d = n",
                "sort by n desc"),
            project("MATCH (u:User), (n:Device) RETURN u.name AS n, n AS d "
                + "ORDER BY n DESC").stages());
    }

    @Test
    @DisplayName("Test DISTINCT projection")
    public void testDistinct() throws TranslationException {
        assertEquals(List.of("project u_department = u.Department",
                "distinct *", "sort by u_department asc"),
            project("MATCH (u:User) RETURN DISTINCT u.department "
                + "ORDER BY u.department").stages());
    }

    @Test
    @DisplayName("Test unreturned ORDER BY keys are rejected with DISTINCT or aggregation")
    public void testUnsupportedOrderKey() {
        UnsupportedPatternException distinct = assertThrows(
            UnsupportedPatternException.class,
            () -> project("MATCH (u:User) RETURN DISTINCT u.name "
                + "ORDER BY u.age"));
        assertEquals(UnsupportedPatternException.UNSUPPORTED_ORDER_KEY,
            distinct.getReasonCode());
        assertThrows(UnsupportedPatternException.class,
            () -> project("MATCH (u:User) RETURN u.department, count(*) "
                + "ORDER BY u.age"));
    }

    @Test
    @DisplayName("Test aggregates nested in scalar functions are rejected")
    public void testNestedAggregate() {
        UnsupportedPatternException e = assertThrows(
            UnsupportedPatternException.class,
            () -> project("MATCH (u:User) RETURN toString(count(*))"));
        assertEquals(UnsupportedPatternException.MISPLACED_AGGREGATE,
            e.getReasonCode());
    }

    @Test
    @DisplayName("Test derived column names")
    public void testDerivedName() throws TranslationException {
        Query query = CypherParser.parse("MATCH (u:User) RETURN "
            + "toUpper(u.name), count(*), u");
        assertEquals("toupper_u_name", ProjectionTranslator.derivedName(
            query.returnClause().items().get(0).expression(), 1));
        assertEquals("count", ProjectionTranslator.derivedName(
            query.returnClause().items().get(1).expression(), 2));
        assertEquals("u", ProjectionTranslator.derivedName(
            query.returnClause().items().get(2).expression(), 3));
        assertEquals("Column4", ProjectionTranslator.derivedName(
            new Literal(new LiteralValue.IntegerValue(1)), 4));
    }
}
