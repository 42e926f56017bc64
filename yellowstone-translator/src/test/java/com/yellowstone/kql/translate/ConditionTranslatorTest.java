package com.yellowstone.kql.translate;

import com.yellowstone.kql.TestSchemas;
import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.error.UnsupportedPatternException;
import com.yellowstone.kql.parser.CypherParser;
import com.yellowstone.kql.schema.SchemaMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConditionTranslator.
 */
public class ConditionTranslatorTest {

    private static SchemaMapper mapper;

    @BeforeAll
    public static void setUpClass() {
        mapper = TestSchemas.testSchema();
    }

    private static String where(final String condition)
            throws TranslationException {
        Query query = CypherParser.parse("MATCH (u:User)-[r:LOGGED_IN]->"
            + "(d:Device) WHERE " + condition + " RETURN u");
        TranslationContext context = SchemaResolver.resolve(query, mapper,
            TranslatorConfig.defaults());
        return ConditionTranslator.translate(query.whereClause().condition(),
            context);
    }

    @Test
    @DisplayName("Test comparisons use physical field names and KQL operators")
    public void testComparisons() throws TranslationException {
        assertEquals("u.Age > 30", where("u.age > 30"));
        assertEquals("u.AccountName == 'alice'", where("u.name = 'alice'"));
        assertEquals("d.OSPlatform != 'linux'", where("d.os <> 'linux'"));
        assertEquals("r.ResultType <= 3", where("r.result <= 3"));
        assertEquals("u.Age >= 30", where("u.age >= 30"));
        assertEquals("u.Age < 18", where("u.age < 18"));
        assertEquals("d.OSPlatform != 'linux'", where("d.os != 'linux'"));
    }

    @Test
    @DisplayName("Test OR under AND keeps its parentheses")
    public void testPrecedence() throws TranslationException {
        assertEquals("u.Age > 30 and (u.AccountName == 'a' or "
                + "u.AccountName == 'b')",
            where("u.age > 30 AND (u.name = 'a' OR u.name = 'b')"));
        assertEquals("u.Age > 30 and u.Age < 40 or u.Department == 'IT'",
            where("u.age > 30 AND u.age < 40 OR u.department = 'IT'"));
        assertEquals("not(u.Age > 30 or u.Age < 10)",
            where("NOT (u.age > 30 OR u.age < 10)"));
    }

    @Test
    @DisplayName("Test string predicates, null checks and scalar functions")
    public void testOperatorsAndFunctions() throws TranslationException {
        assertEquals("u.AccountName startswith 'adm'",
            where("u.name STARTS WITH 'adm'"));
        assertEquals("u.AccountName endswith 'svc'",
            where("u.name ENDS WITH 'svc'"));
        assertEquals("u.AccountName contains 'x'",
            where("u.name CONTAINS 'x'"));
        assertEquals("isnull(u.Department)", where("u.department IS NULL"));
        assertEquals("isnotnull(u.Department)",
            where("u.department IS NOT NULL"));
        assertEquals("tolower(u.AccountName) == 'bob'",
            where("toLower(u.name) = 'bob'"));
        assertEquals("u.AccountName startswith 'a'",
            where("startsWith(u.name, 'a')"));
        assertEquals("coalesce(u.Department, 'none') == 'none'",
            where("coalesce(u.department, 'none') = 'none'"));
    }

    @Test
    @DisplayName("Test unmapped functions and aggregates are rejected")
    public void testRejected() {
        UnsupportedPatternException unknown = assertThrows(
            UnsupportedPatternException.class,
            () -> where("soundex(u.name) = 'x'"));
        assertEquals(UnsupportedPatternException.UNMAPPED_FUNCTION,
            unknown.getReasonCode());

        UnsupportedPatternException aggregate = assertThrows(
            UnsupportedPatternException.class,
            () -> where("count(u) > 1"));
        assertEquals(UnsupportedPatternException.MISPLACED_AGGREGATE,
            aggregate.getReasonCode());
    }
}
