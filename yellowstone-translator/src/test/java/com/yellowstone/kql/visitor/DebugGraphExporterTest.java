package com.yellowstone.kql.visitor;

import com.yellowstone.kql.error.TranslationException;
import com.yellowstone.kql.parser.CypherParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DebugGraphExporter.
 */
public class DebugGraphExporterTest {

    @Test
    @DisplayName("Test export produces a DOT digraph rooted at the query")
    public void testExport() throws TranslationException {
        String dot = DebugGraphExporter.export(CypherParser.parse(
            "MATCH (u:User)-[:LOGGED_IN]->(d) WHERE u.name = 'x' "
                + "RETURN DISTINCT d LIMIT 5"));

        assertTrue(dot.startsWith("digraph ast {\n"));
        assertTrue(dot.endsWith("}\n"));
        assertTrue(dot.contains("n0 [label=\"Query\"]"));
        assertTrue(dot.contains("label=\"Node (u:User)\""));
        assertTrue(dot.contains("label=\"Rel -[:LOGGED_IN]->\""));
        assertTrue(dot.contains("label=\"RETURN DISTINCT LIMIT 5\""));
        assertTrue(dot.contains("n0 -> n1;"));
    }

    @Test
    @DisplayName("Test quotes in labels are escaped")
    public void testEscaping() throws TranslationException {
        String dot = DebugGraphExporter.export(CypherParser.parse(
            "MATCH (u) WHERE u.name = 'say \"hi\"' RETURN u"));
        assertTrue(dot.contains("\\\"hi\\\""));
    }
}
