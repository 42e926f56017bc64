package com.yellowstone.kql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yellowstone.kql.ast.Query;
import com.yellowstone.kql.parser.CypherParser;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EscalationRequest.
 */
public class EscalationRequestTest {

    private static EscalationRequest request() throws Exception {
        String cypher = "MATCH (a:User {name: 'x'})-[:KNOWS*]->(b) RETURN b";
        Query query = CypherParser.parse(cypher);
        return new EscalationRequest(query, cypher, "unbounded-path",
            "-[:KNOWS*]->", "Unbounded repetition * has no native rendering",
            new EscalationRequest.SchemaContext("test-1", List.of("User"),
                List.of("KNOWS"), List.of("Device", "User"),
                List.of("KNOWS")));
    }

    @Test
    @DisplayName("Test JSON payload carries reason and schema context")
    public void testToJson() throws Exception {
        JsonNode json = new ObjectMapper().readTree(request().toJson());

        assertEquals("unbounded-path", json.get("reasonCode").asText());
        assertEquals("-[:KNOWS*]->", json.get("subPattern").asText());
        assertEquals("test-1", json.get("schemaContext")
            .get("schemaVersion").asText());
        assertEquals("User", json.get("schemaContext")
            .get("referencedLabels").get(0).asText());
    }

    @Test
    @DisplayName("Test AST nodes are tagged with their type")
    public void testAstTypeTags() throws Exception {
        String text = request().toJson();
        assertTrue(text.contains("\"node\":\"Query\""), text);
        assertTrue(text.contains("\"node\":\"NodePattern\""), text);
        assertTrue(text.contains("\"literal\":"), text);
        assertFalse(text.contains("\"variableLength\""), text);
    }

    @Test
    @DisplayName("Test query and reason are required")
    public void testRequired() throws Exception {
        EscalationRequest valid = request();
        assertThrows(NullPointerException.class,
            () -> new EscalationRequest(null, "x", "r", null, "m",
                valid.schemaContext()));
        assertThrows(NullPointerException.class,
            () -> new EscalationRequest(valid.query(), "x", null, null, "m",
                valid.schemaContext()));
    }
}
