package com.yellowstone.kql;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.yellowstone.kql.ast.AstNode;
import com.yellowstone.kql.ast.LiteralValue;
import com.yellowstone.kql.ast.Query;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * Payload handed to the assisted translator for a query the rule-based
 * translator cannot render natively.
 *
 * <p>{@link #toJson()} produces a self-contained document: every AST node
 * carries its type name in a {@code "node"} field and every literal in a
 * {@code "literal"} field.</p>
 *
 * @param query the parsed query
 * @param cypher the original query text, null when translated from an AST
 * @param reasonCode why the query was escalated
 * @param subPattern the offending sub-pattern as Cypher text
 * @param message human readable explanation
 * @param schemaContext schema facts the collaborator needs
 */
public record EscalationRequest(Query query, String cypher, String reasonCode,
        String subPattern, String message, SchemaContext schemaContext) {

    /**
     * Schema facts attached to an escalation.
     *
     * @param schemaVersion version of the schema document
     * @param referencedLabels labels used by the query
     * @param referencedRelationshipTypes relationship types used by the query
     * @param availableLabels every mapped label
     * @param availableRelationshipTypes every mapped relationship type
     */
    public record SchemaContext(String schemaVersion,
            List<String> referencedLabels,
            List<String> referencedRelationshipTypes,
            List<String> availableLabels,
            List<String> availableRelationshipTypes) {

        public SchemaContext {
            referencedLabels = List.copyOf(referencedLabels);
            referencedRelationshipTypes = List.copyOf(
                referencedRelationshipTypes);
            availableLabels = List.copyOf(availableLabels);
            availableRelationshipTypes = List.copyOf(
                availableRelationshipTypes);
        }
    }

    private static final ObjectMapper JSON = JsonMapper.builder()
        .addMixIn(AstNode.class, AstNodeMixIn.class)
        .addMixIn(LiteralValue.class, LiteralValueMixIn.class)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .serializationInclusion(JsonInclude.Include.NON_NULL)
        .build();

    public EscalationRequest {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(reasonCode, "reasonCode");
        Objects.requireNonNull(schemaContext, "schemaContext");
    }

    /**
     * Serialize the payload.
     *
     * @return JSON text
     * @throws UncheckedIOException if serialization fails
     */
    public String toJson() {
        try {
            return JSON.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "node")
    @JsonIgnoreProperties({"variableLength", "aggregate", "unbounded"})
    private interface AstNodeMixIn {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, property = "literal")
    private interface LiteralValueMixIn {
    }
}
