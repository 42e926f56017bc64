package com.yellowstone.kql.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson binding of a schema file.
 *
 * <pre>{@code
 * version: "1.0.0"
 * description: Sentinel security graph
 * nodes:
 *   User:
 *     sentinel_table: IdentityInfo
 *     properties:
 *       name: {sentinel_field: AccountName, type: string}
 * edges:
 *   LOGGED_IN:
 *     description: User signed in to a device
 *     from_label: User
 *     to_label: Device
 *     sentinel_table: SigninLogs
 * tables:
 *   IdentityInfo: {description: Identity data, retention_days: 90}
 * }</pre>
 *
 * <p>{@code sentinel_table} accepts a single name or a list.</p>
 *
 * @param version schema version
 * @param description schema description
 * @param nodes node label mappings, in document order
 * @param edges relationship type mappings, in document order
 * @param tables table metadata, in document order
 */
public record SchemaDocument(String version, String description,
        Map<String, NodeMapping> nodes, Map<String, EdgeMapping> edges,
        Map<String, TableMetadata> tables) {

    public SchemaDocument {
        nodes = ordered(nodes);
        edges = ordered(edges);
        tables = ordered(tables);
    }

    /**
     * Mapping of a node label.
     *
     * @param sentinelTables backing tables, first is primary
     * @param properties logical property mappings
     */
    public record NodeMapping(
            @JsonProperty("sentinel_table") List<String> sentinelTables,
            Map<String, PropertyMapping> properties) {

        public NodeMapping {
            sentinelTables = sentinelTables == null ? List.of()
                : List.copyOf(sentinelTables);
            properties = ordered(properties);
        }
    }

    /**
     * Mapping of a relationship type.
     *
     * @param description human readable description
     * @param fromLabel label of the source node
     * @param toLabel label of the target node
     * @param sentinelTables backing tables, first is primary
     * @param sentinelJoin join metadata between endpoint tables, may be null
     * @param strength join reliability: high, medium or low
     * @param properties logical property mappings
     */
    public record EdgeMapping(String description,
            @JsonProperty("from_label") String fromLabel,
            @JsonProperty("to_label") String toLabel,
            @JsonProperty("sentinel_table") List<String> sentinelTables,
            @JsonProperty("sentinel_join") JoinCondition sentinelJoin,
            String strength,
            Map<String, PropertyMapping> properties) {

        public EdgeMapping {
            sentinelTables = sentinelTables == null ? List.of()
                : List.copyOf(sentinelTables);
            strength = strength == null ? "medium" : strength;
            properties = ordered(properties);
        }
    }

    /**
     * Join metadata of a relationship.
     *
     * @param leftTable left table
     * @param rightTable right table
     * @param joinCondition join condition text
     */
    public record JoinCondition(
            @JsonProperty("left_table") String leftTable,
            @JsonProperty("right_table") String rightTable,
            @JsonProperty("join_condition") String joinCondition) {
    }

    /**
     * Mapping of one logical property.
     *
     * @param sentinelField physical field; for relationship properties a
     *        missing field means the field carries the logical name
     * @param type declared type
     * @param required whether the field is always present
     */
    public record PropertyMapping(
            @JsonProperty("sentinel_field") String sentinelField,
            String type,
            boolean required) {
    }

    /**
     * Metadata of a physical table.
     *
     * @param description table description
     * @param retentionDays retention period, may be null
     * @param fields known field names
     */
    public record TableMetadata(String description,
            @JsonProperty("retention_days") Integer retentionDays,
            List<String> fields) {

        public TableMetadata {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }
    }

    private static <V> Map<String, V> ordered(final Map<String, V> map) {
        return map == null ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
