package com.yellowstone.kql.schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Integrity checks for a {@link SchemaDocument}.
 *
 * <p>Errors make a document unusable; warnings point at inconsistencies in
 * table metadata that do not affect translation.</p>
 */
public final class SchemaValidator {

    /** Property types a mapping may declare. */
    public static final Set<String> PROPERTY_TYPES = Set.of("string", "int",
        "long", "datetime", "bool", "float", "double", "array", "object",
        "dynamic");

    /** Allowed relationship strengths. */
    public static final Set<String> STRENGTHS = Set.of("high", "medium",
        "low");

    /**
     * Outcome of validation.
     *
     * @param errors problems that make the document unusable
     * @param warnings metadata inconsistencies
     * @param nodeCount number of node labels
     * @param edgeCount number of relationship types
     * @param tableCount number of table metadata entries
     */
    public record ValidationResult(List<String> errors, List<String> warnings,
            int nodeCount, int edgeCount, int tableCount) {

        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        /**
         * Whether the document has no errors.
         *
         * @return true when valid
         */
        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    private SchemaValidator() {
        throw new AssertionError("No instances");
    }

    /**
     * Validate a schema document.
     *
     * @param document the document
     * @return errors and warnings
     */
    public static ValidationResult validate(final SchemaDocument document) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (isBlank(document.version())) {
            errors.add("Schema must have a version");
        }
        if (isBlank(document.description())) {
            errors.add("Schema must have a description");
        }
        if (document.nodes().isEmpty()) {
            warnings.add("Schema has no node mappings");
        }
        if (document.edges().isEmpty()) {
            warnings.add("Schema has no edge mappings");
        }
        if (document.tables().isEmpty()) {
            warnings.add("Schema has no table metadata");
        }

        document.nodes().forEach((label, node) -> {
            if (node.sentinelTables().isEmpty()) {
                errors.add("Node '" + label + "' missing sentinel_table");
            }
            checkProperties("Node '" + label + "'", node.properties(), true,
                errors);
        });

        document.edges().forEach((type, edge) -> {
            if (edge.sentinelTables().isEmpty()) {
                errors.add("Edge '" + type + "' missing sentinel_table");
            }
            if (isBlank(edge.description())) {
                warnings.add("Edge '" + type + "' has no description");
            }
            if (edge.fromLabel() != null
                    && !document.nodes().containsKey(edge.fromLabel())) {
                errors.add("Edge '" + type + "' references unknown from_label '"
                    + edge.fromLabel() + "'");
            }
            if (edge.toLabel() != null
                    && !document.nodes().containsKey(edge.toLabel())) {
                errors.add("Edge '" + type + "' references unknown to_label '"
                    + edge.toLabel() + "'");
            }
            if (!STRENGTHS.contains(edge.strength())) {
                errors.add("Edge '" + type + "' has strength '"
                    + edge.strength() + "', expected one of high, medium, low");
            }
            checkProperties("Edge '" + type + "'", edge.properties(), false,
                errors);
        });

        checkTableConsistency(document, warnings);
        checkCaseCollisions("label", document.nodes().keySet(), warnings);
        checkCaseCollisions("relationship type", document.edges().keySet(),
            warnings);

        return new ValidationResult(errors, warnings, document.nodes().size(),
            document.edges().size(), document.tables().size());
    }

    private static void checkProperties(final String owner,
            final Map<String, SchemaDocument.PropertyMapping> properties,
            final boolean fieldRequired, final List<String> errors) {
        properties.forEach((name, property) -> {
            if (fieldRequired && isBlank(property.sentinelField())) {
                errors.add(owner + " property '" + name
                    + "' missing sentinel_field");
            }
            if (property.type() == null
                    || !PROPERTY_TYPES.contains(property.type())) {
                errors.add(owner + " property '" + name + "' has type '"
                    + property.type() + "', expected one of "
                    + String.join(", ", PROPERTY_TYPES.stream().sorted()
                        .toList()));
            }
        });
    }

    private static void checkTableConsistency(final SchemaDocument document,
            final List<String> warnings) {
        if (document.tables().isEmpty()) {
            return;
        }
        Set<String> referenced = new LinkedHashSet<>();
        document.nodes().values().forEach(n ->
            referenced.addAll(n.sentinelTables()));
        document.edges().values().forEach(e ->
            referenced.addAll(e.sentinelTables()));

        for (String table : referenced) {
            if (!document.tables().containsKey(table)) {
                warnings.add("Table '" + table
                    + "' referenced by mappings but missing from tables metadata");
            }
        }
        for (String table : document.tables().keySet()) {
            if (!referenced.contains(table)) {
                warnings.add("Table '" + table
                    + "' defined in metadata but not referenced by any mapping");
            }
        }
        document.nodes().forEach((label, node) -> {
            for (String table : node.sentinelTables()) {
                SchemaDocument.TableMetadata meta = document.tables().get(table);
                if (meta == null || meta.fields().isEmpty()) {
                    continue;
                }
                node.properties().forEach((name, property) -> {
                    if (property.sentinelField() != null
                            && !meta.fields().contains(property.sentinelField())) {
                        warnings.add("Node '" + label + "' property '" + name
                            + "' maps to field '" + property.sentinelField()
                            + "' not listed for table '" + table + "'");
                    }
                });
            }
        });
    }

    private static void checkCaseCollisions(final String what,
            final Set<String> names, final List<String> warnings) {
        Map<String, String> seen = new HashMap<>();
        for (String name : names) {
            String previous = seen.putIfAbsent(name.toLowerCase(Locale.ROOT),
                name);
            if (previous != null) {
                warnings.add("The " + what + "s '" + previous + "' and '"
                    + name + "' differ only in case");
            }
        }
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }
}
