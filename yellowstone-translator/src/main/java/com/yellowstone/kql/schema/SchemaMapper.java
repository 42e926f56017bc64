package com.yellowstone.kql.schema;

import com.yellowstone.kql.error.UnresolvedSchemaReferenceException;
import com.yellowstone.kql.error.UnresolvedSchemaReferenceException.ReferenceKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves logical labels, relationship types and properties to the tables
 * and fields of the event store.
 *
 * <p>A mapper is built once from a validated {@link SchemaDocument} and is
 * immutable afterwards, so one instance can be shared by concurrent
 * translations. Obtain one from {@link SchemaLoader}.</p>
 *
 * <h2>Lookup:</h2>
 * <p>Names are matched exactly first. The {@code lookup*} methods can fall
 * back to a case-insensitive match, which is accepted only when exactly one
 * name matches; such a result is flagged as a second attempt so callers can
 * report it. The {@code resolve*} methods match exactly.</p>
 */
public final class SchemaMapper {

    /**
     * Outcome of a lookup.
     *
     * @param value the resolved value
     * @param requested the name as written in the query
     * @param matchedName the schema name that matched
     * @param secondAttempt whether the match was case-insensitive only
     * @param <T> value type
     */
    public record Resolution<T>(T value, String requested, String matchedName,
            boolean secondAttempt) {
    }

    /**
     * A resolved property.
     *
     * @param logicalName property name used in queries
     * @param physicalName field name in the table
     * @param type declared type
     */
    public record ResolvedProperty(String logicalName, String physicalName,
            String type) {
    }

    /**
     * Summary of the loaded schema.
     *
     * @param version schema version
     * @param description schema description
     * @param labels node labels
     * @param relationshipTypes relationship types
     * @param tables every table referenced or described
     */
    public record SchemaInfo(String version, String description,
            List<String> labels, List<String> relationshipTypes,
            List<String> tables) {
    }

    private final SchemaDocument document;
    private final Map<String, List<BackingEntityRef>> labelEntities;
    private final Map<String, List<BackingEntityRef>> typeEntities;
    private final Map<String, Map<String, ResolvedProperty>> nodeProperties;
    private final Map<String, Map<String, ResolvedProperty>> edgeProperties;

    /**
     * Creates a mapper. The document is expected to be valid; use
     * {@link SchemaLoader} to validate while loading.
     *
     * @param document the schema document
     */
    public SchemaMapper(final SchemaDocument document) {
        this.document = Objects.requireNonNull(document, "document");
        this.labelEntities = new LinkedHashMap<>();
        this.nodeProperties = new LinkedHashMap<>();
        document.nodes().forEach((label, node) -> {
            labelEntities.put(label, entities(EntityKind.NODE, label,
                node.sentinelTables()));
            nodeProperties.put(label, properties(node.properties()));
        });
        this.typeEntities = new LinkedHashMap<>();
        this.edgeProperties = new LinkedHashMap<>();
        document.edges().forEach((type, edge) -> {
            typeEntities.put(type, entities(EntityKind.RELATIONSHIP, type,
                edge.sentinelTables()));
            edgeProperties.put(type, properties(edge.properties()));
        });
    }

    private static List<BackingEntityRef> entities(final EntityKind kind,
            final String name, final List<String> tables) {
        List<BackingEntityRef> refs = new ArrayList<>();
        for (String table : tables) {
            refs.add(new BackingEntityRef(kind, name, table));
        }
        return List.copyOf(refs);
    }

    private static Map<String, ResolvedProperty> properties(
            final Map<String, SchemaDocument.PropertyMapping> mappings) {
        Map<String, ResolvedProperty> result = new LinkedHashMap<>();
        mappings.forEach((name, mapping) -> result.put(name,
            new ResolvedProperty(name, mapping.sentinelField() == null
                ? name : mapping.sentinelField(), mapping.type())));
        return Collections.unmodifiableMap(result);
    }

    /**
     * Resolve a label exactly.
     *
     * @param label the label
     * @return backing entities, first is primary
     * @throws UnresolvedSchemaReferenceException if the label is unmapped
     */
    public List<BackingEntityRef> resolveLabel(final String label)
            throws UnresolvedSchemaReferenceException {
        return lookupLabel(label, false).value();
    }

    /**
     * Resolve a label, optionally falling back to a case-insensitive match.
     *
     * @param label the label
     * @param caseInsensitive whether to try a case-insensitive match
     * @return the resolution
     * @throws UnresolvedSchemaReferenceException if the label is unmapped
     */
    public Resolution<List<BackingEntityRef>> lookupLabel(final String label,
            final boolean caseInsensitive)
            throws UnresolvedSchemaReferenceException {
        return lookup(labelEntities, label, caseInsensitive,
            ReferenceKind.LABEL);
    }

    /**
     * Resolve a relationship type exactly.
     *
     * @param type the relationship type
     * @return backing entities, first is primary
     * @throws UnresolvedSchemaReferenceException if the type is unmapped
     */
    public List<BackingEntityRef> resolveRelationshipType(final String type)
            throws UnresolvedSchemaReferenceException {
        return lookupRelationshipType(type, false).value();
    }

    /**
     * Resolve a relationship type, optionally falling back to a
     * case-insensitive match.
     *
     * @param type the relationship type
     * @param caseInsensitive whether to try a case-insensitive match
     * @return the resolution
     * @throws UnresolvedSchemaReferenceException if the type is unmapped
     */
    public Resolution<List<BackingEntityRef>> lookupRelationshipType(
            final String type, final boolean caseInsensitive)
            throws UnresolvedSchemaReferenceException {
        return lookup(typeEntities, type, caseInsensitive,
            ReferenceKind.RELATIONSHIP_TYPE);
    }

    /**
     * Resolve a property of one backing entity exactly.
     *
     * @param entity the entity
     * @param logicalName the property name used in the query
     * @return the physical field name
     * @throws UnresolvedSchemaReferenceException if the property is unmapped
     */
    public String resolveProperty(final BackingEntityRef entity,
            final String logicalName)
            throws UnresolvedSchemaReferenceException {
        return lookupProperty(List.of(entity), logicalName, false).value()
            .physicalName();
    }

    /**
     * Resolve a property shared by several backing entities. Every entity must
     * map the property to the same physical field.
     *
     * @param entities the entities, not empty
     * @param logicalName the property name used in the query
     * @return the physical field name
     * @throws UnresolvedSchemaReferenceException if any entity lacks the
     *         property or the entities disagree on its field
     */
    public String resolveProperty(final List<BackingEntityRef> entities,
            final String logicalName)
            throws UnresolvedSchemaReferenceException {
        return lookupProperty(entities, logicalName, false).value()
            .physicalName();
    }

    /**
     * Resolve a property shared by several backing entities, optionally
     * falling back to a case-insensitive match.
     *
     * @param entities the entities, not empty
     * @param logicalName the property name used in the query
     * @param caseInsensitive whether to try a case-insensitive match
     * @return the resolution
     * @throws UnresolvedSchemaReferenceException if the property does not
     *         resolve to a single field
     */
    public Resolution<ResolvedProperty> lookupProperty(
            final List<BackingEntityRef> entities, final String logicalName,
            final boolean caseInsensitive)
            throws UnresolvedSchemaReferenceException {
        if (entities.isEmpty()) {
            throw new IllegalArgumentException("No entities to resolve against");
        }
        Resolution<ResolvedProperty> agreed = null;
        Set<String> owners = new LinkedHashSet<>();
        for (BackingEntityRef entity : entities) {
            if (!owners.add(entity.kind() + ":" + entity.logicalName())) {
                continue;
            }
            Map<String, ResolvedProperty> table = propertyTable(entity);
            Resolution<ResolvedProperty> next = lookup(table, logicalName,
                caseInsensitive, ReferenceKind.PROPERTY);
            if (agreed != null && !agreed.value().physicalName()
                    .equals(next.value().physicalName())) {
                throw new UnresolvedSchemaReferenceException(logicalName,
                    ReferenceKind.PROPERTY, List.of(
                        agreed.value().physicalName(),
                        next.value().physicalName()));
            }
            if (agreed == null || next.secondAttempt()) {
                agreed = next;
            }
        }
        return agreed;
    }

    /**
     * Resolve a property of a variable that carries no label. The property
     * resolves only when every label or type declaring it maps it to the
     * same physical field.
     *
     * @param kind whether the variable is a node or a relationship
     * @param logicalName the property name used in the query
     * @param caseInsensitive whether to try a case-insensitive match
     * @return the resolution
     * @throws UnresolvedSchemaReferenceException if no mapping declares the
     *         property or the declarations disagree
     */
    public Resolution<ResolvedProperty> resolveUnlabeledProperty(
            final EntityKind kind, final String logicalName,
            final boolean caseInsensitive)
            throws UnresolvedSchemaReferenceException {
        Map<String, Map<String, ResolvedProperty>> tables =
            kind == EntityKind.NODE ? nodeProperties : edgeProperties;
        Resolution<ResolvedProperty> found = collectUnlabeled(tables,
            logicalName, false);
        if (found == null && caseInsensitive) {
            found = collectUnlabeled(tables, logicalName, true);
        }
        if (found == null) {
            Set<String> all = new TreeSet<>();
            tables.values().forEach(t -> all.addAll(t.keySet()));
            throw new UnresolvedSchemaReferenceException(logicalName,
                ReferenceKind.PROPERTY, List.copyOf(all));
        }
        return found;
    }

    private Resolution<ResolvedProperty> collectUnlabeled(
            final Map<String, Map<String, ResolvedProperty>> tables,
            final String logicalName, final boolean ignoreCase)
            throws UnresolvedSchemaReferenceException {
        Map<String, ResolvedProperty> byField = new LinkedHashMap<>();
        Set<String> declarations = new TreeSet<>();
        for (Map.Entry<String, Map<String, ResolvedProperty>> owner
                : tables.entrySet()) {
            for (ResolvedProperty property : owner.getValue().values()) {
                boolean matches = ignoreCase
                    ? property.logicalName().equalsIgnoreCase(logicalName)
                    : property.logicalName().equals(logicalName);
                if (matches) {
                    byField.putIfAbsent(property.physicalName(), property);
                    declarations.add(owner.getKey() + "."
                        + property.logicalName() + " -> "
                        + property.physicalName());
                }
            }
        }
        if (byField.isEmpty()) {
            return null;
        }
        if (byField.size() > 1) {
            throw new UnresolvedSchemaReferenceException(logicalName,
                ReferenceKind.PROPERTY, List.copyOf(declarations));
        }
        ResolvedProperty property = byField.values().iterator().next();
        return new Resolution<>(property, logicalName, property.logicalName(),
            ignoreCase);
    }

    private Map<String, ResolvedProperty> propertyTable(
            final BackingEntityRef entity) {
        Map<String, Map<String, ResolvedProperty>> tables =
            entity.kind() == EntityKind.NODE ? nodeProperties : edgeProperties;
        return tables.getOrDefault(entity.logicalName(), Map.of());
    }

    private static <T> Resolution<T> lookup(final Map<String, T> table,
            final String name, final boolean caseInsensitive,
            final ReferenceKind kind)
            throws UnresolvedSchemaReferenceException {
        T exact = table.get(name);
        if (exact != null) {
            return new Resolution<>(exact, name, name, false);
        }
        if (caseInsensitive) {
            String match = null;
            int matches = 0;
            for (String candidate : table.keySet()) {
                if (candidate.equalsIgnoreCase(name)) {
                    match = candidate;
                    matches++;
                }
            }
            if (matches == 1) {
                return new Resolution<>(table.get(match), name, match, true);
            }
        }
        throw new UnresolvedSchemaReferenceException(name, kind,
            List.copyOf(new TreeSet<>(table.keySet())));
    }

    /**
     * Node labels in document order.
     *
     * @return the labels
     */
    public List<String> getLabels() {
        return List.copyOf(labelEntities.keySet());
    }

    /**
     * Relationship types in document order.
     *
     * @return the types
     */
    public List<String> getRelationshipTypes() {
        return List.copyOf(typeEntities.keySet());
    }

    /**
     * Every table referenced by a mapping or described in metadata.
     *
     * @return table names, mappings first in document order
     */
    public List<String> getTables() {
        Set<String> tables = new LinkedHashSet<>();
        labelEntities.values().forEach(refs ->
            refs.forEach(r -> tables.add(r.entityId())));
        typeEntities.values().forEach(refs ->
            refs.forEach(r -> tables.add(r.entityId())));
        tables.addAll(document.tables().keySet());
        return List.copyOf(tables);
    }

    /**
     * Known fields of a table, from its metadata.
     *
     * @param table the table name
     * @return the fields, empty when the table has no metadata
     */
    public List<String> getTableFields(final String table) {
        SchemaDocument.TableMetadata meta = document.tables().get(table);
        return meta == null ? List.of() : meta.fields();
    }

    /**
     * Logical properties declared for a label.
     *
     * @param label the label
     * @return properties by logical name, empty for an unknown label
     */
    public Map<String, ResolvedProperty> getProperties(final String label) {
        return nodeProperties.getOrDefault(label, Map.of());
    }

    /**
     * Mapping of a relationship type, including endpoints and join metadata.
     *
     * @param type the relationship type
     * @return the mapping, or empty for an unknown type
     */
    public Optional<SchemaDocument.EdgeMapping> getRelationshipMapping(
            final String type) {
        return Optional.ofNullable(document.edges().get(type));
    }

    /**
     * Relationship types declared from one label to another.
     *
     * @param fromLabel source label
     * @param toLabel target label
     * @return matching types in document order
     */
    public List<String> relationshipsBetween(final String fromLabel,
            final String toLabel) {
        List<String> result = new ArrayList<>();
        document.edges().forEach((type, edge) -> {
            if (fromLabel.equals(edge.fromLabel())
                    && toLabel.equals(edge.toLabel())) {
                result.add(type);
            }
        });
        return result;
    }

    /**
     * Schema version.
     *
     * @return the version
     */
    public String getVersion() {
        return document.version();
    }

    /**
     * Summary of the loaded schema.
     *
     * @return the schema info
     */
    public SchemaInfo schemaInfo() {
        return new SchemaInfo(document.version(), document.description(),
            getLabels(), getRelationshipTypes(), getTables());
    }
}
