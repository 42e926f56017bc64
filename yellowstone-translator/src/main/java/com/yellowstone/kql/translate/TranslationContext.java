package com.yellowstone.kql.translate;

import com.yellowstone.kql.TranslatorConfig;
import com.yellowstone.kql.ast.NodePattern;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.schema.BackingEntityRef;
import com.yellowstone.kql.schema.SchemaMapper;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the clause translators need about one query after schema
 * resolution: bindings, the tables to render for each pattern and the
 * physical name of every property the query touches.
 *
 * <p>A context is created per translation by {@link SchemaResolver} and is
 * read-only afterwards. Patterns are keyed by identity since structurally
 * equal patterns may appear more than once in a query.</p>
 */
public final class TranslationContext {

    private final SchemaMapper mapper;
    private final TranslatorConfig config;
    private final Map<String, VariableBinding> bindings;
    private final Map<NodePattern, String> nodeVariables;
    private final Map<NodePattern, List<BackingEntityRef>> nodeEntities;
    private final Map<RelationshipPattern, String> relationshipVariables;
    private final Map<RelationshipPattern, List<BackingEntityRef>>
        relationshipEntities;
    private final Map<String, String> physicalProperties;
    private final List<String> approximations;
    private final List<String> secondAttempts;

    TranslationContext(final SchemaMapper mapper, final TranslatorConfig config,
            final Map<String, VariableBinding> bindings,
            final IdentityHashMap<NodePattern, String> nodeVariables,
            final IdentityHashMap<NodePattern, List<BackingEntityRef>>
                nodeEntities,
            final IdentityHashMap<RelationshipPattern, String>
                relationshipVariables,
            final IdentityHashMap<RelationshipPattern, List<BackingEntityRef>>
                relationshipEntities,
            final Map<String, String> physicalProperties,
            final List<String> approximations,
            final List<String> secondAttempts) {
        this.mapper = mapper;
        this.config = config;
        this.bindings = Collections.unmodifiableMap(
            new LinkedHashMap<>(bindings));
        this.nodeVariables = Collections.unmodifiableMap(
            new IdentityHashMap<>(nodeVariables));
        this.nodeEntities = Collections.unmodifiableMap(
            new IdentityHashMap<>(nodeEntities));
        this.relationshipVariables = Collections.unmodifiableMap(
            new IdentityHashMap<>(relationshipVariables));
        this.relationshipEntities = Collections.unmodifiableMap(
            new IdentityHashMap<>(relationshipEntities));
        this.physicalProperties = Map.copyOf(physicalProperties);
        this.approximations = List.copyOf(approximations);
        this.secondAttempts = List.copyOf(secondAttempts);
    }

    static String propertyKey(final String variable, final String property) {
        return variable + "." + property;
    }

    /**
     * The schema mapper used for resolution.
     *
     * @return the mapper
     */
    public SchemaMapper getMapper() {
        return mapper;
    }

    /**
     * The active configuration.
     *
     * @return the configuration
     */
    public TranslatorConfig getConfig() {
        return config;
    }

    /**
     * Bindings in order of first appearance, generated ones included.
     *
     * @return unmodifiable bindings by name
     */
    public Map<String, VariableBinding> getBindings() {
        return bindings;
    }

    /**
     * Binding of a name.
     *
     * @param name the variable
     * @return the binding, or null when unbound
     */
    public VariableBinding binding(final String name) {
        return bindings.get(name);
    }

    /**
     * Variable to render for a node pattern, generated for anonymous nodes
     * with property maps.
     *
     * @param node the pattern
     * @return the variable, or null for an anonymous node
     */
    public String variableOf(final NodePattern node) {
        return node.variable() != null ? node.variable()
            : nodeVariables.get(node);
    }

    /**
     * Variable to render for a relationship pattern.
     *
     * @param rel the pattern
     * @return the variable, or null for an anonymous relationship
     */
    public String variableOf(final RelationshipPattern rel) {
        return rel.variable() != null ? rel.variable()
            : relationshipVariables.get(rel);
    }

    /**
     * Tables to render for a node pattern, after the multi-entity policy.
     *
     * @param node the pattern
     * @return the tables, empty for an unlabeled node
     */
    public List<BackingEntityRef> entitiesOf(final NodePattern node) {
        return nodeEntities.getOrDefault(node, List.of());
    }

    /**
     * Tables to render for a relationship pattern, after the multi-entity
     * policy.
     *
     * @param rel the pattern
     * @return the tables, empty for an untyped relationship
     */
    public List<BackingEntityRef> entitiesOf(final RelationshipPattern rel) {
        return relationshipEntities.getOrDefault(rel, List.of());
    }

    /**
     * Physical field of a property of a bound variable.
     *
     * @param variable the variable
     * @param property the logical property
     * @return the physical field
     * @throws IllegalStateException if the property was not resolved, which
     *         means the expression was not part of the resolved query
     */
    public String physicalProperty(final String variable,
            final String property) {
        String physical = physicalProperties.get(propertyKey(variable,
            property));
        if (physical == null) {
            throw new IllegalStateException("Property " + variable + "."
                + property + " was not resolved against the schema");
        }
        return physical;
    }

    /**
     * Notes on every multi-entity approximation made.
     *
     * @return one note per approximated label or type
     */
    public List<String> getApproximations() {
        return approximations;
    }

    /**
     * Notes on every reference resolved by a case-insensitive match.
     *
     * @return one note per such reference
     */
    public List<String> getSecondAttempts() {
        return secondAttempts;
    }
}
