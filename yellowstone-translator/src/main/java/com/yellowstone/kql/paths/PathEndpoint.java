package com.yellowstone.kql.paths;

import com.yellowstone.kql.ast.LiteralValue;
import com.yellowstone.kql.ast.NodePattern;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One end of a path search: a variable, an optional label and the property
 * values that pin it down.
 *
 * @param variable the variable naming the node
 * @param label the label, or null for any node
 * @param properties equality constraints on logical properties
 */
public record PathEndpoint(String variable, String label,
        Map<String, LiteralValue> properties) {

    public PathEndpoint {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(properties, "properties");
        if (variable.isBlank()) {
            throw new IllegalArgumentException("Endpoint variable is blank");
        }
        properties = Collections.unmodifiableMap(
            new LinkedHashMap<>(properties));
    }

    /**
     * Endpoint with a label and no constraints.
     *
     * @param variable the variable
     * @param label the label
     * @return the endpoint
     */
    public static PathEndpoint of(final String variable, final String label) {
        return new PathEndpoint(variable, label, Map.of());
    }

    /**
     * Endpoint pinned by one string property.
     *
     * @param variable the variable
     * @param label the label
     * @param property the logical property
     * @param value the required value
     * @return the endpoint
     */
    public static PathEndpoint of(final String variable, final String label,
            final String property, final String value) {
        return new PathEndpoint(variable, label,
            Map.of(property, new LiteralValue.StringValue(value)));
    }

    NodePattern toNodePattern() {
        return new NodePattern(variable,
            label == null ? List.of() : List.of(label), properties, 0);
    }
}
