package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node pattern such as {@code (u:User {name: 'Alice'})}.
 *
 * @param variable bound variable, may be null
 * @param labels labels in source order
 * @param properties property equality map in source order
 * @param position offset of the opening parenthesis
 */
public record NodePattern(String variable, List<String> labels,
        Map<String, LiteralValue> properties, int position)
        implements AstNode {

    public NodePattern {
        Objects.requireNonNull(labels, "labels");
        Objects.requireNonNull(properties, "properties");
        labels = List.copyOf(labels);
        properties = Collections.unmodifiableMap(
            new LinkedHashMap<>(properties));
    }

    /**
     * Create a node pattern with no property map.
     *
     * @param variable bound variable, may be null
     * @param labels labels
     * @return the pattern
     */
    public static NodePattern of(final String variable,
            final String... labels) {
        return new NodePattern(variable, List.of(labels), Map.of(), 0);
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitNodePattern(this);
    }
}
