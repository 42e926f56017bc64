package com.yellowstone.kql.ast;

import com.yellowstone.kql.visitor.AstVisitor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A relationship pattern such as {@code -[r:KNOWS*1..3]->}.
 *
 * @param variable bound variable, may be null
 * @param types alternative relationship types ({@code :A|B})
 * @param direction direction relative to the left node
 * @param properties property equality map in source order
 * @param length repetition bounds, null for a single hop
 * @param position offset of the first arrow character
 */
public record RelationshipPattern(String variable, List<String> types,
        Direction direction, Map<String, LiteralValue> properties,
        PathLength length, int position) implements AstNode {

    public RelationshipPattern {
        Objects.requireNonNull(types, "types");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(properties, "properties");
        types = List.copyOf(types);
        properties = Collections.unmodifiableMap(
            new LinkedHashMap<>(properties));
    }

    /**
     * Create a single-type relationship without properties.
     *
     * @param variable bound variable, may be null
     * @param type relationship type, may be null
     * @param direction direction
     * @param length repetition bounds, may be null
     * @return the pattern
     */
    public static RelationshipPattern of(final String variable,
            final String type, final Direction direction,
            final PathLength length) {
        return new RelationshipPattern(variable,
            type == null ? List.of() : List.of(type), direction, Map.of(),
            length, 0);
    }

    /**
     * Whether the relationship repeats (has a length specification).
     *
     * @return true for variable-length relationships
     */
    public boolean isVariableLength() {
        return length != null;
    }

    @Override
    public <R> R accept(final AstVisitor<R> visitor) {
        return visitor.visitRelationshipPattern(this);
    }
}
