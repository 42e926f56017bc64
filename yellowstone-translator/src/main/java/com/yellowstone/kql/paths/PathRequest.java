package com.yellowstone.kql.paths;

import com.yellowstone.kql.ast.Direction;
import com.yellowstone.kql.ast.PathLength;
import java.util.List;
import java.util.Objects;

/**
 * Traversal settings shared by the path search entry points.
 *
 * @param relationshipTypes types to traverse, empty for any
 * @param direction traversal direction
 * @param length repetition bounds
 * @param pathVariable variable bound to each found path
 * @param relationshipVariable variable bound to the traversed edges
 */
public record PathRequest(List<String> relationshipTypes, Direction direction,
        PathLength length, String pathVariable, String relationshipVariable) {

    /** Default path variable. */
    public static final String DEFAULT_PATH_VARIABLE = "p";

    /** Default edge variable. */
    public static final String DEFAULT_RELATIONSHIP_VARIABLE = "e";

    public PathRequest {
        Objects.requireNonNull(relationshipTypes, "relationshipTypes");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(length, "length");
        Objects.requireNonNull(pathVariable, "pathVariable");
        Objects.requireNonNull(relationshipVariable, "relationshipVariable");
        relationshipTypes = List.copyOf(relationshipTypes);
    }

    /**
     * Outgoing, unbounded traversal over the given types.
     *
     * @param types relationship types
     * @return the request
     */
    public static PathRequest of(final String... types) {
        return new PathRequest(List.of(types), Direction.OUTGOING,
            PathLength.unbounded(), DEFAULT_PATH_VARIABLE,
            DEFAULT_RELATIONSHIP_VARIABLE);
    }

    /**
     * Copy with another direction.
     *
     * @param newDirection the direction
     * @return the request
     */
    public PathRequest withDirection(final Direction newDirection) {
        return new PathRequest(relationshipTypes, newDirection, length,
            pathVariable, relationshipVariable);
    }

    /**
     * Copy with other bounds.
     *
     * @param newLength the bounds
     * @return the request
     */
    public PathRequest withLength(final PathLength newLength) {
        return new PathRequest(relationshipTypes, direction, newLength,
            pathVariable, relationshipVariable);
    }
}
