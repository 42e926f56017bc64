package com.yellowstone.kql.ast;

/**
 * Repetition bounds of a variable-length relationship.
 *
 * <p>Either bound may be null: {@code *} has neither, {@code *2..} has no
 * maximum and {@code *..4} has no minimum (an absent minimum means 1).
 * A fixed {@code *3} is stored as 3..3.</p>
 *
 * @param min lower bound, or null
 * @param max upper bound, or null for an open-ended path
 */
public record PathLength(Integer min, Integer max) {

    /** Implicit lower bound when none is written. */
    public static final int DEFAULT_MIN = 1;

    public PathLength {
        if (min != null && min < 0) {
            throw new IllegalArgumentException(
                "Path length minimum must be non-negative: " + min);
        }
        if (max != null && max < 0) {
            throw new IllegalArgumentException(
                "Path length maximum must be non-negative: " + max);
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("Path length minimum " + min
                + " exceeds maximum " + max);
        }
    }

    /**
     * Create a fixed length.
     *
     * @param hops the exact hop count
     * @return the length
     */
    public static PathLength fixed(final int hops) {
        return new PathLength(hops, hops);
    }

    /**
     * Create a bounded range.
     *
     * @param min lower bound
     * @param max upper bound
     * @return the length
     */
    public static PathLength between(final int min, final int max) {
        return new PathLength(min, max);
    }

    /**
     * Create a fully unbounded length ({@code *}).
     *
     * @return the length
     */
    public static PathLength unbounded() {
        return new PathLength(null, null);
    }

    /**
     * Lower bound with the implicit default applied.
     *
     * @return the effective minimum
     */
    public int effectiveMin() {
        return min == null ? DEFAULT_MIN : min;
    }

    /**
     * Whether the path has no upper bound.
     *
     * @return true for {@code *} and {@code *n..}
     */
    public boolean isUnbounded() {
        return max == null;
    }

    /**
     * Cypher spelling, e.g. {@code *1..3}.
     *
     * @return the length text
     */
    public String toCypher() {
        if (min == null && max == null) {
            return "*";
        }
        if (min != null && min.equals(max)) {
            return "*" + min;
        }
        return "*" + (min == null ? "" : min) + ".." + (max == null ? "" : max);
    }
}
