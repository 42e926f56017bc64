package com.yellowstone.kql.ast;

import java.util.Locale;

/**
 * Path functions that may wrap a pattern in MATCH.
 */
public enum PathFunction {
    /** Plain pattern. */
    NONE(null),
    /** {@code shortestPath(...)}. */
    SHORTEST_PATH("shortestPath"),
    /** {@code allShortestPaths(...)}. */
    ALL_SHORTEST_PATHS("allShortestPaths");

    /** Name as written in Cypher. */
    private final String cypherName;

    PathFunction(final String cypherName) {
        this.cypherName = cypherName;
    }

    /**
     * Gets the Cypher spelling of the function.
     *
     * @return the function name, or null for {@link #NONE}
     */
    public String cypherName() {
        return cypherName;
    }

    /**
     * Look up a path function by name, ignoring case.
     *
     * @param name the name as written
     * @return the function, or null when the name is not a path function
     */
    public static PathFunction fromName(final String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (PathFunction f : values()) {
            if (f.cypherName != null
                    && f.cypherName.toLowerCase(Locale.ROOT).equals(lower)) {
                return f;
            }
        }
        return null;
    }
}
