package com.yellowstone.kql.paths;

/**
 * Whether enumerated paths may revisit nodes.
 */
public enum CyclePolicy {
    /** Paths never revisit a node ({@code cycles=none}). */
    FORBIDDEN("none"),
    /** Paths may revisit nodes up to the depth bound ({@code cycles=all}). */
    BOUNDED_ALLOWED("all");

    private final String kqlValue;

    CyclePolicy(final String kqlValue) {
        this.kqlValue = kqlValue;
    }

    /**
     * Value of the {@code cycles} option.
     *
     * @return the option value
     */
    public String kqlValue() {
        return kqlValue;
    }
}
