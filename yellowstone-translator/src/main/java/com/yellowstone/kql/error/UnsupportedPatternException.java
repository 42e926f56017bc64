package com.yellowstone.kql.error;

/**
 * Raised when a construct parses and resolves but has no faithful rendering
 * in the target language under the active configuration.
 */
public class UnsupportedPatternException extends TranslationException {

    /** Bounded path whose maximum exceeds the configured ceiling. */
    public static final String DEPTH_CEILING_EXCEEDED = "depth-ceiling-exceeded";

    /** Unbounded path rejected by configuration. */
    public static final String UNBOUNDED_PATH = "unbounded-path";

    /** Function with no target mapping. */
    public static final String UNMAPPED_FUNCTION = "unmapped-function";

    /** Function called with the wrong number of arguments. */
    public static final String FUNCTION_ARITY = "function-arity";

    /** Aggregate function used where only scalars are allowed. */
    public static final String MISPLACED_AGGREGATE = "misplaced-aggregate";

    /** Label or type backed by several entities under the REJECT policy. */
    public static final String MULTI_ENTITY = "multi-entity-reference";

    /** Node whose labels resolve to different backing entities. */
    public static final String CONFLICTING_LABELS = "conflicting-labels";

    /** ORDER BY key that cannot be sorted on. */
    public static final String UNSUPPORTED_ORDER_KEY = "unsupported-order-key";

    /** Property access on a path variable. */
    public static final String PATH_PROPERTY = "path-property";

    /** Path function inside OPTIONAL MATCH. */
    public static final String OPTIONAL_PATH_FUNCTION = "optional-path-function";

    /** Property map on a variable-length relationship. */
    public static final String VARIABLE_PATH_PROPERTIES =
        "variable-path-properties";

    /** Invalid options for a path algorithm. */
    public static final String INVALID_PATH_OPTIONS = "invalid-path-options";

    /** Offending sub-pattern text, may be null. */
    private final String subPattern;

    /**
     * Constructs a new UnsupportedPatternException.
     *
     * @param message the detail message
     * @param reasonCode one of the reason constants of this class
     * @param subPattern text of the offending sub-pattern, may be null
     * @param position offset of the construct, or negative when unknown
     */
    public UnsupportedPatternException(final String message,
            final String reasonCode, final String subPattern,
            final int position) {
        super(message, position, reasonCode);
        this.subPattern = subPattern;
    }

    /**
     * Constructs a new UnsupportedPatternException without location.
     *
     * @param message the detail message
     * @param reasonCode one of the reason constants of this class
     */
    public UnsupportedPatternException(final String message,
            final String reasonCode) {
        this(message, reasonCode, null, NO_POSITION);
    }

    /**
     * Gets the offending sub-pattern text.
     *
     * @return the sub-pattern, or null
     */
    public String getSubPattern() {
        return subPattern;
    }
}
