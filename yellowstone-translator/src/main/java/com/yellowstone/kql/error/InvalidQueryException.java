package com.yellowstone.kql.error;

/**
 * Thrown when a query parses but binds its variables inconsistently, e.g.
 * one name used for a node and a relationship.
 */
public class InvalidQueryException extends TranslationException {

    /** Variable used as two kinds of element. */
    public static final String VARIABLE_KIND_CONFLICT =
        "variable-kind-conflict";

    /** Relationship variable bound by two patterns. */
    public static final String RELATIONSHIP_REBOUND = "relationship-rebound";

    /** Path function used outside a single-hop path. */
    public static final String PATH_FUNCTION_MISUSE = "path-function-misuse";

    /** Offending variable. */
    private final String subject;

    /**
     * Constructs a new InvalidQueryException.
     *
     * @param message the detail message
     * @param reasonCode one of the reason constants
     * @param subject the offending variable
     * @param position character offset, or a negative value
     */
    public InvalidQueryException(final String message,
            final String reasonCode, final String subject,
            final int position) {
        super(message, position, reasonCode);
        this.subject = subject;
    }

    /**
     * Gets the offending variable.
     *
     * @return the variable
     */
    public String getSubject() {
        return subject;
    }
}
