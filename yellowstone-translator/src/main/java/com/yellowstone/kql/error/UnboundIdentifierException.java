package com.yellowstone.kql.error;

/**
 * Raised when WHERE, RETURN or ORDER BY references a variable that no MATCH
 * pattern binds.
 */
public class UnboundIdentifierException extends TranslationException {

    /** Reason code for unbound identifiers. */
    public static final String REASON = "unbound-identifier";

    /** The unbound name. */
    private final String identifier;

    /** Clause in which the reference occurred. */
    private final String clause;

    /**
     * Constructs a new UnboundIdentifierException.
     *
     * @param identifier the unbound name
     * @param clause clause in which it was referenced (e.g. RETURN)
     * @param position offset of the reference
     */
    public UnboundIdentifierException(final String identifier,
            final String clause, final int position) {
        super("Variable '" + identifier + "' is not bound by any MATCH"
            + " pattern (referenced in " + clause + ")", position, REASON);
        this.identifier = identifier;
        this.clause = clause;
    }

    /**
     * Gets the unbound name.
     *
     * @return the identifier
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * Gets the clause of the reference.
     *
     * @return the clause name
     */
    public String getClause() {
        return clause;
    }
}
