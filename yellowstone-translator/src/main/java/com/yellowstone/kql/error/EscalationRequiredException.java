package com.yellowstone.kql.error;

/**
 * Signals that a sub-pattern must be handed to the assisted translation
 * collaborator. The orchestrator turns it into an escalated result; it never
 * reaches callers of the public API.
 */
public class EscalationRequiredException extends Exception {

    /** Unbounded variable-length path. */
    public static final String UNBOUNDED_PATH = "unbounded-path";

    /** Variable-length path over several relationship types. */
    public static final String MULTI_TYPE_VARIABLE_PATH =
        "multi-type-variable-path";

    /** Stable reason code. */
    private final String reasonCode;

    /** Offending sub-pattern text. */
    private final String subPattern;

    /**
     * Constructs a new EscalationRequiredException.
     *
     * @param message the detail message
     * @param reasonCode stable reason code
     * @param subPattern offending sub-pattern text
     */
    public EscalationRequiredException(final String message,
            final String reasonCode, final String subPattern) {
        super(message);
        this.reasonCode = reasonCode;
        this.subPattern = subPattern;
    }

    /**
     * Gets the reason code.
     *
     * @return the reason code
     */
    public String getReasonCode() {
        return reasonCode;
    }

    /**
     * Gets the offending sub-pattern text.
     *
     * @return the sub-pattern
     */
    public String getSubPattern() {
        return subPattern;
    }
}
