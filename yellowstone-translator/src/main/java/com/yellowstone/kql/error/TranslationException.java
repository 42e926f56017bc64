package com.yellowstone.kql.error;

import java.util.OptionalInt;

/**
 * Base type of every failure raised while turning Cypher text into KQL.
 *
 * <p>Each failure carries a stable reason code (used in diagnostics and
 * escalation payloads) and, where it is known, the 0-based character offset
 * of the offending construct in the input text.</p>
 */
public abstract class TranslationException extends Exception {

    /** Position marker for errors without a source location. */
    protected static final int NO_POSITION = -1;

    /** Offset of the offending construct, or {@link #NO_POSITION}. */
    private final int position;

    /** Stable machine-readable reason. */
    private final String reasonCode;

    /**
     * Constructs a new TranslationException.
     *
     * @param message the detail message
     * @param position character offset, or a negative value when unknown
     * @param reasonCode stable reason code
     */
    protected TranslationException(final String message, final int position,
            final String reasonCode) {
        super(message);
        this.position = position < 0 ? NO_POSITION : position;
        this.reasonCode = reasonCode;
    }

    /**
     * Gets the character offset of the offending construct.
     *
     * @return the offset, or empty when no source location is known
     */
    public OptionalInt getPosition() {
        return position == NO_POSITION ? OptionalInt.empty()
            : OptionalInt.of(position);
    }

    /**
     * Gets the stable reason code.
     *
     * @return the reason code
     */
    public String getReasonCode() {
        return reasonCode;
    }
}
