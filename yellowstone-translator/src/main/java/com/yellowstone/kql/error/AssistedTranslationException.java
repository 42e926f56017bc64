package com.yellowstone.kql.error;

/**
 * Records that the assisted translator could not answer an escalated query.
 */
public class AssistedTranslationException extends TranslationException {

    /** Reason code. */
    public static final String REASON = "assisted-translation-failed";

    /**
     * Constructs a new AssistedTranslationException.
     *
     * @param message the collaborator's explanation
     */
    public AssistedTranslationException(final String message) {
        super(message, NO_POSITION, REASON);
    }
}
