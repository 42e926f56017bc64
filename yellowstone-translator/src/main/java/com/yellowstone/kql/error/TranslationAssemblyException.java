package com.yellowstone.kql.error;

/**
 * Raised when the assembled query text fails its final well-formedness
 * checks (empty stages, unbalanced brackets or quotes).
 */
public class TranslationAssemblyException extends TranslationException {

    /** Reason code for assembly failures. */
    public static final String REASON = "assembly-error";

    /**
     * Constructs a new TranslationAssemblyException.
     *
     * @param message the detail message
     */
    public TranslationAssemblyException(final String message) {
        super(message, NO_POSITION, REASON);
    }
}
