package com.yellowstone.kql.error;

/**
 * Raised by the lexer on an unrecognized character or an unterminated
 * string or identifier.
 */
public class LexicalException extends TranslationException {

    /** Reason code for lexical failures. */
    public static final String REASON = "lexical-error";

    /**
     * Constructs a new LexicalException.
     *
     * @param message the detail message
     * @param position offset of the offending character
     */
    public LexicalException(final String message, final int position) {
        super(message + " at position " + position, position, REASON);
    }
}
