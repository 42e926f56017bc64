package com.yellowstone.kql.error;

/**
 * Raised by the parser when the token stream does not match the grammar.
 */
public class CypherSyntaxException extends TranslationException {

    /** Reason code for syntax failures. */
    public static final String REASON = "syntax-error";

    /** Description of the construct the parser expected. */
    private final String expected;

    /** Text of the token actually found. */
    private final String found;

    /**
     * Constructs a new CypherSyntaxException.
     *
     * @param position offset of the offending token
     * @param expected the construct the parser expected
     * @param found the text of the token found instead
     */
    public CypherSyntaxException(final int position, final String expected,
            final String found) {
        super("Expected " + expected + " but found " + found
            + " at position " + position, position, REASON);
        this.expected = expected;
        this.found = found;
    }

    /**
     * Gets the expected construct.
     *
     * @return the expected construct
     */
    public String getExpected() {
        return expected;
    }

    /**
     * Gets the text of the token found.
     *
     * @return the found token text
     */
    public String getFound() {
        return found;
    }
}
