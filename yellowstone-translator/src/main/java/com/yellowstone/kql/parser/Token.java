package com.yellowstone.kql.parser;

/**
 * A lexical token.
 *
 * @param type token kind
 * @param text token text; unescaped content for strings and quoted names
 * @param position 0-based character offset of the first character
 */
public record Token(TokenType type, String text, int position) {

    /**
     * Text suitable for error messages.
     *
     * @return quoted token text, or "end of input"
     */
    public String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
