package com.yellowstone.kql.parser;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Token kinds produced by {@link CypherLexer}.
 */
public enum TokenType {
    IDENTIFIER,
    STRING,
    INTEGER,
    FLOAT,

    // keywords
    MATCH("MATCH"),
    OPTIONAL("OPTIONAL"),
    WHERE("WHERE"),
    RETURN("RETURN"),
    AND("AND"),
    OR("OR"),
    NOT("NOT"),
    DISTINCT("DISTINCT"),
    ORDER("ORDER"),
    BY("BY"),
    ASC("ASC"),
    DESC("DESC"),
    LIMIT("LIMIT"),
    SKIP("SKIP"),
    AS("AS"),
    TRUE("TRUE"),
    FALSE("FALSE"),
    NULL("NULL"),
    IS("IS"),
    CONTAINS("CONTAINS"),
    STARTS("STARTS"),
    ENDS("ENDS"),
    WITH("WITH"),

    // punctuation and operators
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    COLON,
    SEMICOLON,
    DOT,
    DOTDOT,
    STAR,
    DASH,
    ARROW_RIGHT,
    ARROW_LEFT,
    EQUALS,
    NOT_EQUALS,
    LESS_THAN,
    GREATER_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN_OR_EQUAL,
    PIPE,

    EOF;

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.keyword != null) {
                KEYWORDS.put(type.keyword, type);
            }
        }
        KEYWORDS.put("ASCENDING", ASC);
        KEYWORDS.put("DESCENDING", DESC);
    }

    /** Upper-case keyword spelling, null for non-keywords. */
    private final String keyword;

    TokenType() {
        this(null);
    }

    TokenType(final String keyword) {
        this.keyword = keyword;
    }

    /**
     * Whether this type is a reserved word.
     *
     * @return true for keywords
     */
    public boolean isKeyword() {
        return keyword != null;
    }

    /**
     * Look up a keyword, ignoring case.
     *
     * @param word the word as written
     * @return the keyword type, or null when the word is an identifier
     */
    public static TokenType keyword(final String word) {
        return KEYWORDS.get(word.toUpperCase(Locale.ROOT));
    }
}
