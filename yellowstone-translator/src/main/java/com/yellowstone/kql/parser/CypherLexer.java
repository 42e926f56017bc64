package com.yellowstone.kql.parser;

import com.yellowstone.kql.error.LexicalException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns Cypher query text into tokens.
 *
 * <p>Keywords are matched case-insensitively. Strings may use single or
 * double quotes with backslash escapes, identifiers may be quoted with
 * backticks and {@code //} comments run to the end of the line. A lexer
 * instance only holds its input, so {@link #tokenize()} may be called any
 * number of times and always returns a fresh list.</p>
 */
public final class CypherLexer {

    private final String input;

    /**
     * Creates a lexer over the given text.
     *
     * @param input the query text
     */
    public CypherLexer(final String input) {
        this.input = input;
    }

    /**
     * Tokenize the given text.
     *
     * @param input the query text
     * @return tokens ending with {@link TokenType#EOF}
     * @throws LexicalException on an unrecognized character or an
     *         unterminated string
     */
    public static List<Token> tokenize(final String input)
            throws LexicalException {
        return new CypherLexer(input).tokenize();
    }

    /**
     * Tokenize the input of this lexer.
     *
     * @return tokens ending with {@link TokenType#EOF}
     * @throws LexicalException on an unrecognized character or an
     *         unterminated string
     */
    public List<Token> tokenize() throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = input.length();
        while (pos < length) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (c == '/' && peek(pos + 1) == '/') {
                while (pos < length && input.charAt(pos) != '\n') {
                    pos++;
                }
                continue;
            }
            int start = pos;
            if (Character.isLetter(c) || c == '_') {
                while (pos < length && isIdentifierPart(input.charAt(pos))) {
                    pos++;
                }
                String word = input.substring(start, pos);
                TokenType keyword = TokenType.keyword(word);
                tokens.add(new Token(keyword != null ? keyword
                    : TokenType.IDENTIFIER, word, start));
                continue;
            }
            if (Character.isDigit(c)) {
                pos = readNumber(start, tokens);
                continue;
            }
            if (c == '\'' || c == '"') {
                pos = readString(start, c, tokens);
                continue;
            }
            if (c == '`') {
                int end = input.indexOf('`', start + 1);
                if (end < 0) {
                    throw new LexicalException(
                        "Unterminated quoted identifier", start);
                }
                if (end == start + 1) {
                    throw new LexicalException("Empty quoted identifier",
                        start);
                }
                tokens.add(new Token(TokenType.IDENTIFIER,
                    input.substring(start + 1, end), start));
                pos = end + 1;
                continue;
            }
            pos = readSymbol(start, c, tokens);
        }
        tokens.add(new Token(TokenType.EOF, "", length));
        return tokens;
    }

    private int readSymbol(final int start, final char c,
            final List<Token> tokens) throws LexicalException {
        char next = peek(start + 1);
        TokenType type;
        int width = 1;
        switch (c) {
            case '(' -> type = TokenType.LPAREN;
            case ')' -> type = TokenType.RPAREN;
            case '[' -> type = TokenType.LBRACKET;
            case ']' -> type = TokenType.RBRACKET;
            case '{' -> type = TokenType.LBRACE;
            case '}' -> type = TokenType.RBRACE;
            case ',' -> type = TokenType.COMMA;
            case ':' -> type = TokenType.COLON;
            case ';' -> type = TokenType.SEMICOLON;
            case '*' -> type = TokenType.STAR;
            case '|' -> type = TokenType.PIPE;
            case '=' -> type = TokenType.EQUALS;
            case '.' -> {
                if (next == '.') {
                    type = TokenType.DOTDOT;
                    width = 2;
                } else {
                    type = TokenType.DOT;
                }
            }
            case '-' -> {
                if (next == '>') {
                    type = TokenType.ARROW_RIGHT;
                    width = 2;
                } else {
                    type = TokenType.DASH;
                }
            }
            case '<' -> {
                if (next == '-') {
                    type = TokenType.ARROW_LEFT;
                    width = 2;
                } else if (next == '=') {
                    type = TokenType.LESS_THAN_OR_EQUAL;
                    width = 2;
                } else if (next == '>') {
                    type = TokenType.NOT_EQUALS;
                    width = 2;
                } else {
                    type = TokenType.LESS_THAN;
                }
            }
            case '>' -> {
                if (next == '=') {
                    type = TokenType.GREATER_THAN_OR_EQUAL;
                    width = 2;
                } else {
                    type = TokenType.GREATER_THAN;
                }
            }
            case '!' -> {
                if (next != '=') {
                    throw new LexicalException("Unexpected character '!'",
                        start);
                }
                type = TokenType.NOT_EQUALS;
                width = 2;
            }
            default -> throw new LexicalException(
                "Unexpected character '" + c + "'", start);
        }
        tokens.add(new Token(type, input.substring(start, start + width),
            start));
        return start + width;
    }

    private int readNumber(final int start, final List<Token> tokens)
            throws LexicalException {
        int pos = start;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        boolean isFloat = false;
        // "1..3" is a range, not a float
        if (peek(pos) == '.' && Character.isDigit(peek(pos + 1))) {
            isFloat = true;
            pos++;
            while (pos < input.length()
                    && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        if (peek(pos) == 'e' || peek(pos) == 'E') {
            int exp = pos + 1;
            if (peek(exp) == '+' || peek(exp) == '-') {
                exp++;
            }
            if (!Character.isDigit(peek(exp))) {
                throw new LexicalException("Malformed exponent", pos);
            }
            isFloat = true;
            pos = exp;
            while (pos < input.length()
                    && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        if (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            throw new LexicalException("Malformed number", start);
        }
        tokens.add(new Token(isFloat ? TokenType.FLOAT : TokenType.INTEGER,
            input.substring(start, pos), start));
        return pos;
    }

    private int readString(final int start, final char quote,
            final List<Token> tokens) throws LexicalException {
        StringBuilder sb = new StringBuilder();
        int pos = start + 1;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == quote) {
                tokens.add(new Token(TokenType.STRING, sb.toString(), start));
                return pos + 1;
            }
            if (c == '\\') {
                if (pos + 1 >= input.length()) {
                    break;
                }
                char escaped = input.charAt(pos + 1);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\', '\'', '"' -> sb.append(escaped);
                    default -> throw new LexicalException(
                        "Unknown escape sequence '\\" + escaped + "'", pos);
                }
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw new LexicalException("Unterminated string literal", start);
    }

    private char peek(final int index) {
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private static boolean isIdentifierPart(final char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
