package com.yellowstone.kql.parser;

import com.yellowstone.kql.error.LexicalException;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CypherLexer.
 */
public class CypherLexerTest {

    private static List<TokenType> types(final String text)
            throws LexicalException {
        return CypherLexer.tokenize(text).stream()
            .map(Token::type)
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Test keywords are case-insensitive and identifiers keep their text")
    public void testKeywordsAndIdentifiers() throws LexicalException {
        List<Token> tokens = CypherLexer.tokenize("match (UserNode) Return x");
        assertEquals(TokenType.MATCH, tokens.get(0).type());
        assertEquals(TokenType.IDENTIFIER, tokens.get(2).type());
        assertEquals("UserNode", tokens.get(2).text());
        assertEquals(TokenType.RETURN, tokens.get(4).type());
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type());
    }

    @Test
    @DisplayName("Test range after star is split into integers and DOTDOT")
    public void testRangeTokens() throws LexicalException {
        assertEquals(List.of(TokenType.LBRACKET, TokenType.COLON,
                TokenType.IDENTIFIER, TokenType.STAR, TokenType.INTEGER,
                TokenType.DOTDOT, TokenType.INTEGER, TokenType.RBRACKET,
                TokenType.EOF),
            types("[:KNOWS*1..3]"));
    }

    @Test
    @DisplayName("Test arrows and dashes")
    public void testArrows() throws LexicalException {
        assertEquals(List.of(TokenType.LPAREN, TokenType.RPAREN,
                TokenType.ARROW_LEFT, TokenType.DASH, TokenType.LPAREN,
                TokenType.RPAREN, TokenType.DASH, TokenType.ARROW_RIGHT,
                TokenType.LPAREN, TokenType.RPAREN, TokenType.EOF),
            types("()<--()-->()"));
    }

    @Test
    @DisplayName("Test both inequality spellings produce NOT_EQUALS")
    public void testNotEquals() throws LexicalException {
        assertEquals(TokenType.NOT_EQUALS, types("<>").get(0));
        assertEquals(TokenType.NOT_EQUALS, types("!=").get(0));
        assertEquals(TokenType.LESS_THAN_OR_EQUAL, types("<=").get(0));
        assertEquals(TokenType.GREATER_THAN_OR_EQUAL, types(">=").get(0));
    }

    @Test
    @DisplayName("Test string escapes are decoded")
    public void testStringEscapes() throws LexicalException {
        List<Token> tokens = CypherLexer.tokenize("'O\\'Brien\\n' \"two\"");
        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("O'Brien\n", tokens.get(0).text());
        assertEquals("two", tokens.get(1).text());
    }

    @Test
    @DisplayName("Test numbers with fractions and exponents")
    public void testNumbers() throws LexicalException {
        List<Token> tokens = CypherLexer.tokenize("42 3.5 1e3");
        assertEquals(TokenType.INTEGER, tokens.get(0).type());
        assertEquals(TokenType.FLOAT, tokens.get(1).type());
        assertEquals("3.5", tokens.get(1).text());
        assertEquals(TokenType.FLOAT, tokens.get(2).type());
    }

    @Test
    @DisplayName("Test backtick identifiers and line comments")
    public void testBacktickAndComment() throws LexicalException {
        List<Token> tokens = CypherLexer.tokenize(
            "`odd name` // trailing comment\n x");
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("odd name", tokens.get(0).text());
        assertEquals("x", tokens.get(1).text());
        assertEquals(3, tokens.size());
    }

    @Test
    @DisplayName("Test token positions are character offsets")
    public void testPositions() throws LexicalException {
        List<Token> tokens = CypherLexer.tokenize("MATCH (n)");
        assertEquals(0, tokens.get(0).position());
        assertEquals(6, tokens.get(1).position());
        assertEquals(7, tokens.get(2).position());
        assertEquals(9, tokens.get(4).position());
    }

    @Test
    @DisplayName("Test unterminated string is rejected with its start position")
    public void testUnterminatedString() {
        LexicalException e = assertThrows(LexicalException.class,
            () -> CypherLexer.tokenize("RETURN 'abc"));
        assertTrue(e.getMessage().contains("Unterminated string literal"));
        assertEquals(7, e.getPosition().getAsInt());
        assertEquals(LexicalException.REASON, e.getReasonCode());
    }

    @Test
    @DisplayName("Test unknown characters and escapes are rejected")
    public void testInvalidInput() {
        assertThrows(LexicalException.class,
            () -> CypherLexer.tokenize("MATCH (n) RETURN n # 1"));
        assertThrows(LexicalException.class,
            () -> CypherLexer.tokenize("'bad \\q escape'"));
        assertThrows(LexicalException.class,
            () -> CypherLexer.tokenize("a ! b"));
        assertThrows(LexicalException.class,
            () -> CypherLexer.tokenize("12abc"));
    }
}
