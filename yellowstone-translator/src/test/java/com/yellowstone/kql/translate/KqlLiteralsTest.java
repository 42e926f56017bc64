package com.yellowstone.kql.translate;

import com.yellowstone.kql.ast.LiteralValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KqlLiterals.
 */
public class KqlLiteralsTest {

    @Test
    @DisplayName("Test strings are single-quoted with escapes")
    public void testQuote() {
        assertEquals("'plain'", KqlLiterals.quote("plain"));
        assertEquals("'O\\'Brien'", KqlLiterals.quote("O'Brien"));
        assertEquals("'a\\\\b\\nc\\t'", KqlLiterals.quote("a\\b\nc\t"));
    }

    @Test
    @DisplayName("Test scalar literal rendering")
    public void testRender() {
        assertEquals("-5", KqlLiterals.render(
            new LiteralValue.IntegerValue(-5)));
        assertEquals("true", KqlLiterals.render(
            new LiteralValue.BooleanValue(true)));
        assertEquals("dynamic(null)", KqlLiterals.render(
            LiteralValue.NullValue.INSTANCE));
        assertEquals("'x'", KqlLiterals.render(
            new LiteralValue.StringValue("x")));
    }

    @Test
    @DisplayName("Test reals keep a decimal point and never use exponents")
    public void testReals() {
        assertEquals("2.0", KqlLiterals.render(
            new LiteralValue.FloatValue(2.0)));
        assertEquals("0.25", KqlLiterals.render(
            new LiteralValue.FloatValue(0.25)));
        assertEquals("100000000000000000000.0", KqlLiterals.render(
            new LiteralValue.FloatValue(1e20)));
        assertEquals("real(nan)", KqlLiterals.render(
            new LiteralValue.FloatValue(Double.NaN)));
        assertEquals("real(-inf)", KqlLiterals.render(
            new LiteralValue.FloatValue(Double.NEGATIVE_INFINITY)));
    }
}
