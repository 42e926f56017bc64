package com.yellowstone.kql.translate;

import com.yellowstone.kql.ast.LiteralValue;
import java.math.BigDecimal;

/**
 * Renders literal values as KQL literals.
 *
 * <ul>
 *   <li>strings are single quoted with backslash escapes</li>
 *   <li>integers render as long literals</li>
 *   <li>floats render as real literals, non-finite values as
 *       {@code real(nan)}, {@code real(+inf)}, {@code real(-inf)}</li>
 *   <li>null renders as {@code dynamic(null)}</li>
 * </ul>
 */
public final class KqlLiterals {

    private KqlLiterals() {
        throw new AssertionError("No instances");
    }

    /**
     * Render a literal.
     *
     * @param value the value
     * @return KQL text
     */
    public static String render(final LiteralValue value) {
        if (value instanceof LiteralValue.StringValue s) {
            return quote(s.value());
        } else if (value instanceof LiteralValue.IntegerValue i) {
            return Long.toString(i.value());
        } else if (value instanceof LiteralValue.FloatValue f) {
            return real(f.value());
        } else if (value instanceof LiteralValue.BooleanValue b) {
            return b.value() ? "true" : "false";
        }
        return "dynamic(null)";
    }

    /**
     * Quote a string as a KQL string literal.
     *
     * @param text the raw text
     * @return the quoted literal
     */
    public static String quote(final String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('\'');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    private static String real(final double value) {
        if (Double.isNaN(value)) {
            return "real(nan)";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "real(+inf)" : "real(-inf)";
        }
        String plain = BigDecimal.valueOf(value).toPlainString();
        // keep a decimal point so the literal stays a real
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }
}
