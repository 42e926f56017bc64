package com.yellowstone.kql.ast;

import java.util.Objects;

/**
 * Closed set of literal values that may appear in property maps and
 * conditions. Consumers switch over the variants exhaustively.
 */
public sealed interface LiteralValue {

    /**
     * A string literal.
     *
     * @param value the unescaped text
     */
    record StringValue(String value) implements LiteralValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * An integer literal.
     *
     * @param value the value
     */
    record IntegerValue(long value) implements LiteralValue {
    }

    /**
     * A floating point literal.
     *
     * @param value the value
     */
    record FloatValue(double value) implements LiteralValue {
    }

    /**
     * A boolean literal.
     *
     * @param value the value
     */
    record BooleanValue(boolean value) implements LiteralValue {
    }

    /** The null literal. */
    record NullValue() implements LiteralValue {
        /** Shared instance. */
        public static final NullValue INSTANCE = new NullValue();
    }
}
