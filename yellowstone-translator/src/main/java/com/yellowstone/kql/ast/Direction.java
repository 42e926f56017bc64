package com.yellowstone.kql.ast;

/** Direction of a relationship pattern relative to its left node. */
public enum Direction {
    /** {@code -[]->}. */
    OUTGOING,
    /** {@code <-[]-}. */
    INCOMING,
    /** {@code -[]-}. */
    EITHER
}
