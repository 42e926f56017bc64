package com.yellowstone.kql.schema;

/**
 * How to render a label or relationship type backed by more than one table.
 */
public enum MultiEntityPolicy {
    /** Render every backing table as an alternative. */
    UNION,
    /** Use only the first declared table. */
    PRIMARY,
    /** Refuse to translate. */
    REJECT
}
