package com.yellowstone.kql.ast;

/** Sort direction of an ORDER BY item. */
public enum SortDirection {
    /** Ascending. */
    ASC,
    /** Descending. */
    DESC
}
