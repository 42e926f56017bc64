package com.yellowstone.kql.paths;

/**
 * What to do with a MATCH relationship that has no upper repetition bound.
 */
public enum UnboundedPathPolicy {
    /** Hand the query to the assisted translation collaborator. */
    ESCALATE,
    /** Fail the translation. */
    REJECT
}
