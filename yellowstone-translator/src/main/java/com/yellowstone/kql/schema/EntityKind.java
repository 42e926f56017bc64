package com.yellowstone.kql.schema;

/** Whether a schema element backs nodes or relationships. */
public enum EntityKind {
    NODE,
    RELATIONSHIP
}
