package com.yellowstone.kql.schema;

import java.util.Objects;

/**
 * A physical table backing a logical label or relationship type.
 *
 * @param kind whether the table backs nodes or relationships
 * @param logicalName the label or relationship type it backs
 * @param entityId the table name in the event store
 */
public record BackingEntityRef(EntityKind kind, String logicalName,
        String entityId) {

    public BackingEntityRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(logicalName, "logicalName");
        Objects.requireNonNull(entityId, "entityId");
    }
}
