package com.yellowstone.kql.translate;

import com.yellowstone.kql.schema.BackingEntityRef;
import com.yellowstone.kql.visitor.IdentifierCollector.VariableKind;
import java.util.List;

/**
 * A variable bound by MATCH after schema resolution.
 *
 * @param name the variable, or a generated name for anonymous patterns
 * @param kind node, relationship or path
 * @param labels labels or relationship types attached anywhere in the query
 * @param entities every backing entity of those labels, before any
 *        multi-entity policy is applied
 * @param generated whether the name was generated
 */
public record VariableBinding(String name, VariableKind kind,
        List<String> labels, List<BackingEntityRef> entities,
        boolean generated) {

    public VariableBinding {
        labels = List.copyOf(labels);
        entities = List.copyOf(entities);
    }
}
