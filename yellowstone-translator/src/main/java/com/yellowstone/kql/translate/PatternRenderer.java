package com.yellowstone.kql.translate;

import com.yellowstone.kql.ast.Direction;
import com.yellowstone.kql.ast.NodePattern;
import com.yellowstone.kql.ast.RelationshipPattern;
import com.yellowstone.kql.schema.BackingEntityRef;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders resolved node and relationship patterns in graph-match syntax:
 * {@code (u:IdentityInfo)}, {@code -[r:SigninLogs*1..3]->}.
 */
public final class PatternRenderer {

    private PatternRenderer() {
        throw new AssertionError("No instances");
    }

    /**
     * Render a node.
     *
     * @param node the pattern
     * @param context the resolved query context
     * @return KQL text
     */
    public static String node(final NodePattern node,
            final TranslationContext context) {
        return node(context.variableOf(node), context.entitiesOf(node));
    }

    /**
     * Render a node from its parts.
     *
     * @param variable the variable, may be null
     * @param entities backing tables, may be empty
     * @return KQL text
     */
    public static String node(final String variable,
            final List<BackingEntityRef> entities) {
        return "(" + body(variable, entities, "") + ")";
    }

    /**
     * Render a relationship with the given repetition suffix.
     *
     * @param rel the pattern
     * @param length repetition suffix such as {@code *1..3}, or empty
     * @param context the resolved query context
     * @return KQL text
     */
    public static String relationship(final RelationshipPattern rel,
            final String length, final TranslationContext context) {
        return relationship(context.variableOf(rel), context.entitiesOf(rel),
            rel.direction(), length);
    }

    /**
     * Render a relationship from its parts.
     *
     * @param variable the variable, may be null
     * @param entities backing tables, may be empty
     * @param direction the direction
     * @param length repetition suffix, or empty
     * @return KQL text
     */
    public static String relationship(final String variable,
            final List<BackingEntityRef> entities, final Direction direction,
            final String length) {
        String body = body(variable, entities, length);
        String bracket = body.isEmpty() ? "" : "[" + body + "]";
        return switch (direction) {
            case OUTGOING -> "-" + bracket + "->";
            case INCOMING -> "<-" + bracket + "-";
            case EITHER -> "-" + bracket + "-";
        };
    }

    private static String body(final String variable,
            final List<BackingEntityRef> entities, final String length) {
        StringBuilder sb = new StringBuilder();
        if (variable != null) {
            sb.append(variable);
        }
        if (!entities.isEmpty()) {
            List<String> tables = new ArrayList<>();
            for (BackingEntityRef ref : entities) {
                if (!tables.contains(ref.entityId())) {
                    tables.add(ref.entityId());
                }
            }
            sb.append(':').append(String.join("|", tables));
        }
        return sb.append(length).toString();
    }
}
