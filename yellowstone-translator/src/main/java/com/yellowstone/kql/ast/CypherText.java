package com.yellowstone.kql.ast;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders pattern fragments back into Cypher text. Used to quote the
 * offending sub-pattern in errors and escalation payloads.
 */
public final class CypherText {

    private CypherText() {
        throw new AssertionError("No instances");
    }

    /**
     * Render a path expression, including path variable and function.
     *
     * @param path the path
     * @return Cypher text
     */
    public static String of(final PathExpression path) {
        StringBuilder sb = new StringBuilder();
        if (path.pathVariable() != null) {
            sb.append(path.pathVariable()).append(" = ");
        }
        if (path.function() != PathFunction.NONE) {
            sb.append(path.function().cypherName()).append('(');
        }
        sb.append(of(path.nodes().get(0)));
        for (int i = 0; i < path.relationships().size(); i++) {
            sb.append(of(path.relationships().get(i)));
            sb.append(of(path.nodes().get(i + 1)));
        }
        if (path.function() != PathFunction.NONE) {
            sb.append(')');
        }
        return sb.toString();
    }

    /**
     * Render a node pattern.
     *
     * @param node the node
     * @return Cypher text
     */
    public static String of(final NodePattern node) {
        StringBuilder sb = new StringBuilder("(");
        if (node.variable() != null) {
            sb.append(node.variable());
        }
        for (String label : node.labels()) {
            sb.append(':').append(label);
        }
        appendProperties(sb, node.properties());
        return sb.append(')').toString();
    }

    /**
     * Render a relationship pattern including its arrows.
     *
     * @param rel the relationship
     * @return Cypher text
     */
    public static String of(final RelationshipPattern rel) {
        StringBuilder inner = new StringBuilder();
        if (rel.variable() != null) {
            inner.append(rel.variable());
        }
        if (!rel.types().isEmpty()) {
            inner.append(':').append(String.join("|", rel.types()));
        }
        if (rel.length() != null) {
            inner.append(rel.length().toCypher());
        }
        appendProperties(inner, rel.properties());
        String body = inner.length() == 0 ? "" : "[" + inner + "]";
        return switch (rel.direction()) {
            case OUTGOING -> "-" + body + "->";
            case INCOMING -> "<-" + body + "-";
            case EITHER -> "-" + body + "-";
        };
    }

    /**
     * Render a literal value.
     *
     * @param value the value
     * @return Cypher text
     */
    public static String of(final LiteralValue value) {
        if (value instanceof LiteralValue.StringValue s) {
            return "'" + s.value().replace("\\", "\\\\").replace("'", "\\'")
                + "'";
        } else if (value instanceof LiteralValue.IntegerValue i) {
            return Long.toString(i.value());
        } else if (value instanceof LiteralValue.FloatValue f) {
            return Double.toString(f.value());
        } else if (value instanceof LiteralValue.BooleanValue b) {
            return Boolean.toString(b.value());
        }
        return "null";
    }

    private static void appendProperties(final StringBuilder sb,
            final Map<String, LiteralValue> properties) {
        if (properties.isEmpty()) {
            return;
        }
        boolean bare = sb.length() == 0 || sb.charAt(sb.length() - 1) == '(';
        StringJoiner joiner = new StringJoiner(", ", bare ? "{" : " {", "}");
        properties.forEach((k, v) -> joiner.add(k + ": " + of(v)));
        sb.append(joiner);
    }
}
