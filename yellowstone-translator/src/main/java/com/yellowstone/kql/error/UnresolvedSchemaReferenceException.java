package com.yellowstone.kql.error;

import java.util.List;

/**
 * Raised when a label, relationship type or property has no mapping in the
 * schema. There is no silent default: every reference must resolve.
 */
public class UnresolvedSchemaReferenceException extends TranslationException {

    /** Reason code for unresolved references. */
    public static final String REASON = "unresolved-schema-reference";

    /** What kind of schema element could not be resolved. */
    public enum ReferenceKind {
        /** A node label. */
        LABEL,
        /** A relationship type. */
        RELATIONSHIP_TYPE,
        /** A property of a node or relationship. */
        PROPERTY
    }

    /** The unresolved name. */
    private final String reference;

    /** Kind of the unresolved name. */
    private final ReferenceKind kind;

    /** Names that would have resolved. */
    private final List<String> alternatives;

    /**
     * Constructs a new UnresolvedSchemaReferenceException.
     *
     * @param reference the unresolved name
     * @param kind the kind of reference
     * @param alternatives known names of the same kind
     */
    public UnresolvedSchemaReferenceException(final String reference,
            final ReferenceKind kind, final List<String> alternatives) {
        super(describe(reference, kind, alternatives), NO_POSITION, REASON);
        this.reference = reference;
        this.kind = kind;
        this.alternatives = List.copyOf(alternatives);
    }

    private static String describe(final String reference,
            final ReferenceKind kind, final List<String> alternatives) {
        String what = switch (kind) {
            case LABEL -> "label";
            case RELATIONSHIP_TYPE -> "relationship type";
            case PROPERTY -> "property";
        };
        StringBuilder sb = new StringBuilder("Unresolved ").append(what)
            .append(" '").append(reference).append('\'');
        if (!alternatives.isEmpty()) {
            sb.append("; available: ").append(String.join(", ", alternatives));
        }
        return sb.toString();
    }

    /**
     * Gets the unresolved name.
     *
     * @return the reference
     */
    public String getReference() {
        return reference;
    }

    /**
     * Gets the reference kind.
     *
     * @return the kind
     */
    public ReferenceKind getKind() {
        return kind;
    }

    /**
     * Gets the names that would have resolved.
     *
     * @return immutable list of alternatives
     */
    public List<String> getAlternatives() {
        return alternatives;
    }
}
