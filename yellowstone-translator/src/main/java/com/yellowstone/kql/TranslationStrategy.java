package com.yellowstone.kql;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a translation was, or will be, produced.
 */
public enum TranslationStrategy {
    /** Rendered entirely by the rule-based translator. */
    DIRECT("direct"),
    /** Deferred to the assisted translator. */
    ESCALATE("escalate"),
    /** Not translatable. */
    REJECTED("rejected");

    private final String wireName;

    TranslationStrategy(final String wireName) {
        this.wireName = wireName;
    }

    /**
     * Lower-case name used in payloads and span attributes.
     *
     * @return the name
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }
}
