package com.yellowstone.kql;

/**
 * Progress of one translation. The last three values are terminal.
 */
public enum TranslationStage {
    PARSED,
    SCHEMA_RESOLVED,
    CLAUSES_TRANSLATED,
    ASSEMBLED,
    SUCCEEDED,
    REJECTED,
    ESCALATED;

    /**
     * Whether no further stage follows.
     *
     * @return true for SUCCEEDED, REJECTED and ESCALATED
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == REJECTED || this == ESCALATED;
    }
}
