package com.yellowstone.kql.ast;

/**
 * Binary comparison operators of the condition language.
 */
public enum ComparisonOperator {
    EQUALS("="),
    NOT_EQUALS("<>"),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN_OR_EQUAL(">="),
    CONTAINS("CONTAINS"),
    STARTS_WITH("STARTS WITH"),
    ENDS_WITH("ENDS WITH");

    private final String symbol;

    ComparisonOperator(final String symbol) {
        this.symbol = symbol;
    }

    /**
     * Gets the Cypher spelling of the operator.
     *
     * @return the symbol
     */
    public String symbol() {
        return symbol;
    }
}
