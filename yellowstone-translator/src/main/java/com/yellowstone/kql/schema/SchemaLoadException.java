package com.yellowstone.kql.schema;

import java.util.List;

/**
 * Raised when a schema document cannot be read, parsed or validated.
 */
public class SchemaLoadException extends Exception {

    /** Validation errors, empty for read and parse failures. */
    private final List<String> problems;

    /**
     * Constructs a SchemaLoadException for an unreadable document.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public SchemaLoadException(final String message, final Throwable cause) {
        super(message, cause);
        this.problems = List.of();
    }

    /**
     * Constructs a SchemaLoadException for a document failing validation.
     *
     * @param message the detail message
     * @param problems the validation errors
     */
    public SchemaLoadException(final String message,
            final List<String> problems) {
        super(message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /**
     * Gets the validation errors.
     *
     * @return the problems, empty for read and parse failures
     */
    public List<String> getProblems() {
        return problems;
    }
}
