package com.yellowstone.kql;

import java.util.Objects;

/**
 * A note attached to a translation result.
 *
 * @param severity how much the note matters
 * @param code stable machine-readable code
 * @param message human readable text
 */
public record Diagnostic(Severity severity, String code, String message) {

    /** Diagnostic severity. */
    public enum Severity {
        INFO,
        WARNING,
        ERROR
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    static Diagnostic info(final String code, final String message) {
        return new Diagnostic(Severity.INFO, code, message);
    }

    static Diagnostic warning(final String code, final String message) {
        return new Diagnostic(Severity.WARNING, code, message);
    }

    static Diagnostic error(final String code, final String message) {
        return new Diagnostic(Severity.ERROR, code, message);
    }
}
