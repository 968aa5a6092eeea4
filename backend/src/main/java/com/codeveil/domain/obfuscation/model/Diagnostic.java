package com.codeveil.domain.obfuscation.model;

/**
 * One entry of a run's diagnostics stream.
 *
 * @param severity how serious the entry is
 * @param stage    pipeline stage or technique name that produced it
 * @param message  human-readable description
 */
public record Diagnostic(
        Severity severity,
        String stage,
        String message
) {
    public enum Severity {
        INFO,
        WARNING,
        ERROR
    }

    public static Diagnostic info(String stage, String message) {
        return new Diagnostic(Severity.INFO, stage, message);
    }

    public static Diagnostic warning(String stage, String message) {
        return new Diagnostic(Severity.WARNING, stage, message);
    }

    public static Diagnostic error(String stage, String message) {
        return new Diagnostic(Severity.ERROR, stage, message);
    }
}
