package com.codeveil.domain.obfuscation.model;

/**
 * Individual problem found in a candidate output.
 *
 * @param type        the type of validation issue
 * @param severity    ERROR rejects the candidate, WARNING is logged only
 * @param message     human-readable description of the issue
 * @param matchedText the offending source text (nullable)
 */
public record ValidationIssue(
        ValidationIssueType type,
        Severity severity,
        String message,
        String matchedText
) {
    public enum Severity {
        ERROR,
        WARNING
    }

    public static ValidationIssue error(ValidationIssueType type, String message, String matchedText) {
        return new ValidationIssue(type, Severity.ERROR, message, matchedText);
    }

    public static ValidationIssue warning(ValidationIssueType type, String message, String matchedText) {
        return new ValidationIssue(type, Severity.WARNING, message, matchedText);
    }
}
