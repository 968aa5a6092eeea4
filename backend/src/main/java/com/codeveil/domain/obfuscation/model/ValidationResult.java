package com.codeveil.domain.obfuscation.model;

import java.util.List;

/**
 * Verdict of the validity gate on one candidate output.
 *
 * @param passed true if no ERROR-level issues were found
 * @param issues all issues (both ERROR and WARNING)
 */
public record ValidationResult(
        boolean passed,
        List<ValidationIssue> issues
) {
    public static ValidationResult of(List<ValidationIssue> issues) {
        boolean passed = issues.stream().noneMatch(i -> i.severity() == ValidationIssue.Severity.ERROR);
        return new ValidationResult(passed, List.copyOf(issues));
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(i -> i.severity() == ValidationIssue.Severity.ERROR);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.ERROR).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.WARNING).toList();
    }
}
