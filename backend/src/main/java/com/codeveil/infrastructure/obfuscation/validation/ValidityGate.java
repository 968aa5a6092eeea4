package com.codeveil.infrastructure.obfuscation.validation;

import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.ValidationIssue;
import com.codeveil.domain.obfuscation.model.ValidationIssue.Severity;
import com.codeveil.domain.obfuscation.model.ValidationIssueType;
import com.codeveil.domain.obfuscation.model.ValidationResult;
import com.codeveil.infrastructure.obfuscation.ScanException;
import com.codeveil.infrastructure.obfuscation.scanner.PythonScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a candidate output may be emitted.
 *
 * Checks, in order: the candidate re-scans, it passes the structural syntax checks, every
 * protected span of the input survives byte-identical at its original range. Optionally the
 * candidate is compiled and executed by a real interpreter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidityGate {

    private final PythonScanner scanner;
    private final PythonSyntaxChecker syntaxChecker;
    private final PythonInterpreterProbe probe;

    @Value("${obfuscator.validation.external-compile:false}")
    private boolean externalCompile;

    @Value("${obfuscator.validation.smoke-execute:false}")
    private boolean smokeExecute;

    /**
     * Structural checks on the untouched input.
     */
    public ValidationResult validateInput(List<Span> originalSpans) {
        return ValidationResult.of(syntaxChecker.check(originalSpans));
    }

    /**
     * Validate one candidate.
     *
     * @param candidateSpans span sequence the techniques produced
     * @param candidateText  concatenation of {@code candidateSpans}
     * @param originalText   the input text
     * @param originalSpans  the scan of the input
     */
    public ValidationResult validate(List<Span> candidateSpans, String candidateText,
                                     String originalText, List<Span> originalSpans) {
        List<ValidationIssue> issues = new ArrayList<>();

        List<Span> rescanned;
        try {
            rescanned = scanner.scan(candidateText);
        } catch (ScanException e) {
            issues.add(ValidationIssue.error(ValidationIssueType.SCAN_FAILURE, e.getMessage(), null));
            return finish(issues);
        }

        issues.addAll(syntaxChecker.check(rescanned));
        checkProtectedSpans(candidateSpans, originalSpans, issues);

        if (issues.stream().noneMatch(i -> i.severity() == Severity.ERROR)) {
            if (externalCompile) {
                checkCompiles(candidateText, issues);
            }
            if (smokeExecute) {
                checkSameBehavior(candidateText, originalText, issues);
            }
        }
        return finish(issues);
    }

    private void checkProtectedSpans(List<Span> candidateSpans, List<Span> originalSpans, List<ValidationIssue> issues) {
        Map<Long, String> kept = new HashMap<>();
        for (Span span : candidateSpans) {
            if (span.locked() && !span.isSynthetic()) {
                kept.put(rangeKey(span), span.text());
            }
        }
        for (Span span : originalSpans) {
            if (span.locked() && !span.text().equals(kept.get(rangeKey(span)))) {
                issues.add(ValidationIssue.error(ValidationIssueType.PROTECTED_SPAN_ALTERED,
                        "Protected span at " + span.start() + ".." + span.end() + " was altered", span.text()));
            }
        }
    }

    private void checkCompiles(String candidateText, List<ValidationIssue> issues) {
        PythonInterpreterProbe.Outcome outcome = probe.compile(candidateText);
        if (!outcome.available()) {
            issues.add(ValidationIssue.warning(ValidationIssueType.INTERPRETER_UNAVAILABLE,
                    "External compile check skipped: " + outcome.stderr(), null));
        } else if (!outcome.succeeded()) {
            issues.add(ValidationIssue.error(ValidationIssueType.EXTERNAL_COMPILE,
                    "Interpreter rejected the output", outcome.stderr()));
        }
    }

    private void checkSameBehavior(String candidateText, String originalText, List<ValidationIssue> issues) {
        PythonInterpreterProbe.Outcome before = probe.execute(originalText);
        if (!before.available()) {
            issues.add(ValidationIssue.warning(ValidationIssueType.INTERPRETER_UNAVAILABLE,
                    "Smoke execution skipped: " + before.stderr(), null));
            return;
        }
        if (before.timedOut()) {
            issues.add(ValidationIssue.warning(ValidationIssueType.SMOKE_MISMATCH,
                    "Smoke execution skipped: input did not finish in time", null));
            return;
        }
        PythonInterpreterProbe.Outcome after = probe.execute(candidateText);
        if (after.timedOut() || after.exitCode() != before.exitCode() || !after.stdout().equals(before.stdout())) {
            issues.add(ValidationIssue.error(ValidationIssueType.SMOKE_MISMATCH,
                    "Output behaves differently from input (exit " + before.exitCode() + " vs " + after.exitCode() + ")",
                    after.stderr()));
        }
    }

    private static long rangeKey(Span span) {
        return ((long) span.start() << 32) | (span.end() & 0xffffffffL);
    }

    private ValidationResult finish(List<ValidationIssue> issues) {
        ValidationResult result = ValidationResult.of(issues);
        if (!issues.isEmpty()) {
            log.info("[ValidityGate] {} issues ({} errors, {} warnings)",
                    issues.size(), result.errors().size(), result.warnings().size());
        }
        return result;
    }
}
