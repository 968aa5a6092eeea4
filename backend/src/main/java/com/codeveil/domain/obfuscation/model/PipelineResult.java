package com.codeveil.domain.obfuscation.model;

import java.util.List;

/**
 * Final output of one pipeline run.
 *
 * @param outputText        the emitted text (the untouched input on FALLBACK_ORIGINAL)
 * @param appliedTechniques techniques whose output was accepted, in application order
 * @param fallbackOccurred  true if any reduction happened or the original was emitted
 * @param diagnostics       everything the run reported
 * @param finalState        ACCEPTED or FALLBACK_ORIGINAL
 * @param attempts          number of Applying rounds executed
 */
public record PipelineResult(
        String outputText,
        List<String> appliedTechniques,
        boolean fallbackOccurred,
        List<Diagnostic> diagnostics,
        PipelineState finalState,
        int attempts
) {
    public boolean isFallbackOriginal() {
        return finalState == PipelineState.FALLBACK_ORIGINAL;
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.severity() == Diagnostic.Severity.WARNING).toList();
    }
}
