package com.codeveil.interfaces.api.dto;

import com.codeveil.domain.obfuscation.model.Diagnostic;
import com.codeveil.domain.obfuscation.model.PipelineResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObfuscateResponse(
        String obfuscatedCode,
        List<String> appliedTechniques,
        boolean fallbackOccurred,
        String finalState,
        int attempts,
        List<DiagnosticEntry> diagnostics
) {
    public record DiagnosticEntry(String severity, String stage, String message) {}

    public static ObfuscateResponse from(PipelineResult result, boolean verbose) {
        List<DiagnosticEntry> diagnostics = result.diagnostics().stream()
                .filter(d -> verbose || d.severity() != Diagnostic.Severity.INFO)
                .map(d -> new DiagnosticEntry(d.severity().name(), d.stage(), d.message()))
                .toList();
        return new ObfuscateResponse(
                result.outputText(),
                result.appliedTechniques(),
                result.fallbackOccurred(),
                result.finalState().name(),
                result.attempts(),
                diagnostics.isEmpty() ? null : diagnostics);
    }
}
