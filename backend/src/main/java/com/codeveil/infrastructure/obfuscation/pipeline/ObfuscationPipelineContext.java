package com.codeveil.infrastructure.obfuscation.pipeline;

import com.codeveil.domain.obfuscation.model.Diagnostic;
import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.PipelineResult;
import com.codeveil.domain.obfuscation.model.PipelineState;
import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.TechniqueDescriptor;
import com.codeveil.domain.obfuscation.model.ValidationResult;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one pipeline run, accumulated across attempts.
 */
@Data
public class ObfuscationPipelineContext {

    // --- Input ---
    private String source;
    private ObfuscationConfig config;
    private long seed;

    // --- Scan ---
    private List<Span> scannedSpans = new ArrayList<>();

    // --- Composition ---
    private List<TechniqueDescriptor> selected = new ArrayList<>();
    private List<TechniqueDescriptor> active = new ArrayList<>();
    private PipelineState state;
    private List<PipelineState> stateHistory = new ArrayList<>();
    private int attempts;

    // --- Output ---
    private List<String> appliedTechniques = new ArrayList<>();
    private String outputText;
    private ValidationResult validationResult;
    private List<Diagnostic> diagnostics = new ArrayList<>();

    public void transition(PipelineState next) {
        this.state = next;
        this.stateHistory.add(next);
    }

    public PipelineResult toPipelineResult() {
        boolean fallback = state == PipelineState.FALLBACK_ORIGINAL || attempts > 1;
        return new PipelineResult(
                outputText,
                List.copyOf(appliedTechniques),
                fallback,
                List.copyOf(diagnostics),
                state,
                attempts
        );
    }
}
