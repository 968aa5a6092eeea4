package com.codeveil.domain.obfuscation.model;

public enum PipelineState {
    SELECTED,
    APPLYING,
    VALIDATING,
    ACCEPTED,
    REDUCING,
    FAILED,
    FALLBACK_ORIGINAL;

    public boolean isTerminal() {
        return this == ACCEPTED || this == FALLBACK_ORIGINAL;
    }
}
