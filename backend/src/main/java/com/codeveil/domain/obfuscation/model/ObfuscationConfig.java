package com.codeveil.domain.obfuscation.model;

import lombok.Builder;

import java.util.List;

/**
 * Settings for one pipeline run.
 *
 * @param level            obfuscation level 1..4, used when {@code techniques} is empty
 * @param techniques       explicit technique names, overriding the level when non-empty
 * @param namePattern      how generated identifiers look
 * @param stringEncoding   strategy for string literals
 * @param textBase         16 or 64, payload base for {@link StringEncoding#BASE_N_TEXT}
 * @param randomizeSeed    pick a fresh seed per run instead of {@code seed}
 * @param seed             seed for deterministic runs
 * @param excludedPatterns regular expressions; identifiers containing a match are never renamed
 * @param deadCodeDensity  probability (0..1) that an eligible boundary receives a dead statement
 * @param maxAttempts      upper bound on Applying rounds before falling back to the original
 */
@Builder(toBuilder = true)
public record ObfuscationConfig(
        int level,
        List<String> techniques,
        NamePattern namePattern,
        StringEncoding stringEncoding,
        int textBase,
        boolean randomizeSeed,
        long seed,
        List<String> excludedPatterns,
        double deadCodeDensity,
        int maxAttempts
) {
    public ObfuscationConfig {
        if (level < 1 || level > 4) {
            throw new IllegalArgumentException("Obfuscation level must be between 1 and 4, got " + level);
        }
        if (textBase != 16 && textBase != 64) {
            throw new IllegalArgumentException("Text base must be 16 or 64, got " + textBase);
        }
        if (deadCodeDensity < 0.0 || deadCodeDensity > 1.0) {
            throw new IllegalArgumentException("Dead code density must be within [0, 1], got " + deadCodeDensity);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be positive, got " + maxAttempts);
        }
        techniques = techniques == null ? List.of() : List.copyOf(techniques);
        excludedPatterns = excludedPatterns == null ? List.of() : List.copyOf(excludedPatterns);
        namePattern = namePattern == null ? NamePattern.RANDOM : namePattern;
        stringEncoding = stringEncoding == null ? StringEncoding.CHARCODE : stringEncoding;
    }

    public boolean hasExplicitTechniques() {
        return !techniques.isEmpty();
    }
}
