package com.codeveil.infrastructure.obfuscation.config;

import java.util.List;

/**
 * Per-invocation settings from a request body or command line; null fields keep the base value.
 */
public record ConfigOverrides(
        Integer level,
        List<String> techniques,
        String namePattern,
        String stringEncoding,
        Integer textBase,
        Boolean randomizeSeed,
        Long seed,
        List<String> excludedPatterns,
        Double deadCodeDensity,
        Integer maxAttempts
) {
    public static ConfigOverrides none() {
        return new ConfigOverrides(null, null, null, null, null, null, null, null, null, null);
    }
}
