package com.codeveil.interfaces.api.dto;

import com.codeveil.infrastructure.obfuscation.config.ConfigOverrides;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ObfuscateRequest(
        @NotNull(message = "Source is required")
        String source,

        @Size(max = 255, message = "File name must not exceed 255 characters")
        String fileName,

        String language,

        @Min(value = 1, message = "Level must be between 1 and 4")
        @Max(value = 4, message = "Level must be between 1 and 4")
        Integer level,

        List<String> techniques,

        String namePattern,

        String stringEncoding,

        Integer textBase,

        Long seed,

        Boolean randomizeSeed,

        List<String> excludedPatterns,

        @DecimalMin(value = "0.0", message = "Dead code density must be within [0, 1]")
        @DecimalMax(value = "1.0", message = "Dead code density must be within [0, 1]")
        Double deadCodeDensity,

        @Min(value = 1, message = "Max attempts must be positive")
        Integer maxAttempts
) {
    public ConfigOverrides toOverrides() {
        return new ConfigOverrides(level, techniques, namePattern, stringEncoding, textBase,
                randomizeSeed, seed, excludedPatterns, deadCodeDensity, maxAttempts);
    }
}
