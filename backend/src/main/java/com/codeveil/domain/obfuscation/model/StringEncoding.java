package com.codeveil.domain.obfuscation.model;

import java.util.Arrays;

public enum StringEncoding {
    CHARCODE("charcode"),
    BASE_N_TEXT("base-n-text");

    private final String value;

    StringEncoding(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Accepts the canonical names plus the encoder names older config files use
     * ("char_codes", "base64", "hex", "base16").
     */
    public static StringEncoding fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("String encoding is required");
        }
        switch (value.toLowerCase()) {
            case "char_codes", "char-codes":
                return CHARCODE;
            case "base64", "base16", "hex":
                return BASE_N_TEXT;
            default:
                return Arrays.stream(values())
                        .filter(e -> e.value.equalsIgnoreCase(value) || e.name().equalsIgnoreCase(value))
                        .findFirst()
                        .orElseThrow(() -> new IllegalArgumentException("Unknown string encoding: " + value));
        }
    }

    /**
     * Base implied by an encoder alias, or 0 if the alias does not imply one.
     */
    public static int impliedTextBase(String value) {
        if (value == null) {
            return 0;
        }
        return switch (value.toLowerCase()) {
            case "hex", "base16" -> 16;
            case "base64" -> 64;
            default -> 0;
        };
    }
}
