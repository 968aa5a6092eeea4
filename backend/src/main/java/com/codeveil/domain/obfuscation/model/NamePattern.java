package com.codeveil.domain.obfuscation.model;

import java.util.Arrays;

public enum NamePattern {
    RANDOM("random"),
    HEX("hex"),
    SEQUENTIAL("sequential");

    private final String value;

    NamePattern(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static NamePattern fromValue(String value) {
        if ("numeric".equalsIgnoreCase(value)) {
            return SEQUENTIAL;
        }
        return Arrays.stream(values())
                .filter(p -> p.value.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown name pattern: " + value));
    }
}
