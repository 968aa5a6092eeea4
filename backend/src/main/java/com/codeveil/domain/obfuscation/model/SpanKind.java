package com.codeveil.domain.obfuscation.model;

public enum SpanKind {
    CODE,
    STRING_LITERAL,
    INTERPOLATED_LITERAL,
    NUMERIC_LITERAL,
    COMMENT;

    public boolean isStringLike() {
        return this == STRING_LITERAL || this == INTERPOLATED_LITERAL;
    }
}
