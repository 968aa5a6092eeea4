package com.codeveil.domain.obfuscation.model;

public enum ValidationIssueType {
    SCAN_FAILURE,
    UNBALANCED_BRACKET,
    INDENTATION,
    BLOCK_STRUCTURE,
    CLAUSE_ORDER,
    ADJACENT_OPERANDS,
    FUTURE_IMPORT_PLACEMENT,
    RETURN_OUTSIDE_FUNCTION,
    PROTECTED_SPAN_ALTERED,
    EXTERNAL_COMPILE,
    SMOKE_MISMATCH,
    INTERPRETER_UNAVAILABLE
}
