package com.codeveil.infrastructure.obfuscation.scanner;

public enum BlockKind {
    MODULE,
    CLASS,
    FUNCTION
}
