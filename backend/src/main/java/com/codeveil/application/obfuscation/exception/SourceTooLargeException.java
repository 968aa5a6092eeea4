package com.codeveil.application.obfuscation.exception;

public class SourceTooLargeException extends RuntimeException {
    public SourceTooLargeException(int length, int maxLength) {
        super(String.format("Source has %d characters; at most %d are accepted.", length, maxLength));
    }
}
