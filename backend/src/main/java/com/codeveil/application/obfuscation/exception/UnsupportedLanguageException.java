package com.codeveil.application.obfuscation.exception;

public class UnsupportedLanguageException extends RuntimeException {
    public UnsupportedLanguageException(String language) {
        super("Language '" + language + "' is not supported; only python sources can be obfuscated.");
    }
}
