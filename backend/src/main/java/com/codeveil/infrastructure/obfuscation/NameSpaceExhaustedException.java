package com.codeveil.infrastructure.obfuscation;

import com.codeveil.domain.obfuscation.model.NamePattern;

public class NameSpaceExhaustedException extends ObfuscationException {

    public NameSpaceExhaustedException(NamePattern pattern, int attempts) {
        super("No unused identifier found for pattern '" + pattern.value() + "' after " + attempts + " attempts");
    }
}
