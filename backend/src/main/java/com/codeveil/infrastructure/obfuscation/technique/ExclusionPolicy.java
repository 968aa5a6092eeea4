package com.codeveil.infrastructure.obfuscation.technique;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled exclusion patterns. A name is excluded when any pattern is found anywhere in it.
 */
public final class ExclusionPolicy {

    private final List<Pattern> patterns;

    public ExclusionPolicy(List<String> expressions) {
        try {
            this.patterns = expressions.stream().map(Pattern::compile).toList();
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid exclusion pattern: " + e.getPattern(), e);
        }
    }

    public boolean isExcluded(String name) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }
}
