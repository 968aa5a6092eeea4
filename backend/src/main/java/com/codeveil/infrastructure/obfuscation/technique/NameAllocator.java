package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.NamePattern;
import com.codeveil.infrastructure.obfuscation.NameSpaceExhaustedException;

import java.util.Collection;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/**
 * Issues fresh identifiers for one run. A name is never issued twice and never equals an
 * identifier already present in the source, a keyword or builtin, or an excluded name.
 */
public class NameAllocator {

    static final int MAX_ATTEMPTS = 64;

    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String ALPHANUMERIC = LETTERS + "0123456789";
    private static final String HEX_DIGITS = "0123456789abcdef";

    private final NamePattern pattern;
    private final Random random;
    private final ExclusionPolicy exclusions;
    private final Set<String> taken = new HashSet<>();
    private int counter;

    public NameAllocator(NamePattern pattern, Random random, ExclusionPolicy exclusions) {
        this.pattern = pattern;
        this.random = random;
        this.exclusions = exclusions;
    }

    public void reserve(Collection<String> names) {
        taken.addAll(names);
    }

    public boolean isTaken(String name) {
        return taken.contains(name);
    }

    /**
     * @throws NameSpaceExhaustedException if no usable candidate turns up within the retry bound
     */
    public String allocate() {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = candidate();
            if (!taken.contains(candidate) && !PythonNames.isReserved(candidate) && !exclusions.isExcluded(candidate)) {
                taken.add(candidate);
                return candidate;
            }
        }
        throw new NameSpaceExhaustedException(pattern, MAX_ATTEMPTS);
    }

    private String candidate() {
        return switch (pattern) {
            case RANDOM -> {
                StringBuilder sb = new StringBuilder();
                sb.append(LETTERS.charAt(random.nextInt(LETTERS.length())));
                int length = 5 + random.nextInt(7);
                for (int i = 0; i < length; i++) {
                    sb.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
                }
                yield sb.toString();
            }
            case HEX -> {
                StringBuilder sb = new StringBuilder("_0x");
                for (int i = 0; i < 6; i++) {
                    sb.append(HEX_DIGITS.charAt(random.nextInt(HEX_DIGITS.length())));
                }
                yield sb.toString();
            }
            case SEQUENTIAL -> "_v" + (++counter);
        };
    }
}
