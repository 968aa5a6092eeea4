package com.codeveil.domain.obfuscation.model;

import java.util.Set;

/**
 * Static description of one technique.
 *
 * @param name          technique name used in configuration
 * @param minLevel      lowest level that selects this technique
 * @param maxLevel      highest level that selects this technique
 * @param priority      higher runs earlier and is dropped later
 * @param conflictsWith techniques that cannot safely co-run without triggering a reduction
 */
public record TechniqueDescriptor(
        String name,
        int minLevel,
        int maxLevel,
        int priority,
        Set<String> conflictsWith
) {
    public TechniqueDescriptor {
        conflictsWith = conflictsWith == null ? Set.of() : Set.copyOf(conflictsWith);
    }

    public boolean appliesTo(int level) {
        return level >= minLevel && level <= maxLevel;
    }

    public boolean conflictsWith(TechniqueDescriptor other) {
        return conflictsWith.contains(other.name()) || other.conflictsWith().contains(name);
    }
}
