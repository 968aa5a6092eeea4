package com.codeveil.domain.obfuscation.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-run mapping from original to generated identifiers.
 * Injective by construction: registering a generated name twice is rejected.
 */
public class RenameMap {

    public enum DeclarationKind {
        FUNCTION,
        CLASS,
        PARAMETER,
        VARIABLE,
        LOOP_TARGET,
        ALIAS,
        GLOBAL
    }

    public record Entry(String original, String generated, DeclarationKind kind) {}

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Set<String> generatedNames = new HashSet<>();

    public void put(String original, String generated, DeclarationKind kind) {
        if (entries.containsKey(original)) {
            throw new IllegalStateException("Identifier already mapped: " + original);
        }
        if (!generatedNames.add(generated)) {
            throw new IllegalStateException("Generated name issued twice: " + generated);
        }
        entries.put(original, new Entry(original, generated, kind));
    }

    public String get(String original) {
        Entry entry = entries.get(original);
        return entry != null ? entry.generated() : null;
    }

    public boolean contains(String original) {
        return entries.containsKey(original);
    }

    public Collection<Entry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public Set<String> generatedNames() {
        return Collections.unmodifiableSet(generatedNames);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        entries.values().forEach(e -> map.put(e.original(), e.generated()));
        return map;
    }
}
