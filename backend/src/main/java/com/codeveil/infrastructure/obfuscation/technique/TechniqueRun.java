package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.Diagnostic;
import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.RenameMap;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * State of one Applying attempt: seeded randomness, the name allocator, the rename map, the decode
 * helpers registered so far and the diagnostics produced by the techniques. Never shared between runs.
 */
@Getter
public class TechniqueRun {

    /**
     * A module-level decode function requested during this attempt.
     */
    @Getter
    public static final class DecodeHelper {
        private final String name;
        private final String parameter;
        private final int base;
        private boolean installed;

        DecodeHelper(String name, String parameter, int base) {
            this.name = name;
            this.parameter = parameter;
            this.base = base;
        }

        void markInstalled() {
            this.installed = true;
        }
    }

    private final ObfuscationConfig config;
    private final long seed;
    private final Random random;
    private final ExclusionPolicy exclusions;
    private final NameAllocator allocator;
    private final RenameMap renameMap = new RenameMap();
    private final Map<Integer, DecodeHelper> decodeHelpers = new LinkedHashMap<>();
    private final Set<String> declaredInsertions = new LinkedHashSet<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public TechniqueRun(ObfuscationConfig config, long seed, Collection<String> existingNames) {
        this.config = config;
        this.seed = seed;
        this.random = new Random(seed);
        this.exclusions = new ExclusionPolicy(config.excludedPatterns());
        this.allocator = new NameAllocator(config.namePattern(), random, exclusions);
        this.allocator.reserve(existingNames);
    }

    /**
     * Helper for the given payload base, allocating its names on first request.
     */
    public DecodeHelper decodeHelper(int base) {
        return decodeHelpers.computeIfAbsent(base, b -> new DecodeHelper(allocator.allocate(), allocator.allocate(), b));
    }

    public void declareInsertion(String technique) {
        declaredInsertions.add(technique);
    }

    public void info(String stage, String message) {
        diagnostics.add(Diagnostic.info(stage, message));
    }

    public void warn(String stage, String message) {
        diagnostics.add(Diagnostic.warning(stage, message));
    }
}
