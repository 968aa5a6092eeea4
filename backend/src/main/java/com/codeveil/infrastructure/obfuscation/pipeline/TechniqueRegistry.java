package com.codeveil.infrastructure.obfuscation.pipeline;

import com.codeveil.domain.obfuscation.model.TechniqueDescriptor;
import com.codeveil.infrastructure.obfuscation.technique.DeadCodeInjector;
import com.codeveil.infrastructure.obfuscation.technique.IdentifierRenamer;
import com.codeveil.infrastructure.obfuscation.technique.ImportIndirector;
import com.codeveil.infrastructure.obfuscation.technique.NumericSubstitutionTechnique;
import com.codeveil.infrastructure.obfuscation.technique.ObfuscationTechnique;
import com.codeveil.infrastructure.obfuscation.technique.StringEncodingTechnique;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static descriptor table joined with the technique implementations.
 */
@Component
public class TechniqueRegistry {

    static final List<TechniqueDescriptor> DESCRIPTORS = List.of(
            new TechniqueDescriptor(ImportIndirector.NAME, 3, 4, 50, Set.of()),
            new TechniqueDescriptor(StringEncodingTechnique.NAME, 1, 4, 40, Set.of()),
            new TechniqueDescriptor(NumericSubstitutionTechnique.NAME, 1, 4, 30, Set.of()),
            new TechniqueDescriptor(IdentifierRenamer.NAME, 2, 4, 20, Set.of()),
            new TechniqueDescriptor(DeadCodeInjector.NAME, 4, 4, 10, Set.of(StringEncodingTechnique.NAME))
    );

    private final Map<String, TechniqueDescriptor> descriptors = new LinkedHashMap<>();
    private final Map<String, ObfuscationTechnique> techniques = new LinkedHashMap<>();

    @Autowired
    public TechniqueRegistry(List<ObfuscationTechnique> techniques) {
        this(DESCRIPTORS, techniques);
    }

    public TechniqueRegistry(List<TechniqueDescriptor> descriptors, List<ObfuscationTechnique> techniques) {
        descriptors.forEach(d -> this.descriptors.put(d.name(), d));
        for (ObfuscationTechnique technique : techniques) {
            if (!this.descriptors.containsKey(technique.name())) {
                throw new IllegalStateException("No descriptor for technique: " + technique.name());
            }
            this.techniques.put(technique.name(), technique);
        }
        for (String name : this.descriptors.keySet()) {
            if (!this.techniques.containsKey(name)) {
                throw new IllegalStateException("No implementation for technique: " + name);
            }
        }
    }

    public Optional<TechniqueDescriptor> descriptor(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    public ObfuscationTechnique technique(String name) {
        ObfuscationTechnique technique = techniques.get(name);
        if (technique == null) {
            throw new IllegalArgumentException("Unknown technique: " + name);
        }
        return technique;
    }

    public Collection<TechniqueDescriptor> all() {
        return Collections.unmodifiableCollection(descriptors.values());
    }
}
