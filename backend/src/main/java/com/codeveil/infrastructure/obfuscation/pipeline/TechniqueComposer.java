package com.codeveil.infrastructure.obfuscation.pipeline;

import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.TechniqueDescriptor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Chooses which techniques run, in which order, and which one to give up on next.
 */
@Component
@RequiredArgsConstructor
public class TechniqueComposer {

    private static final Comparator<TechniqueDescriptor> BY_PRIORITY_DESC =
            Comparator.comparingInt(TechniqueDescriptor::priority).reversed();

    private final TechniqueRegistry registry;

    /**
     * @param dropped   technique removed from the active set
     * @param remaining active set after the removal, still in application order
     * @param reason    why this technique was chosen
     */
    public record Reduction(TechniqueDescriptor dropped, List<TechniqueDescriptor> remaining, String reason) {}

    /**
     * Explicit technique names win over the level. Result is ordered by descending priority.
     *
     * @throws IllegalArgumentException for an unknown technique name
     */
    public List<TechniqueDescriptor> select(ObfuscationConfig config) {
        List<TechniqueDescriptor> selected = new ArrayList<>();
        if (config.hasExplicitTechniques()) {
            for (String name : new LinkedHashSet<>(config.techniques())) {
                selected.add(registry.descriptor(name)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown technique: " + name)));
            }
        } else {
            for (TechniqueDescriptor descriptor : registry.all()) {
                if (descriptor.appliesTo(config.level())) {
                    selected.add(descriptor);
                }
            }
        }
        selected.sort(BY_PRIORITY_DESC);
        return selected;
    }

    /**
     * After a failed validation: the lowest-priority member of a conflicting pair if the active set
     * has one, otherwise the lowest-priority active technique.
     */
    public Reduction reduce(List<TechniqueDescriptor> active) {
        if (active.isEmpty()) {
            throw new IllegalStateException("Nothing left to reduce");
        }
        Set<TechniqueDescriptor> conflicting = new LinkedHashSet<>();
        for (int i = 0; i < active.size(); i++) {
            for (int j = i + 1; j < active.size(); j++) {
                if (active.get(i).conflictsWith(active.get(j))) {
                    conflicting.add(active.get(i));
                    conflicting.add(active.get(j));
                }
            }
        }
        if (!conflicting.isEmpty()) {
            TechniqueDescriptor dropped = conflicting.stream().min(Comparator.comparingInt(TechniqueDescriptor::priority)).orElseThrow();
            return without(active, dropped, "conflicts with " + conflicting.stream()
                    .filter(d -> d != dropped)
                    .map(TechniqueDescriptor::name)
                    .toList());
        }
        TechniqueDescriptor dropped = active.stream().min(Comparator.comparingInt(TechniqueDescriptor::priority)).orElseThrow();
        return without(active, dropped, "lowest priority");
    }

    /**
     * After a technique raised an unexpected error.
     */
    public Reduction dropFailing(List<TechniqueDescriptor> active, String failing) {
        TechniqueDescriptor dropped = active.stream()
                .filter(d -> d.name().equals(failing))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Technique not active: " + failing));
        return without(active, dropped, "raised an error");
    }

    private static Reduction without(List<TechniqueDescriptor> active, TechniqueDescriptor dropped, String reason) {
        List<TechniqueDescriptor> remaining = new ArrayList<>(active);
        remaining.remove(dropped);
        return new Reduction(dropped, List.copyOf(remaining), reason);
    }
}
