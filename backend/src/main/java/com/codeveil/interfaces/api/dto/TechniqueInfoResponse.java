package com.codeveil.interfaces.api.dto;

import com.codeveil.domain.obfuscation.model.TechniqueDescriptor;

import java.util.List;

public record TechniqueInfoResponse(
        String name,
        int minLevel,
        int maxLevel,
        int priority,
        List<String> conflictsWith
) {
    public static TechniqueInfoResponse from(TechniqueDescriptor descriptor) {
        return new TechniqueInfoResponse(
                descriptor.name(),
                descriptor.minLevel(),
                descriptor.maxLevel(),
                descriptor.priority(),
                descriptor.conflictsWith().stream().sorted().toList());
    }
}
