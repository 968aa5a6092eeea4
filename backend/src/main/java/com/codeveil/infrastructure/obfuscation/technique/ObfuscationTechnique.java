package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.Span;

import java.util.List;

/**
 * One rewriting pass over a span sequence. Implementations are stateless beans; everything that
 * lives for the duration of a run is carried by {@link TechniqueRun}.
 */
public interface ObfuscationTechnique {

    /**
     * Name matching the technique's descriptor.
     */
    String name();

    /**
     * Rewrite the given spans. Must not modify locked spans and must return a new list.
     */
    List<Span> apply(List<Span> spans, TechniqueRun run);
}
