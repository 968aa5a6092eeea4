package com.codeveil.domain.obfuscation.service;

import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.PipelineResult;

/**
 * Domain service interface for behavior-preserving source obfuscation.
 */
public interface ObfuscationService {

    /**
     * Runs one pipeline over a single source unit.
     *
     * @param source the complete Python source text
     * @param config settings for this run
     * @return the accepted output, or the untouched source when every reduction failed validation
     * @throws com.codeveil.infrastructure.obfuscation.ScanException if the source cannot be tokenized
     * @throws com.codeveil.infrastructure.obfuscation.NameSpaceExhaustedException if no fresh name can be generated
     */
    PipelineResult obfuscate(String source, ObfuscationConfig config);
}
