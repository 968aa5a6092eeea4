package com.codeveil.infrastructure.obfuscation.pipeline;

import com.codeveil.domain.obfuscation.model.Diagnostic;
import com.codeveil.domain.obfuscation.model.PipelineResult;
import com.codeveil.domain.obfuscation.model.PipelineState;
import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.TechniqueDescriptor;
import com.codeveil.infrastructure.obfuscation.ObfuscationTestSupport;
import com.codeveil.infrastructure.obfuscation.ScanException;
import com.codeveil.infrastructure.obfuscation.technique.ObfuscationTechnique;
import com.codeveil.infrastructure.obfuscation.technique.TechniqueRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObfuscationPipelineTest {

    private final ObfuscationPipeline pipeline = ObfuscationTestSupport.pipeline();

    /**
     * Test technique that hands its input back, optionally with extra trailing code.
     */
    private record StubTechnique(String name, String suffix) implements ObfuscationTechnique {
        @Override
        public List<Span> apply(List<Span> spans, TechniqueRun run) {
            List<Span> out = new ArrayList<>(spans);
            if (suffix != null) {
                out.add(Span.code(suffix));
            }
            return out;
        }
    }

    private record ThrowingTechnique(String name) implements ObfuscationTechnique {
        @Override
        public List<Span> apply(List<Span> spans, TechniqueRun run) {
            throw new IllegalStateException("boom");
        }
    }

    private static ObfuscationPipeline stubPipeline(List<TechniqueDescriptor> descriptors, List<ObfuscationTechnique> techniques) {
        return ObfuscationTestSupport.pipeline(new TechniqueRegistry(descriptors, techniques));
    }

    @Nested
    @DisplayName("Accepted runs")
    class AcceptedTests {
        @Test
        void level_one_on_assignment() {
            PipelineResult result = pipeline.obfuscate("x = 5\n", ObfuscationTestSupport.config().level(1).build());

            assertThat(result.finalState()).isEqualTo(PipelineState.ACCEPTED);
            assertThat(result.appliedTechniques()).containsExactly("string_encoding", "numeric_substitution");
            assertThat(result.fallbackOccurred()).isFalse();
            assertThat(result.attempts()).isEqualTo(1);
            assertThat(result.outputText()).startsWith("x = ").doesNotContain("x = 5\n");
        }

        @Test
        void interpolated_strings_survive_untouched() {
            String source = "name = 'world'\nprint(f\"hello {name}!\")\n";

            PipelineResult result = pipeline.obfuscate(source, ObfuscationTestSupport.config().level(1).build());

            assertThat(result.finalState()).isEqualTo(PipelineState.ACCEPTED);
            assertThat(result.outputText()).contains("f\"hello {name}!\"").doesNotContain("'world'");
        }

        @Test
        void renaming_replaces_definitions_and_keeps_builtins() {
            String source = "def add(a, b):\n    return a + b\n\nprint(add(1, 2))\n";

            PipelineResult result = pipeline.obfuscate(source, ObfuscationTestSupport.config()
                    .techniques(List.of("identifier_renaming")).build());

            assertThat(result.finalState()).isEqualTo(PipelineState.ACCEPTED);
            assertThat(result.outputText()).doesNotContain("def add(").contains("print(");
        }

        @Test
        void same_seed_same_output() {
            String source = ObfuscationTestSupport.sample("complex.py");

            PipelineResult first = pipeline.obfuscate(source, ObfuscationTestSupport.config().level(3).build());
            PipelineResult second = pipeline.obfuscate(source, ObfuscationTestSupport.config().level(3).build());

            assertThat(first.outputText()).isEqualTo(second.outputText());
        }

        @Test
        void level_four_on_realistic_module_emits_consistent_output() {
            String source = ObfuscationTestSupport.sample("complex.py");

            ObfuscationPipelineContext ctx = pipeline.execute(source, ObfuscationTestSupport.config().level(4).build());

            assertThat(ctx.getState().isTerminal()).isTrue();
            if (ctx.getState() == PipelineState.ACCEPTED) {
                assertThat(ctx.getOutputText()).startsWith("#!/usr/bin/env python3\n")
                        .contains("from __future__ import annotations")
                        .contains("\"\"\"Inventory bookkeeping used by the obfuscation tests.\"\"\"");
                assertThat(ctx.getAppliedTechniques()).isNotEmpty();
            } else {
                assertThat(ctx.getOutputText()).isEqualTo(source);
            }
        }
    }

    @Nested
    @DisplayName("Reduction and fallback")
    class FallbackTests {
        private final TechniqueDescriptor alpha = new TechniqueDescriptor("alpha", 1, 4, 20, Set.of());
        private final TechniqueDescriptor beta = new TechniqueDescriptor("beta", 1, 4, 10, Set.of("alpha"));

        @Test
        void conflicting_breaker_is_dropped_and_retry_succeeds() {
            ObfuscationPipeline stubbed = stubPipeline(List.of(alpha, beta),
                    List.of(new StubTechnique("alpha", null), new StubTechnique("beta", "(\n")));

            ObfuscationPipelineContext ctx = stubbed.execute("x = 1\n", ObfuscationTestSupport.config().build());
            PipelineResult result = ctx.toPipelineResult();

            assertThat(result.finalState()).isEqualTo(PipelineState.ACCEPTED);
            assertThat(result.attempts()).isEqualTo(2);
            assertThat(result.fallbackOccurred()).isTrue();
            assertThat(result.appliedTechniques()).containsExactly("alpha");
            assertThat(result.outputText()).isEqualTo("x = 1\n");
            assertThat(ctx.getStateHistory()).containsExactly(
                    PipelineState.SELECTED, PipelineState.APPLYING, PipelineState.VALIDATING,
                    PipelineState.REDUCING, PipelineState.APPLYING, PipelineState.VALIDATING,
                    PipelineState.ACCEPTED);
        }

        @Test
        void nothing_passes_so_original_is_emitted() {
            ObfuscationPipeline stubbed = stubPipeline(List.of(beta), List.of(new StubTechnique("beta", "(\n")));
            String source = "x = 1  # keep\n";

            ObfuscationPipelineContext ctx = stubbed.execute(source, ObfuscationTestSupport.config().build());
            PipelineResult result = ctx.toPipelineResult();

            assertThat(result.finalState()).isEqualTo(PipelineState.FALLBACK_ORIGINAL);
            assertThat(result.outputText()).isEqualTo(source);
            assertThat(result.appliedTechniques()).isEmpty();
            assertThat(result.fallbackOccurred()).isTrue();
            assertThat(result.warnings()).isNotEmpty();
            assertThat(ctx.getStateHistory()).endsWith(PipelineState.FAILED, PipelineState.FALLBACK_ORIGINAL);
        }

        @Test
        void retry_bound_is_honoured() {
            ObfuscationPipeline stubbed = stubPipeline(List.of(alpha, beta),
                    List.of(new StubTechnique("alpha", "(\n"), new StubTechnique("beta", null)));

            PipelineResult result = stubbed.obfuscate("x = 1\n", ObfuscationTestSupport.config().maxAttempts(1).build());

            assertThat(result.finalState()).isEqualTo(PipelineState.FALLBACK_ORIGINAL);
            assertThat(result.attempts()).isEqualTo(1);
        }

        @Test
        void throwing_technique_is_dropped() {
            ObfuscationPipeline stubbed = stubPipeline(List.of(alpha, beta),
                    List.of(new StubTechnique("alpha", null), new ThrowingTechnique("beta")));

            PipelineResult result = stubbed.obfuscate("x = 1\n", ObfuscationTestSupport.config().build());

            assertThat(result.finalState()).isEqualTo(PipelineState.ACCEPTED);
            assertThat(result.appliedTechniques()).containsExactly("alpha");
            assertThat(result.diagnostics()).extracting(Diagnostic::message)
                    .anyMatch(m -> m.contains("boom"));
        }

        @Test
        void structurally_invalid_input_falls_back_without_attempts() {
            String source = "return 1\n";

            PipelineResult result = pipeline.obfuscate(source, ObfuscationTestSupport.config().build());

            assertThat(result.finalState()).isEqualTo(PipelineState.FALLBACK_ORIGINAL);
            assertThat(result.attempts()).isZero();
            assertThat(result.outputText()).isEqualTo(source);
            assertThat(result.diagnostics()).extracting(Diagnostic::severity).contains(Diagnostic.Severity.ERROR);
        }

        @Test
        void unscannable_input_is_fatal() {
            assertThatThrownBy(() -> pipeline.obfuscate("s = 'open\n", ObfuscationTestSupport.config().build()))
                    .isInstanceOf(ScanException.class);
        }
    }
}
