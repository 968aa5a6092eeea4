package com.codeveil.infrastructure.obfuscation.pipeline;

import com.codeveil.domain.obfuscation.model.Diagnostic;
import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.PipelineResult;
import com.codeveil.domain.obfuscation.model.PipelineState;
import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.SpanKind;
import com.codeveil.domain.obfuscation.model.TechniqueDescriptor;
import com.codeveil.domain.obfuscation.model.ValidationIssue;
import com.codeveil.domain.obfuscation.model.ValidationResult;
import com.codeveil.domain.obfuscation.service.ObfuscationService;
import com.codeveil.infrastructure.obfuscation.ObfuscationException;
import com.codeveil.infrastructure.obfuscation.scanner.PythonScanner;
import com.codeveil.infrastructure.obfuscation.scanner.SourceStructure;
import com.codeveil.infrastructure.obfuscation.technique.TechniqueRun;
import com.codeveil.infrastructure.obfuscation.validation.ValidityGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orchestrates one obfuscation run:
 * <p>
 * scan → select → apply (priority order) → validate → accept | reduce → apply … → fall back to the original
 * </p>
 * Every attempt starts again from the same scan with a fresh {@link TechniqueRun} seeded identically,
 * so a reduced retry differs from the previous attempt only by the dropped technique.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ObfuscationPipeline implements ObfuscationService {

    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private final PythonScanner scanner;
    private final TechniqueComposer composer;
    private final TechniqueRegistry registry;
    private final ValidityGate validityGate;

    @Override
    public PipelineResult obfuscate(String source, ObfuscationConfig config) {
        return execute(source, config).toPipelineResult();
    }

    /**
     * Run the state machine and return the full context (state history included).
     *
     * @throws com.codeveil.infrastructure.obfuscation.ScanException if the source cannot be scanned
     * @throws com.codeveil.infrastructure.obfuscation.NameSpaceExhaustedException if name generation gives up
     */
    public ObfuscationPipelineContext execute(String source, ObfuscationConfig config) {
        ObfuscationPipelineContext ctx = new ObfuscationPipelineContext();
        ctx.setSource(source);
        ctx.setConfig(config);
        ctx.setSeed(config.randomizeSeed() ? ThreadLocalRandom.current().nextLong() : config.seed());

        // 1. Scan (fatal on failure)
        List<Span> spans = scanner.scan(source);
        ctx.setScannedSpans(spans);

        // 2. Select
        List<TechniqueDescriptor> selected = composer.select(config);
        ctx.setSelected(selected);
        ctx.setActive(new ArrayList<>(selected));
        ctx.transition(PipelineState.SELECTED);
        log.info("[Pipeline] Selected techniques: {} (level={}, seed={})",
                selected.stream().map(TechniqueDescriptor::name).toList(), config.level(), ctx.getSeed());

        ValidationResult input = validityGate.validateInput(spans);
        if (!input.passed()) {
            input.errors().forEach(i -> ctx.getDiagnostics().add(Diagnostic.error("validity_gate", "Input: " + i.message())));
            return fail(ctx, "Input does not pass structural checks");
        }

        Set<String> existingNames = existingNames(spans);
        while (true) {
            if (ctx.getActive().isEmpty()) {
                return fail(ctx, "No technique subset passed validation");
            }
            if (ctx.getAttempts() >= config.maxAttempts()) {
                return fail(ctx, "Retry bound of " + config.maxAttempts() + " attempts exhausted");
            }
            if (attempt(ctx, existingNames)) {
                return ctx;
            }
        }
    }

    /**
     * One Applying → Validating round. True when the candidate was accepted.
     */
    private boolean attempt(ObfuscationPipelineContext ctx, Set<String> existingNames) {
        ctx.setAttempts(ctx.getAttempts() + 1);
        ctx.transition(PipelineState.APPLYING);

        TechniqueRun run = new TechniqueRun(ctx.getConfig(), ctx.getSeed(), existingNames);
        List<Span> current = ctx.getScannedSpans();
        List<String> applied = new ArrayList<>();
        for (TechniqueDescriptor descriptor : ctx.getActive()) {
            try {
                current = registry.technique(descriptor.name()).apply(current, run);
                applied.add(descriptor.name());
            } catch (ObfuscationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[Pipeline] Technique {} failed on attempt {}: {}", descriptor.name(), ctx.getAttempts(), e.getMessage());
                ctx.getDiagnostics().addAll(run.getDiagnostics());
                ctx.getDiagnostics().add(Diagnostic.warning(descriptor.name(), "Technique failed: " + e.getMessage()));
                reduce(ctx, composer.dropFailing(ctx.getActive(), descriptor.name()));
                return false;
            }
        }
        ctx.getDiagnostics().addAll(run.getDiagnostics());

        ctx.transition(PipelineState.VALIDATING);
        String candidate = render(current);
        ValidationResult validation = validityGate.validate(current, candidate, ctx.getSource(), ctx.getScannedSpans());
        ctx.setValidationResult(validation);
        for (ValidationIssue issue : validation.warnings()) {
            ctx.getDiagnostics().add(Diagnostic.warning("validity_gate", issue.message()));
        }

        if (validation.passed()) {
            ctx.setOutputText(candidate);
            ctx.setAppliedTechniques(applied);
            ctx.transition(PipelineState.ACCEPTED);
            log.info("[Pipeline] Accepted on attempt {} with {}", ctx.getAttempts(), applied);
            return true;
        }

        for (ValidationIssue issue : validation.errors()) {
            ctx.getDiagnostics().add(Diagnostic.warning("validity_gate",
                    "Attempt " + ctx.getAttempts() + " rejected: " + issue.message()));
        }
        reduce(ctx, composer.reduce(ctx.getActive()));
        return false;
    }

    private void reduce(ObfuscationPipelineContext ctx, TechniqueComposer.Reduction reduction) {
        ctx.transition(PipelineState.REDUCING);
        ctx.setActive(new ArrayList<>(reduction.remaining()));
        String message = "Dropped " + reduction.dropped().name() + " (" + reduction.reason() + ")";
        ctx.getDiagnostics().add(Diagnostic.info("composer", message));
        log.info("[Pipeline] {}", message);
    }

    private ObfuscationPipelineContext fail(ObfuscationPipelineContext ctx, String reason) {
        ctx.transition(PipelineState.FAILED);
        ctx.setOutputText(ctx.getSource());
        ctx.setAppliedTechniques(List.of());
        ctx.getDiagnostics().add(Diagnostic.warning("pipeline", reason + "; emitting original source unchanged"));
        ctx.transition(PipelineState.FALLBACK_ORIGINAL);
        log.warn("[Pipeline] Falling back to original source after {} attempt(s): {}", ctx.getAttempts(), reason);
        return ctx;
    }

    /**
     * Identifiers in code plus identifier-shaped words inside literals; generated names must avoid all of them.
     */
    private static Set<String> existingNames(List<Span> spans) {
        Set<String> names = new LinkedHashSet<>(SourceStructure.of(spans).identifiers());
        for (Span span : spans) {
            if (span.kind() != SpanKind.CODE) {
                Matcher m = IDENTIFIER.matcher(span.text());
                while (m.find()) {
                    names.add(m.group());
                }
            }
        }
        return names;
    }

    static String render(List<Span> spans) {
        StringBuilder sb = new StringBuilder();
        spans.forEach(s -> sb.append(s.text()));
        return sb.toString();
    }
}
