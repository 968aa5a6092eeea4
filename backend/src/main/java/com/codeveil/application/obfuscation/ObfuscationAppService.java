package com.codeveil.application.obfuscation;

import com.codeveil.application.obfuscation.exception.SourceTooLargeException;
import com.codeveil.application.obfuscation.exception.UnsupportedLanguageException;
import com.codeveil.domain.obfuscation.model.Diagnostic;
import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.PipelineResult;
import com.codeveil.domain.obfuscation.model.TechniqueDescriptor;
import com.codeveil.domain.obfuscation.service.ObfuscationService;
import com.codeveil.infrastructure.detection.LanguageDetector;
import com.codeveil.infrastructure.file.SourceFileGateway;
import com.codeveil.infrastructure.obfuscation.pipeline.TechniqueRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class ObfuscationAppService {

    private final ObfuscationService obfuscationService;
    private final LanguageDetector languageDetector;
    private final SourceFileGateway sourceFileGateway;
    private final TechniqueRegistry techniqueRegistry;

    @Value("${obfuscator.max-source-length:1000000}")
    private int maxSourceLength = 1_000_000;

    /**
     * Outcome of one file in a batch run. {@code error} is set when the file could not be processed.
     */
    public record FileOutcome(Path input, Path output, PipelineResult result, String error) {
        public boolean succeeded() {
            return error == null;
        }
    }

    /**
     * Obfuscate in-memory source text.
     *
     * @param fileName optional file name, used for language detection
     * @param language optional explicit language; detected when absent
     */
    public PipelineResult obfuscate(String source, String fileName, String language, ObfuscationConfig config) {
        if (source.length() > maxSourceLength) {
            throw new SourceTooLargeException(source.length(), maxSourceLength);
        }
        String resolved = resolveLanguage(source, fileName, language);
        log.info("[Obfuscate] Processing {} ({} chars, language={})",
                fileName != null ? fileName : "<inline>", source.length(), resolved);

        PipelineResult result = obfuscationService.obfuscate(source, config);
        logDiagnostics(fileName, result);
        return result;
    }

    /**
     * Read, obfuscate and (unless {@code dryRun} or {@code output} is null) write one file.
     */
    public PipelineResult obfuscateFile(Path input, Path output, String language, ObfuscationConfig config, boolean dryRun) {
        String source = sourceFileGateway.read(input);
        PipelineResult result = obfuscate(source, input.getFileName().toString(), language, config);
        if (output != null && !dryRun) {
            sourceFileGateway.write(output, result.outputText());
            log.info("[Obfuscate] Wrote {}", output);
        }
        return result;
    }

    /**
     * Obfuscate every supported file under {@code inputDir} concurrently, mirroring the tree under
     * {@code outputDir}. A failing file is reported in its outcome and does not stop the others.
     */
    public List<FileOutcome> obfuscateDirectory(Path inputDir, Path outputDir, ObfuscationConfig config, boolean dryRun) {
        List<Path> inputs = sourceFileGateway.list(inputDir,
                p -> languageDetector.hasSupportedExtension(p.getFileName().toString()));
        log.info("[Obfuscate] Found {} source file(s) under {}", inputs.size(), inputDir);

        List<CompletableFuture<FileOutcome>> futures = inputs.stream()
                .map(input -> CompletableFuture.supplyAsync(() -> {
                    Path output = outputDir != null ? outputDir.resolve(inputDir.relativize(input)) : null;
                    try {
                        return new FileOutcome(input, output, obfuscateFile(input, output, null, config, dryRun), null);
                    } catch (RuntimeException e) {
                        log.error("[Obfuscate] Failed to process {}: {}", input, e.getMessage());
                        return new FileOutcome(input, output, null, e.getMessage());
                    }
                }))
                .toList();

        return futures.stream().map(CompletableFuture::join).toList();
    }

    public Collection<TechniqueDescriptor> listTechniques() {
        return techniqueRegistry.all();
    }

    public int getMaxSourceLength() {
        return maxSourceLength;
    }

    private String resolveLanguage(String source, String fileName, String language) {
        if (language != null && !language.isBlank()) {
            if (!languageDetector.isSupported(language)) {
                throw new UnsupportedLanguageException(language);
            }
            return language.toLowerCase(Locale.ROOT);
        }
        String detected = languageDetector.detect(fileName, source).orElse(LanguageDetector.PYTHON);
        if (!languageDetector.isSupported(detected)) {
            throw new UnsupportedLanguageException(detected);
        }
        return detected;
    }

    private void logDiagnostics(String fileName, PipelineResult result) {
        String label = fileName != null ? fileName : "<inline>";
        for (Diagnostic d : result.diagnostics()) {
            switch (d.severity()) {
                case ERROR -> log.error("[Obfuscate] {} [{}] {}", label, d.stage(), d.message());
                case WARNING -> log.warn("[Obfuscate] {} [{}] {}", label, d.stage(), d.message());
                default -> log.info("[Obfuscate] {} [{}] {}", label, d.stage(), d.message());
            }
        }
        log.info("[Obfuscate] {} finished: state={}, attempts={}, applied={}, fallback={}",
                label, result.finalState(), result.attempts(), result.appliedTechniques(), result.fallbackOccurred());
    }
}
