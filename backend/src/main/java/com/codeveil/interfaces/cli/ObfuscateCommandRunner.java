package com.codeveil.interfaces.cli;

import com.codeveil.application.obfuscation.ObfuscationAppService;
import com.codeveil.application.obfuscation.ObfuscationAppService.FileOutcome;
import com.codeveil.domain.obfuscation.model.Diagnostic;
import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.PipelineResult;
import com.codeveil.domain.obfuscation.model.TechniqueDescriptor;
import com.codeveil.infrastructure.obfuscation.ObfuscationException;
import com.codeveil.infrastructure.obfuscation.config.ConfigOverrides;
import com.codeveil.infrastructure.obfuscation.config.ObfuscationConfigLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Command line entry point. Active only when the process was started with one of the
 * command options; otherwise the application runs as a web service.
 *
 * Option values are given as {@code --name=value}.
 * <pre>
 * --input=FILE [--output=FILE] | --input-dir=DIR [--output-dir=DIR] | --list-techniques
 * [--language=NAME] [--level=1..4] [--techniques=a,b] [--config=FILE]
 * [--name-pattern=random|hex|sequential] [--string-encoding=charcode|base64|hex]
 * [--seed=N] [--randomize] [--dry-run] [--verbose]
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ObfuscateCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Set<String> COMMAND_OPTIONS = Set.of("input", "input-dir", "list-techniques");

    private final ObfuscationAppService obfuscationAppService;
    private final ObfuscationConfigLoader configLoader;

    private PrintStream out = System.out;
    private PrintStream err = System.err;
    private int exitCode = EXIT_OK;

    public static boolean isCommandLineInvocation(String... args) {
        return Arrays.stream(args)
                .filter(a -> a.startsWith("--"))
                .map(a -> a.substring(2).split("=", 2)[0])
                .anyMatch(COMMAND_OPTIONS::contains);
    }

    void setStreams(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!isCommandLineInvocation(args.getSourceArgs())) {
            return;
        }
        try {
            exitCode = execute(args);
        } catch (ObfuscationException | IllegalArgumentException | UncheckedIOException e) {
            log.debug("[Cli] Command failed", e);
            err.println("error: " + e.getMessage());
            exitCode = e instanceof IllegalArgumentException ? EXIT_USAGE : EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int execute(ApplicationArguments args) {
        if (args.containsOption("list-techniques")) {
            listTechniques();
            return EXIT_OK;
        }

        ObfuscationConfig config = resolveConfig(args);
        boolean dryRun = args.containsOption("dry-run");
        boolean verbose = args.containsOption("verbose");
        String language = single(args, "language");

        if (args.containsOption("input-dir")) {
            Path inputDir = Path.of(required(args, "input-dir"));
            String outputDir = single(args, "output-dir");
            if (outputDir == null && !dryRun) {
                throw new IllegalArgumentException("--input-dir requires --output-dir unless --dry-run is given");
            }
            List<FileOutcome> outcomes = obfuscationAppService.obfuscateDirectory(
                    inputDir, outputDir != null ? Path.of(outputDir) : null, config, dryRun);
            return reportBatch(outcomes, verbose);
        }

        Path input = Path.of(required(args, "input"));
        String output = single(args, "output");
        PipelineResult result = obfuscationAppService.obfuscateFile(
                input, output != null ? Path.of(output) : null, language, config, dryRun);
        if (output == null && !dryRun) {
            out.print(result.outputText());
            out.flush();
        }
        report(input.toString(), result, verbose || dryRun);
        return EXIT_OK;
    }

    private ObfuscationConfig resolveConfig(ApplicationArguments args) {
        String configFile = single(args, "config");
        ObfuscationConfig base = configLoader.load(configFile != null ? Path.of(configFile) : null);
        String techniques = single(args, "techniques");
        String level = single(args, "level");
        String seed = single(args, "seed");
        return configLoader.applyOverrides(base, new ConfigOverrides(
                level != null ? parseInt("level", level) : null,
                techniques != null ? splitList(techniques) : null,
                single(args, "name-pattern"),
                single(args, "string-encoding"),
                null,
                args.containsOption("randomize") ? Boolean.TRUE : null,
                seed != null ? parseLong("seed", seed) : null,
                null,
                null,
                null));
    }

    private void listTechniques() {
        out.printf("%-22s %-7s %-9s %s%n", "TECHNIQUE", "LEVELS", "PRIORITY", "CONFLICTS");
        for (TechniqueDescriptor d : obfuscationAppService.listTechniques()) {
            out.printf("%-22s %-7s %-9d %s%n", d.name(), d.minLevel() + "-" + d.maxLevel(), d.priority(),
                    d.conflictsWith().isEmpty() ? "-" : String.join(",", d.conflictsWith().stream().sorted().toList()));
        }
        out.flush();
    }

    private int reportBatch(List<FileOutcome> outcomes, boolean verbose) {
        int failed = 0;
        for (FileOutcome outcome : outcomes) {
            if (outcome.succeeded()) {
                report(outcome.input().toString(), outcome.result(), verbose);
            } else {
                failed++;
                err.println(outcome.input() + ": error: " + outcome.error());
            }
        }
        err.printf("%d file(s) processed, %d failed%n", outcomes.size(), failed);
        return failed == 0 ? EXIT_OK : EXIT_FAILURE;
    }

    private void report(String label, PipelineResult result, boolean verbose) {
        for (Diagnostic d : result.diagnostics()) {
            if (verbose || d.severity() != Diagnostic.Severity.INFO) {
                err.printf("%s: %s [%s] %s%n", label, d.severity().name().toLowerCase(), d.stage(), d.message());
            }
        }
        if (verbose) {
            err.printf("%s: %s after %d attempt(s), applied %s%n",
                    label, result.finalState(), result.attempts(), result.appliedTechniques());
        }
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static String required(ApplicationArguments args, String name) {
        String value = single(args, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " requires a value");
        }
        return value;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " expects an integer, got '" + value + "'");
        }
    }

    private static long parseLong(String option, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " expects an integer, got '" + value + "'");
        }
    }
}
