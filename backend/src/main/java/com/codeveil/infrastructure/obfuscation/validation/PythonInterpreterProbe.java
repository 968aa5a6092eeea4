package com.codeveil.infrastructure.obfuscation.validation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external Python interpreter to compile or execute a source text.
 * A missing interpreter is reported as unavailable, never as a failure of the source.
 */
@Slf4j
@Component
public class PythonInterpreterProbe {

    private static final String COMPILE_SCRIPT =
            "import sys; compile(sys.stdin.read(), '<obfuscated>', 'exec')";

    @Value("${obfuscator.validation.python-command:python3}")
    private String pythonCommand = "python3";

    @Value("${obfuscator.validation.timeout-seconds:10}")
    private long timeoutSeconds = 10;

    public record Outcome(boolean available, boolean timedOut, int exitCode, String stdout, String stderr) {

        static Outcome unavailable(String reason) {
            return new Outcome(false, false, -1, "", reason);
        }

        public boolean succeeded() {
            return available && !timedOut && exitCode == 0;
        }
    }

    public Outcome compile(String source) {
        return run(List.of(pythonCommand, "-c", COMPILE_SCRIPT), source);
    }

    public Outcome execute(String source) {
        return run(List.of(pythonCommand, "-"), source);
    }

    private Outcome run(List<String> command, String stdin) {
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            log.warn("[Probe] Interpreter '{}' could not be started: {}", pythonCommand, e.getMessage());
            return Outcome.unavailable(e.getMessage());
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> read(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));
        try (OutputStream in = process.getOutputStream()) {
            in.write(stdin.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("[Probe] Interpreter closed stdin early: {}", e.getMessage());
        }

        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("[Probe] Interpreter timed out after {}s", timeoutSeconds);
                return new Outcome(true, true, -1, "", "timed out");
            }
            return new Outcome(true, false, process.exitValue(), stdout.join(), stderr.join());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return Outcome.unavailable("interrupted");
        }
    }

    private static String read(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
