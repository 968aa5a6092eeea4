package com.codeveil.interfaces.cli;

import com.codeveil.application.obfuscation.ObfuscationAppService;
import com.codeveil.application.obfuscation.ObfuscationAppService.FileOutcome;
import com.codeveil.domain.obfuscation.model.Diagnostic;
import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.PipelineResult;
import com.codeveil.domain.obfuscation.model.PipelineState;
import com.codeveil.domain.obfuscation.model.TechniqueDescriptor;
import com.codeveil.infrastructure.obfuscation.ScanException;
import com.codeveil.infrastructure.obfuscation.config.ObfuscationConfigLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObfuscateCommandRunnerTest {

    @Mock
    private ObfuscationAppService appService;

    private ObfuscateCommandRunner runner;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() {
        runner = new ObfuscateCommandRunner(appService, new ObfuscationConfigLoader(new ObjectMapper()));
        runner.setStreams(new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
        return runner.getExitCode();
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static PipelineResult result(String output, Diagnostic... diagnostics) {
        return new PipelineResult(output, List.of("string_encoding"), false, List.of(diagnostics), PipelineState.ACCEPTED, 1);
    }

    @Test
    @DisplayName("Web invocations are left alone")
    void not_a_command() {
        assertThat(ObfuscateCommandRunner.isCommandLineInvocation("--server.port=9090")).isFalse();
        assertThat(ObfuscateCommandRunner.isCommandLineInvocation("--input=a.py")).isTrue();
        assertThat(ObfuscateCommandRunner.isCommandLineInvocation("--list-techniques")).isTrue();

        assertThat(run("--server.port=9090")).isZero();
        verifyNoInteractions(appService);
    }

    @Nested
    @DisplayName("Single file")
    class SingleFileTests {
        @Test
        void prints_result_to_stdout_without_output_option() {
            when(appService.obfuscateFile(eq(Path.of("a.py")), isNull(), isNull(), any(), eq(false)))
                    .thenReturn(result("x = chr(97)\n", Diagnostic.info("string_encoding", "Encoded 1 string literal(s)")));

            int code = run("--input=a.py");

            assertThat(code).isZero();
            assertThat(stdout()).isEqualTo("x = chr(97)\n");
            assertThat(stderr()).doesNotContain("Encoded");
        }

        @Test
        void writes_to_output_and_reports_verbosely() {
            when(appService.obfuscateFile(eq(Path.of("a.py")), eq(Path.of("b.py")), isNull(), any(), eq(false)))
                    .thenReturn(result("x = chr(97)\n", Diagnostic.info("string_encoding", "Encoded 1 string literal(s)")));

            int code = run("--input=a.py", "--output=b.py", "--verbose");

            assertThat(code).isZero();
            assertThat(stdout()).isEmpty();
            assertThat(stderr()).contains("[string_encoding] Encoded 1 string literal(s)").contains("ACCEPTED");
        }

        @Test
        void options_become_configuration() {
            when(appService.obfuscateFile(any(), any(), eq("python"), any(), anyBoolean()))
                    .thenReturn(result("x = 1\n"));

            run("--input=a.py", "--language=python", "--level=3", "--techniques=identifier_renaming, string_encoding",
                    "--string-encoding=hex", "--seed=11", "--dry-run");

            ArgumentCaptor<ObfuscationConfig> config = ArgumentCaptor.forClass(ObfuscationConfig.class);
            verify(appService).obfuscateFile(eq(Path.of("a.py")), isNull(), eq("python"), config.capture(), eq(true));
            assertThat(config.getValue().level()).isEqualTo(3);
            assertThat(config.getValue().techniques()).containsExactly("identifier_renaming", "string_encoding");
            assertThat(config.getValue().textBase()).isEqualTo(16);
            assertThat(config.getValue().seed()).isEqualTo(11L);
            assertThat(config.getValue().randomizeSeed()).isFalse();
            assertThat(stdout()).isEmpty();
        }

        @Test
        void bad_number_is_a_usage_error() {
            assertThat(run("--input=a.py", "--level=high")).isEqualTo(ObfuscateCommandRunner.EXIT_USAGE);
            assertThat(stderr()).contains("--level expects an integer");
        }

        @Test
        void scan_failure_is_a_failure() {
            when(appService.obfuscateFile(any(), any(), any(), any(), anyBoolean()))
                    .thenThrow(new ScanException("Unterminated string literal", 2, 4));

            assertThat(run("--input=a.py")).isEqualTo(ObfuscateCommandRunner.EXIT_FAILURE);
            assertThat(stderr()).contains("error: Unterminated string literal (line 2, column 4)");
        }

        @Test
        void warnings_are_always_reported() {
            when(appService.obfuscateFile(any(), any(), any(), any(), anyBoolean()))
                    .thenReturn(result("x = 1\n", Diagnostic.warning("pipeline", "emitting original source unchanged")));

            run("--input=a.py");

            assertThat(stderr()).contains("a.py: warning [pipeline] emitting original source unchanged");
        }
    }

    @Nested
    @DisplayName("Directory")
    class DirectoryTests {
        @Test
        void output_dir_is_required() {
            assertThat(run("--input-dir=src")).isEqualTo(ObfuscateCommandRunner.EXIT_USAGE);
            verifyNoInteractions(appService);
        }

        @Test
        void failures_set_exit_code() {
            when(appService.obfuscateDirectory(eq(Path.of("src")), eq(Path.of("out")), any(), eq(false)))
                    .thenReturn(List.of(
                            new FileOutcome(Path.of("src/a.py"), Path.of("out/a.py"), result("a\n"), null),
                            new FileOutcome(Path.of("src/b.py"), Path.of("out/b.py"), null, "boom")));

            int code = run("--input-dir=src", "--output-dir=out");

            assertThat(code).isEqualTo(ObfuscateCommandRunner.EXIT_FAILURE);
            assertThat(stderr()).contains("b.py: error: boom").contains("2 file(s) processed, 1 failed");
        }

        @Test
        void dry_run_needs_no_output_dir() {
            when(appService.obfuscateDirectory(eq(Path.of("src")), isNull(), any(), eq(true))).thenReturn(List.of());

            assertThat(run("--input-dir=src", "--dry-run")).isZero();
        }
    }

    @Test
    @DisplayName("--list-techniques prints one row per technique")
    void list_techniques() {
        when(appService.listTechniques()).thenReturn(List.of(
                new TechniqueDescriptor("string_encoding", 1, 4, 40, Set.of()),
                new TechniqueDescriptor("dead_code_insertion", 4, 4, 10, Set.of("string_encoding"))));

        assertThat(run("--list-techniques")).isZero();
        assertThat(stdout()).contains("TECHNIQUE").contains("string_encoding").contains("1-4")
                .contains("dead_code_insertion").contains("4-4");
    }
}
