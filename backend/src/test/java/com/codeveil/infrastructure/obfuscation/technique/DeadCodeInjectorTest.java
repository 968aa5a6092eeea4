package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.StringEncoding;
import com.codeveil.infrastructure.obfuscation.ObfuscationTestSupport;
import com.codeveil.infrastructure.obfuscation.validation.PythonSyntaxChecker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static com.codeveil.infrastructure.obfuscation.ObfuscationTestSupport.render;
import static org.assertj.core.api.Assertions.assertThat;

class DeadCodeInjectorTest {

    private static final Pattern DEAD_STATEMENT = Pattern.compile(
            "\\s*([A-Za-z]\\w* = \\d+ \\* \\d+ - \\d+|[A-Za-z]\\w* = None|if \\(.*\\): pass|pass)");

    private final DeadCodeInjector injector = new DeadCodeInjector();

    private String inject(String source, double density) {
        ObfuscationConfig config = ObfuscationTestSupport.config().deadCodeDensity(density).build();
        return render(injector.apply(ObfuscationTestSupport.scan(source), ObfuscationTestSupport.run(config, source)));
    }

    @Test
    @DisplayName("Full density inserts after every simple statement")
    void full_density() {
        String out = inject("x = 1\ny = 2\n", 1.0);
        String[] lines = out.split("\n");

        assertThat(lines).hasSize(4);
        assertThat(lines[0]).isEqualTo("x = 1");
        assertThat(lines[1]).matches(DEAD_STATEMENT);
        assertThat(lines[2]).isEqualTo("y = 2");
        assertThat(lines[3]).matches(DEAD_STATEMENT);
        assertThat(new PythonSyntaxChecker().check(ObfuscationTestSupport.scan(out))).isEmpty();
    }

    @Test
    @DisplayName("Zero density leaves the source unchanged")
    void zero_density() {
        assertThat(inject("x = 1\ny = 2\n", 0.0)).isEqualTo("x = 1\ny = 2\n");
    }

    @Test
    @DisplayName("Class bodies only receive pass")
    void class_body() {
        assertThat(inject("class A:\n    x = 1\n", 1.0)).isEqualTo("class A:\n    x = 1\n    pass\n");
    }

    @Test
    @DisplayName("Inserted statements keep the indentation of their block")
    void nested_blocks_stay_valid() {
        String source = "def f(a):\n    if a:\n        b = 1\n    else:\n        b = 2\n    return b\n";
        String out = inject(source, 1.0);

        assertThat(out.split("\n")).hasSize(9);
        assertThat(new PythonSyntaxChecker().check(ObfuscationTestSupport.scan(out))).isEmpty();
    }

    @Test
    @DisplayName("No insertion after headers, decorators, one-line compounds or an unterminated last line")
    void ineligible_boundaries() {
        String source = "@decorator\ndef f():\n    if x: pass\n    return 1";
        assertThat(inject(source, 1.0)).isEqualTo(source);
    }

    @Test
    @DisplayName("Decode helper block is never split")
    void helper_block_is_reserved() {
        ObfuscationConfig config = ObfuscationTestSupport.config()
                .stringEncoding(StringEncoding.BASE_N_TEXT).textBase(64).deadCodeDensity(1.0).build();
        String source = "x = 'hi'\n";
        TechniqueRun run = ObfuscationTestSupport.run(config, source);

        List<Span> encoded = new StringEncodingTechnique(new LiteralEncoder()).apply(ObfuscationTestSupport.scan(source), run);
        String out = render(injector.apply(encoded, run));
        TechniqueRun.DecodeHelper helper = run.getDecodeHelpers().get(64);

        assertThat(out).startsWith("def " + helper.getName() + "(" + helper.getParameter() + "):\n"
                + "    return __import__('base64').b64decode(" + helper.getParameter()
                + ").decode('utf-8', 'surrogatepass')\n"
                + "x = " + helper.getName() + "('aGk=')\n");
    }
}
