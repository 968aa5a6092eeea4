package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.Diagnostic;
import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.StringEncoding;
import com.codeveil.infrastructure.obfuscation.ObfuscationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.codeveil.infrastructure.obfuscation.ObfuscationTestSupport.render;
import static org.assertj.core.api.Assertions.assertThat;

class LiteralEncoderTest {

    private final LiteralEncoder encoder = new LiteralEncoder();

    private static final Pattern SUBTRACT = Pattern.compile("\\((\\d+) - (\\d+)\\)");
    private static final Pattern XOR = Pattern.compile("\\((\\d+) \\^ (\\d+)\\)");
    private static final Pattern MULTIPLY_ADD = Pattern.compile("\\((\\d+) \\* (\\d+) \\+ (\\d+)\\)");
    private static final Pattern INT_CALL = Pattern.compile("int\\('(\\d+)'\\)");

    /**
     * Evaluates the integer forms the encoder emits.
     */
    static BigInteger evaluate(String expression) {
        Matcher m = SUBTRACT.matcher(expression);
        if (m.matches()) {
            return new BigInteger(m.group(1)).subtract(new BigInteger(m.group(2)));
        }
        m = XOR.matcher(expression);
        if (m.matches()) {
            return new BigInteger(m.group(1)).xor(new BigInteger(m.group(2)));
        }
        m = MULTIPLY_ADD.matcher(expression);
        if (m.matches()) {
            return new BigInteger(m.group(1)).multiply(new BigInteger(m.group(2))).add(new BigInteger(m.group(3)));
        }
        m = INT_CALL.matcher(expression);
        if (m.matches()) {
            return new BigInteger(m.group(1));
        }
        throw new AssertionError("Unexpected numeric form: " + expression);
    }

    private static ObfuscationConfig baseN(int base) {
        return ObfuscationTestSupport.config().stringEncoding(StringEncoding.BASE_N_TEXT).textBase(base).build();
    }

    @Nested
    @DisplayName("Charcode strategy")
    class CharcodeTests {
        @Test
        void text_becomes_join_over_code_points() {
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), "");
            List<Span> spans = encoder.encodeText("hi", run);

            assertThat(render(spans)).isEqualTo("''.join(map(chr, [104, 105]))");
            assertThat(spans.get(0).locked()).isTrue();
        }

        @Test
        void escapes_are_evaluated_before_encoding() {
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), "");
            Optional<List<Span>> spans = encoder.encodeStringLiteral("'a\\n'", run);

            assertThat(spans).isPresent();
            assertThat(render(spans.get())).isEqualTo("''.join(map(chr, [97, 10]))");
        }

        @Test
        void empty_literal() {
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), "");
            assertThat(render(encoder.encodeStringLiteral("''", run).orElseThrow()))
                    .isEqualTo("''.join(map(chr, []))");
        }
    }

    @Nested
    @DisplayName("Base-N strategy")
    class BaseNTests {
        @Test
        void base64_payload_is_locked_helper_argument() {
            TechniqueRun run = ObfuscationTestSupport.run(baseN(64), "");
            List<Span> spans = encoder.encodeText("hi", run);
            String helper = run.getDecodeHelpers().get(64).getName();

            assertThat(render(spans)).isEqualTo(helper + "('aGk=')");
            assertThat(spans.get(1).locked()).isTrue();
        }

        @Test
        void base16_encodes_utf8_bytes() {
            TechniqueRun run = ObfuscationTestSupport.run(baseN(16), "");
            String helper = run.decodeHelper(16).getName();
            assertThat(render(encoder.encodeText("é😀", run))).isEqualTo(helper + "('c3a9f09f9880')");
        }

        @Test
        void lone_surrogate_uses_surrogatepass_bytes() {
            assertThat(LiteralEncoder.utf8SurrogatePass(new int[]{0xD800})).containsExactly(0xED, 0xA0, 0x80);
        }

        @Test
        void helper_is_installed_after_docstring_once() {
            ObfuscationConfig config = baseN(64);
            String source = "\"\"\"doc\"\"\"\nx = 'hi'\ny = 'hi'\n";
            TechniqueRun run = ObfuscationTestSupport.run(config, source);

            List<Span> result = new StringEncodingTechnique(encoder).apply(ObfuscationTestSupport.scan(source), run);
            TechniqueRun.DecodeHelper helper = run.getDecodeHelpers().get(64);
            String h = helper.getName();
            String p = helper.getParameter();

            assertThat(render(result)).isEqualTo("\"\"\"doc\"\"\"\n"
                    + "def " + h + "(" + p + "):\n"
                    + "    return __import__('base64').b64decode(" + p + ").decode('utf-8', 'surrogatepass')\n"
                    + "x = " + h + "('aGk=')\n"
                    + "y = " + h + "('aGk=')\n");
            assertThat(helper.isInstalled()).isTrue();
            assertThat(run.getDeclaredInsertions()).contains(LiteralEncoder.HELPER_OWNER);
        }

        @Test
        void hex_helper_uses_bytes_fromhex() {
            ObfuscationConfig config = baseN(16);
            String source = "x = 'a'\n";
            TechniqueRun run = ObfuscationTestSupport.run(config, source);

            String out = render(new StringEncodingTechnique(encoder).apply(ObfuscationTestSupport.scan(source), run));
            assertThat(out).contains("bytes.fromhex(").endsWith("('61')\n");
        }
    }

    @Nested
    @DisplayName("Literals left alone")
    class UntouchedTests {
        @Test
        void bytes_literal() {
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), "");
            assertThat(encoder.encodeStringLiteral("b'x'", run)).isEmpty();
        }

        @Test
        void bad_escape_reports_warning() {
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), "");
            assertThat(encoder.encodeStringLiteral("'\\N{NO SUCH CHARACTER NAME}'", run)).isEmpty();
            assertThat(run.getDiagnostics()).extracting(Diagnostic::severity).contains(Diagnostic.Severity.WARNING);
        }

        @Test
        void implicit_concatenation_and_case_patterns() {
            String source = "x = 'a' 'b'\nmatch x:\n    case 'ab':\n        pass\ny = 'c'\n";
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), source);

            String out = render(new StringEncodingTechnique(encoder).apply(ObfuscationTestSupport.scan(source), run));
            assertThat(out).isEqualTo("x = 'a' 'b'\nmatch x:\n    case 'ab':\n        pass\n"
                    + "y = ''.join(map(chr, [99]))\n");
        }

        @Test
        void rebound_map_blocks_charcode_only() {
            String source = "def map(f, xs):\n    return []\nprint('hi')\n";
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), source);

            String out = render(new StringEncodingTechnique(encoder).apply(ObfuscationTestSupport.scan(source), run));
            assertThat(out).isEqualTo(source);
            assertThat(run.getDiagnostics()).anyMatch(d -> d.severity() == Diagnostic.Severity.WARNING
                    && d.message().contains("map"));

            TechniqueRun base64 = ObfuscationTestSupport.run(baseN(64), source);
            String encoded = render(new StringEncodingTechnique(encoder).apply(ObfuscationTestSupport.scan(source), base64));
            assertThat(encoded).contains("__import__('base64')").doesNotContain("'hi'");
        }

        @Test
        void docstring_and_fstring() {
            String source = "\"\"\"doc\"\"\"\nname = 1\nprint(f'{name}')\n";
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), source);
            String out = render(new StringEncodingTechnique(encoder).apply(ObfuscationTestSupport.scan(source), run));
            assertThat(out).isEqualTo(source);
        }
    }

    @Nested
    @DisplayName("Numeric literals")
    class NumericTests {
        @Test
        void integers_evaluate_to_the_original_value() {
            for (long seed = 0; seed < 40; seed++) {
                TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().seed(seed).build(), "");
                for (String literal : List.of("0", "5", "1_000", "0x1F", "0o17", "0b1010", "123456789012345678901234567890")) {
                    String expression = render(encoder.encodeNumericLiteral(literal, run).orElseThrow());
                    BigInteger expected = switch (literal) {
                        case "0x1F" -> BigInteger.valueOf(31);
                        case "0o17" -> BigInteger.valueOf(15);
                        case "0b1010" -> BigInteger.TEN;
                        default -> new BigInteger(literal.replace("_", ""));
                    };
                    assertThat(evaluate(expression)).as(literal + " -> " + expression).isEqualTo(expected);
                }
            }
        }

        @Test
        void floats_become_float_calls() {
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), "");
            assertThat(render(encoder.encodeNumericLiteral("3.5e-2", run).orElseThrow())).isEqualTo("float('3.5e-2')");
        }

        @Test
        void imaginary_literals_are_kept() {
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), "");
            assertThat(encoder.encodeNumericLiteral("2j", run)).isEmpty();
            assertThat(encoder.encodeNumericLiteral("1.5J", run)).isEmpty();
        }

        @Test
        void rebound_int_and_float_are_never_called() {
            String source = "def int(x):\n    return 0\nfloat = str\ny = 5\nz = 1.5\n";
            for (long seed = 0; seed < 20; seed++) {
                TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().seed(seed).build(), source);
                String out = render(new NumericSubstitutionTechnique(encoder).apply(ObfuscationTestSupport.scan(source), run));

                String[] lines = out.split("\n");
                assertThat(evaluate(lines[3].substring("y = ".length()))).isEqualTo(BigInteger.valueOf(5));
                assertThat(lines[4]).isEqualTo("z = 1.5");
            }
        }

        @Test
        void technique_rewrites_code_numbers_only() {
            String source = "x = 5\ns = '5'\nz = 1j\n";
            TechniqueRun run = ObfuscationTestSupport.run(ObfuscationTestSupport.config().build(), source);
            String out = render(new NumericSubstitutionTechnique(encoder).apply(ObfuscationTestSupport.scan(source), run));

            String[] lines = out.split("\n");
            assertThat(evaluate(lines[0].substring("x = ".length()))).isEqualTo(BigInteger.valueOf(5));
            assertThat(lines[1]).isEqualTo("s = '5'");
            assertThat(lines[2]).isEqualTo("z = 1j");
        }
    }
}
