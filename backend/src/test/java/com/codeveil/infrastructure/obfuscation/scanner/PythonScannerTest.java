package com.codeveil.infrastructure.obfuscation.scanner;

import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.SpanKind;
import com.codeveil.infrastructure.obfuscation.ObfuscationTestSupport;
import com.codeveil.infrastructure.obfuscation.ScanException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonScannerTest {

    private PythonScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new PythonScanner();
    }

    private List<Span> ofKind(List<Span> spans, SpanKind kind) {
        return spans.stream().filter(s -> s.kind() == kind).toList();
    }

    @Nested
    @DisplayName("Span boundaries")
    class BoundaryTests {
        @Test
        void simple_assignment_splits_code_and_literals() {
            List<Span> spans = scanner.scan("x = 'a' + \"b\"\n");

            assertThat(spans).extracting(Span::kind).containsExactly(
                    SpanKind.CODE, SpanKind.STRING_LITERAL, SpanKind.CODE, SpanKind.STRING_LITERAL, SpanKind.CODE);
            assertThat(spans).extracting(Span::text).containsExactly("x = ", "'a'", " + ", "\"b\"", "\n");
            assertThat(spans.get(1).start()).isEqualTo(4);
            assertThat(spans.get(1).end()).isEqualTo(7);
            assertThat(spans.get(1).locked()).isFalse();
        }

        @Test
        void concatenation_reproduces_the_input() {
            String source = ObfuscationTestSupport.sample("complex.py");
            assertThat(ObfuscationTestSupport.render(scanner.scan(source))).isEqualTo(source);
        }

        @Test
        void line_continuation_stays_in_code() {
            String source = "x = 1 + \\\n    2\n";
            List<Span> spans = scanner.scan(source);
            assertThat(ObfuscationTestSupport.render(spans)).isEqualTo(source);
            assertThat(ofKind(spans, SpanKind.NUMERIC_LITERAL)).extracting(Span::text).containsExactly("1", "2");
        }

        @Test
        void empty_source_has_no_spans() {
            assertThat(scanner.scan("")).isEmpty();
        }
    }

    @Nested
    @DisplayName("String literals")
    class StringTests {
        @Test
        void module_docstring_is_locked() {
            List<Span> spans = scanner.scan("\"\"\"Module doc.\"\"\"\nx = 1\n");
            assertThat(spans.get(0).kind()).isEqualTo(SpanKind.STRING_LITERAL);
            assertThat(spans.get(0).text()).isEqualTo("\"\"\"Module doc.\"\"\"");
            assertThat(spans.get(0).locked()).isTrue();
        }

        @Test
        void function_docstring_is_locked() {
            List<Span> spans = scanner.scan("def f():\n    \"\"\"doc\"\"\"\n    return 1\n");
            assertThat(ofKind(spans, SpanKind.STRING_LITERAL)).singleElement()
                    .satisfies(s -> assertThat(s.locked()).isTrue());
        }

        @Test
        void string_inside_brackets_on_its_own_line_is_not_locked() {
            List<Span> spans = scanner.scan("x = [\n    'a',\n]\n");
            assertThat(ofKind(spans, SpanKind.STRING_LITERAL)).singleElement()
                    .satisfies(s -> assertThat(s.locked()).isFalse());
        }

        @Test
        void prefixed_literals_keep_their_prefix() {
            List<Span> spans = scanner.scan("p = rb'\\d+' + Rb\"x\"\n");
            assertThat(ofKind(spans, SpanKind.STRING_LITERAL)).extracting(Span::text)
                    .containsExactly("rb'\\d+'", "Rb\"x\"");
        }

        @Test
        void hash_inside_string_is_not_a_comment() {
            List<Span> spans = scanner.scan("s = \"a#b\"\n");
            assertThat(ofKind(spans, SpanKind.COMMENT)).isEmpty();
        }

        @Test
        void escaped_quote_does_not_end_literal() {
            List<Span> spans = scanner.scan("s = 'it\\'s'\n");
            assertThat(ofKind(spans, SpanKind.STRING_LITERAL)).extracting(Span::text).containsExactly("'it\\'s'");
        }

        @Test
        void triple_quoted_literal_spans_lines() {
            List<Span> spans = scanner.scan("s = '''a\nb'''\n");
            assertThat(ofKind(spans, SpanKind.STRING_LITERAL)).extracting(Span::text).containsExactly("'''a\nb'''");
        }
    }

    @Nested
    @DisplayName("Interpolated literals")
    class InterpolatedTests {
        @Test
        void nested_fields_and_format_spec_are_one_locked_span() {
            String literal = "f\"{user['name']:>{width}} {{literal}}\"";
            List<Span> spans = scanner.scan("msg = " + literal + "\n");

            assertThat(ofKind(spans, SpanKind.INTERPOLATED_LITERAL)).singleElement().satisfies(s -> {
                assertThat(s.text()).isEqualTo(literal);
                assertThat(s.locked()).isTrue();
            });
            assertThat(ofKind(spans, SpanKind.STRING_LITERAL)).isEmpty();
        }

        @Test
        void template_prefix_is_interpolated() {
            List<Span> spans = scanner.scan("t = t\"{x}\"\n");
            assertThat(ofKind(spans, SpanKind.INTERPOLATED_LITERAL)).extracting(Span::text).containsExactly("t\"{x}\"");
        }

        @Test
        void same_quote_reused_inside_field() {
            String literal = "f\"{\", \".join(names)}\"";
            List<Span> spans = scanner.scan("s = " + literal + "\n");
            assertThat(ofKind(spans, SpanKind.INTERPOLATED_LITERAL)).extracting(Span::text).containsExactly(literal);
        }
    }

    @Nested
    @DisplayName("Comments and numbers")
    class CommentAndNumberTests {
        @Test
        void comment_is_unlocked_span() {
            List<Span> spans = scanner.scan("x = 1  # note\n");
            assertThat(ofKind(spans, SpanKind.COMMENT)).singleElement().satisfies(s -> {
                assertThat(s.text()).isEqualTo("# note");
                assertThat(s.locked()).isFalse();
            });
        }

        @Test
        void numeric_forms() {
            List<Span> spans = scanner.scan("y = 0x1F + 1_000 + 3.5e-2 + 2j + .5 + 0o17 + 0b1010\n");
            assertThat(ofKind(spans, SpanKind.NUMERIC_LITERAL)).extracting(Span::text)
                    .containsExactly("0x1F", "1_000", "3.5e-2", "2j", ".5", "0o17", "0b1010");
        }

        @Test
        void digits_inside_identifiers_are_not_numbers() {
            List<Span> spans = scanner.scan("x1 = var2\n");
            assertThat(ofKind(spans, SpanKind.NUMERIC_LITERAL)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Scan failures")
    class FailureTests {
        @Test
        void unterminated_string_reports_position() {
            assertThatThrownBy(() -> scanner.scan("x = 'abc\n"))
                    .isInstanceOf(ScanException.class)
                    .satisfies(e -> {
                        ScanException scan = (ScanException) e;
                        assertThat(scan.getLine()).isEqualTo(1);
                        assertThat(scan.getColumn()).isEqualTo(5);
                    });
        }

        @Test
        void unterminated_string_on_later_line() {
            assertThatThrownBy(() -> scanner.scan("a = 1\nb = \"oops\n"))
                    .isInstanceOf(ScanException.class)
                    .satisfies(e -> assertThat(((ScanException) e).getLine()).isEqualTo(2));
        }

        @Test
        void unterminated_triple_quote() {
            assertThatThrownBy(() -> scanner.scan("s = \"\"\"never closed\n"))
                    .isInstanceOf(ScanException.class);
        }

        @Test
        void unterminated_interpolated_literal() {
            assertThatThrownBy(() -> scanner.scan("s = f\"{x\n"))
                    .isInstanceOf(ScanException.class);
        }
    }
}
