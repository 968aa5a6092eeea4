package com.codeveil.infrastructure.obfuscation.technique;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonLiteralDecoderTest {

    private static String value(String literal) {
        int[] cps = PythonLiteralDecoder.decode(literal);
        return new String(cps, 0, cps.length);
    }

    @Test
    @DisplayName("Simple escapes")
    void simple_escapes() {
        assertThat(value("'a\\tb\\n'")).isEqualTo("a\tb\n");
        assertThat(value("\"q\\\"\\\\\"")).isEqualTo("q\"\\");
        assertThat(value("'\\a\\b\\f\\v\\r'")).isEqualTo("\u0007\b\f\u000b\r");
    }

    @Test
    @DisplayName("Numeric escapes")
    void numeric_escapes() {
        assertThat(value("'\\x41\\101\\u00e9'")).isEqualTo("AAé");
        assertThat(value("'\\U0001F600'")).isEqualTo("😀");
    }

    @Test
    @DisplayName("Named escape")
    void named_escape() {
        assertThat(value("'\\N{BULLET}'")).isEqualTo("\u2022");
    }

    @Test
    @DisplayName("Unknown escape keeps the backslash")
    void unknown_escape() {
        assertThat(value("'\\d'")).isEqualTo("\\d");
    }

    @Test
    @DisplayName("Raw literal keeps escapes verbatim")
    void raw_literal() {
        assertThat(value("r'\\n\\x41'")).isEqualTo("\\n\\x41");
    }

    @Test
    @DisplayName("Triple-quoted literal normalizes line breaks and honors line continuation")
    void triple_quoted() {
        assertThat(value("'''a\r\nb\\\nc'''")).isEqualTo("a\nbc");
    }

    @Test
    @DisplayName("Lone surrogate escapes survive")
    void lone_surrogate() {
        assertThat(PythonLiteralDecoder.decode("'\\ud800'")).containsExactly(0xD800);
    }

    @Test
    @DisplayName("Prefix inspection")
    void prefixes() {
        assertThat(PythonLiteralDecoder.prefixOf("Rb'x'")).isEqualTo("Rb");
        assertThat(PythonLiteralDecoder.isBytes("Rb'x'")).isTrue();
        assertThat(PythonLiteralDecoder.isRaw("Rb'x'")).isTrue();
        assertThat(PythonLiteralDecoder.isBytes("u'x'")).isFalse();
        assertThat(PythonLiteralDecoder.body("\"\"\"doc\"\"\"")).isEqualTo("doc");
        assertThat(PythonLiteralDecoder.body("''")).isEmpty();
    }

    @Test
    @DisplayName("Invalid escapes are rejected")
    void invalid_escapes() {
        assertThatThrownBy(() -> PythonLiteralDecoder.decode("'\\x4'"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PythonLiteralDecoder.decode("'\\N{NO SUCH CHARACTER NAME}'"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
