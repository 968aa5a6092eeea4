package com.codeveil.infrastructure.detection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @Test
    void extension_wins() {
        assertThat(detector.detect("tool.py", "const x = 1;")).contains("python");
        assertThat(detector.detect("app.JS", "def f():\n    pass\n")).contains("javascript");
    }

    @Test
    void content_when_extension_is_unknown() {
        assertThat(detector.detect("script", "#!/usr/bin/env python3\nprint(1)\n")).contains("python");
        assertThat(detector.detect(null, "def main():\n    return 0\n")).contains("python");
        assertThat(detector.detect("x.txt", "package com.example;\n")).contains("java");
    }

    @Test
    void nothing_recognisable() {
        assertThat(detector.detect(null, "hello there")).isEmpty();
        assertThat(detector.detect("notes.", null)).isEmpty();
    }

    @Test
    void only_python_is_supported() {
        assertThat(detector.isSupported("Python")).isTrue();
        assertThat(detector.isSupported("javascript")).isFalse();
        assertThat(detector.isSupported(null)).isFalse();
        assertThat(detector.hasSupportedExtension("pkg/mod.pyi")).isTrue();
        assertThat(detector.hasSupportedExtension("index.ts")).isFalse();
    }
}
