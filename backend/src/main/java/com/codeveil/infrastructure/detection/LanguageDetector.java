package com.codeveil.infrastructure.detection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Guesses the language of a source file, first from its extension and then from its content.
 */
@Slf4j
@Component
public class LanguageDetector {

    public static final String PYTHON = "python";

    private static final Set<String> SUPPORTED = Set.of(PYTHON);

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("py", PYTHON),
            Map.entry("pyw", PYTHON),
            Map.entry("pyi", PYTHON),
            Map.entry("js", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("java", "java"),
            Map.entry("rb", "ruby"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("c", "c"),
            Map.entry("h", "c"),
            Map.entry("cpp", "cpp"),
            Map.entry("cs", "csharp"),
            Map.entry("php", "php"),
            Map.entry("sh", "shell")
    );

    // Checked in insertion order; the first language with a match wins.
    private static final Map<String, List<Pattern>> CONTENT_PATTERNS = new LinkedHashMap<>();

    static {
        CONTENT_PATTERNS.put(PYTHON, List.of(
                Pattern.compile("\\A#!.*\\bpython[0-9.]*\\b"),
                Pattern.compile("(?m)^\\s*def\\s+\\w+\\s*\\(.*\\)\\s*(->[^:]+)?:\\s*$"),
                Pattern.compile("(?m)^\\s*from\\s+[\\w.]+\\s+import\\s+"),
                Pattern.compile("(?m)^\\s*class\\s+\\w+(\\(.*\\))?\\s*:\\s*$"),
                Pattern.compile("(?m)^if\\s+__name__\\s*==\\s*['\"]__main__['\"]\\s*:")
        ));
        CONTENT_PATTERNS.put("javascript", List.of(
                Pattern.compile("(?m)^\\s*(const|let|var)\\s+\\w+\\s*=.*;\\s*$"),
                Pattern.compile("\\bfunction\\s*\\w*\\s*\\([^)]*\\)\\s*\\{"),
                Pattern.compile("\\brequire\\(['\"][^'\"]+['\"]\\)")
        ));
        CONTENT_PATTERNS.put("java", List.of(
                Pattern.compile("(?m)^\\s*package\\s+[\\w.]+;"),
                Pattern.compile("\\bpublic\\s+(final\\s+)?class\\s+\\w+")
        ));
        CONTENT_PATTERNS.put("shell", List.of(
                Pattern.compile("\\A#!.*\\b(ba|z)?sh\\b")
        ));
    }

    /**
     * @param fileName file name or path, may be null
     * @param content  source text, may be null
     * @return the detected language name, empty if neither hint matches
     */
    public Optional<String> detect(String fileName, String content) {
        Optional<String> byExtension = byExtension(fileName);
        if (byExtension.isPresent()) {
            return byExtension;
        }
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        for (Map.Entry<String, List<Pattern>> entry : CONTENT_PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(content).find()) {
                    log.debug("[LanguageDetector] Detected {} from content", entry.getKey());
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public boolean isSupported(String language) {
        return language != null && SUPPORTED.contains(language.toLowerCase(Locale.ROOT));
    }

    public boolean hasSupportedExtension(String fileName) {
        return byExtension(fileName).filter(this::isSupported).isPresent();
    }

    private static Optional<String> byExtension(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(EXTENSIONS.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT)));
    }
}
