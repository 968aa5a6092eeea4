package com.codeveil.infrastructure.obfuscation.config;

import com.codeveil.domain.obfuscation.model.NamePattern;
import com.codeveil.domain.obfuscation.model.ObfuscationConfig;
import com.codeveil.domain.obfuscation.model.StringEncoding;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the configuration of a run: application defaults, then an optional JSON file,
 * then per-invocation overrides.
 *
 * JSON keys are accepted in camelCase and snake_case; the legacy {@code custom_encodings}
 * block is read for the name pattern and string encoding.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ObfuscationConfigLoader {

    private final ObjectMapper objectMapper;

    @Value("${obfuscator.default-level:2}")
    private int defaultLevel = 2;

    @Value("${obfuscator.name-pattern:random}")
    private String namePattern = "random";

    @Value("${obfuscator.string-encoding:charcode}")
    private String stringEncoding = "charcode";

    @Value("${obfuscator.text-base:64}")
    private int textBase = 64;

    @Value("${obfuscator.randomize-seed:true}")
    private boolean randomizeSeed = true;

    @Value("${obfuscator.seed:0}")
    private long seed;

    @Value("${obfuscator.dead-code-density:0.15}")
    private double deadCodeDensity = 0.15;

    @Value("${obfuscator.max-attempts:6}")
    private int maxAttempts = 6;

    @Value("${obfuscator.excluded-patterns:__main__,__init__}")
    private List<String> excludedPatterns = List.of("__main__", "__init__");

    public ObfuscationConfig defaults() {
        return ObfuscationConfig.builder()
                .level(defaultLevel)
                .techniques(List.of())
                .namePattern(NamePattern.fromValue(namePattern))
                .stringEncoding(StringEncoding.fromValue(stringEncoding))
                .textBase(textBase)
                .randomizeSeed(randomizeSeed)
                .seed(seed)
                .excludedPatterns(excludedPatterns)
                .deadCodeDensity(deadCodeDensity)
                .maxAttempts(maxAttempts)
                .build();
    }

    /**
     * Defaults merged with a JSON file. A missing or unreadable file leaves the defaults in place.
     *
     * @throws IllegalArgumentException if the file holds an invalid value
     */
    public ObfuscationConfig load(Path configFile) {
        ObfuscationConfig base = defaults();
        if (configFile == null) {
            return base;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(configFile));
        } catch (IOException e) {
            log.warn("[Config] Could not read {}: {}; using defaults", configFile, e.getMessage());
            return base;
        }
        if (root == null || !root.isObject()) {
            log.warn("[Config] {} is not a JSON object; using defaults", configFile);
            return base;
        }
        log.info("[Config] Loaded configuration from {}", configFile);
        return merge(base, root);
    }

    public ObfuscationConfig applyOverrides(ObfuscationConfig base, ConfigOverrides overrides) {
        ObfuscationConfig.ObfuscationConfigBuilder builder = base.toBuilder();
        if (overrides.level() != null) {
            builder.level(overrides.level());
        }
        if (overrides.techniques() != null) {
            builder.techniques(overrides.techniques());
        }
        if (overrides.namePattern() != null) {
            builder.namePattern(NamePattern.fromValue(overrides.namePattern()));
        }
        if (overrides.stringEncoding() != null) {
            builder.stringEncoding(StringEncoding.fromValue(overrides.stringEncoding()));
            int implied = StringEncoding.impliedTextBase(overrides.stringEncoding());
            if (implied != 0) {
                builder.textBase(implied);
            }
        }
        if (overrides.textBase() != null) {
            builder.textBase(overrides.textBase());
        }
        if (overrides.randomizeSeed() != null) {
            builder.randomizeSeed(overrides.randomizeSeed());
        }
        if (overrides.seed() != null) {
            builder.seed(overrides.seed());
            if (overrides.randomizeSeed() == null) {
                builder.randomizeSeed(false);
            }
        }
        if (overrides.excludedPatterns() != null) {
            builder.excludedPatterns(overrides.excludedPatterns());
        }
        if (overrides.deadCodeDensity() != null) {
            builder.deadCodeDensity(overrides.deadCodeDensity());
        }
        if (overrides.maxAttempts() != null) {
            builder.maxAttempts(overrides.maxAttempts());
        }
        return builder.build();
    }

    private ObfuscationConfig merge(ObfuscationConfig base, JsonNode root) {
        JsonNode encodings = root.path("custom_encodings");
        return applyOverrides(base, new ConfigOverrides(
                integer(root, "level", "default_level"),
                strings(root, "techniques"),
                text(root, "namePattern", "name_pattern") != null
                        ? text(root, "namePattern", "name_pattern")
                        : text(encodings, "name_pattern"),
                text(root, "stringEncoding", "string_encoding") != null
                        ? text(root, "stringEncoding", "string_encoding")
                        : text(encodings, "string_encoding"),
                integer(root, "textBase", "text_base"),
                bool(root, "randomizeSeed", "randomize_seed", "randomize_seeds"),
                root.hasNonNull("seed") ? root.get("seed").asLong() : null,
                strings(root, "excludedPatterns", "excluded_patterns"),
                root.hasNonNull("deadCodeDensity") ? Double.valueOf(root.get("deadCodeDensity").asDouble())
                        : root.hasNonNull("dead_code_density") ? Double.valueOf(root.get("dead_code_density").asDouble()) : null,
                integer(root, "maxAttempts", "max_attempts")
        ));
    }

    private static JsonNode first(JsonNode node, String... keys) {
        for (String key : keys) {
            if (node.hasNonNull(key)) {
                return node.get(key);
            }
        }
        return null;
    }

    private static Integer integer(JsonNode node, String... keys) {
        JsonNode value = first(node, keys);
        return value != null ? value.asInt() : null;
    }

    private static Boolean bool(JsonNode node, String... keys) {
        JsonNode value = first(node, keys);
        return value != null ? value.asBoolean() : null;
    }

    private static String text(JsonNode node, String... keys) {
        JsonNode value = first(node, keys);
        return value != null ? value.asText() : null;
    }

    private static List<String> strings(JsonNode node, String... keys) {
        JsonNode value = first(node, keys);
        if (value == null || !value.isArray()) {
            return null;
        }
        List<String> result = new ArrayList<>();
        value.forEach(v -> result.add(v.asText()));
        return result;
    }
}
