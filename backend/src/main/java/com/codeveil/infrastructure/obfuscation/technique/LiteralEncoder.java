package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.StringEncoding;
import com.codeveil.infrastructure.obfuscation.scanner.LogicalLine;
import com.codeveil.infrastructure.obfuscation.scanner.PythonToken;
import com.codeveil.infrastructure.obfuscation.scanner.SourceStructure;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Replaces literal values with expressions that evaluate to the same value at runtime.
 *
 * String payloads are emitted as locked literals so later passes leave them alone.
 * The decode helper used by the base-N strategy is defined once per run after the module prologue.
 */
@Component
public class LiteralEncoder {

    public static final String HELPER_OWNER = "string_encoding";

    /**
     * Whether the literal at {@code spanIndex} may be rewritten at all.
     */
    public boolean isRewritable(SourceStructure structure, int spanIndex) {
        Span span = structure.spans().get(spanIndex);
        if (span.locked()) {
            return false;
        }
        LogicalLine line = structure.lineOfSpan(spanIndex);
        if (line != null && line.startsWith("case") && line.isCompound()) {
            return false;
        }
        if (span.kind().isStringLike()) {
            int tokenIndex = structure.tokenIndexOfSpan(spanIndex);
            PythonToken previous = structure.previousSignificant(tokenIndex);
            PythonToken next = structure.nextSignificant(tokenIndex);
            boolean concatenated = previous != null && previous.isStringLike() || next != null && next.isStringLike();
            return !concatenated;
        }
        return true;
    }

    /**
     * Encode a string literal's source text. Empty if the literal is a bytes literal or holds an
     * escape that cannot be evaluated.
     */
    public Optional<List<Span>> encodeStringLiteral(String literal, TechniqueRun run) {
        if (PythonLiteralDecoder.isBytes(literal)) {
            return Optional.empty();
        }
        int[] codePoints;
        try {
            codePoints = PythonLiteralDecoder.decode(literal);
        } catch (IllegalArgumentException e) {
            run.warn(HELPER_OWNER, "Left literal unchanged: " + e.getMessage());
            return Optional.empty();
        }
        return Optional.of(encodeCodePoints(codePoints, run));
    }

    /**
     * Builtins the configured text strategy calls at runtime.
     */
    public Set<String> textBuiltins(TechniqueRun run) {
        if (run.getConfig().stringEncoding() == StringEncoding.CHARCODE) {
            return Set.of("map", "chr");
        }
        return run.getConfig().textBase() == 64 ? Set.of("__import__") : Set.of("bytes");
    }

    public List<Span> encodeText(String value, TechniqueRun run) {
        return encodeCodePoints(value.codePoints().toArray(), run);
    }

    public List<Span> encodeCodePoints(int[] codePoints, TechniqueRun run) {
        if (run.getConfig().stringEncoding() == StringEncoding.CHARCODE) {
            String codes = Arrays.stream(codePoints)
                    .mapToObj(Integer::toString)
                    .collect(Collectors.joining(", "));
            return List.of(Span.lockedLiteral("''"), Span.code(".join(map(chr, [" + codes + "]))"));
        }
        int base = run.getConfig().textBase();
        TechniqueRun.DecodeHelper helper = run.decodeHelper(base);
        byte[] bytes = utf8SurrogatePass(codePoints);
        String payload = base == 64
                ? Base64.getEncoder().encodeToString(bytes)
                : HexFormat.of().formatHex(bytes);
        return List.of(
                Span.code(helper.getName() + "("),
                Span.lockedLiteral("'" + payload + "'"),
                Span.code(")"));
    }

    public Optional<List<Span>> encodeNumericLiteral(String literal, TechniqueRun run) {
        return encodeNumericLiteral(literal, run, Set.of());
    }

    /**
     * Encode a numeric literal. Imaginary literals are never rewritten, and forms calling a builtin
     * named in {@code rebound} are not used.
     */
    public Optional<List<Span>> encodeNumericLiteral(String literal, TechniqueRun run, Set<String> rebound) {
        String lower = literal.toLowerCase(Locale.ROOT);
        if (lower.endsWith("j")) {
            return Optional.empty();
        }
        boolean radixPrefixed = lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b");
        if (!radixPrefixed && (lower.contains(".") || lower.contains("e"))) {
            if (rebound.contains("float")) {
                return Optional.empty();
            }
            return Optional.of(List.of(Span.code("float("), Span.lockedLiteral("'" + literal + "'"), Span.code(")")));
        }

        BigInteger value = parseInteger(lower.replace("_", ""));
        Random random = run.getRandom();
        return switch (random.nextInt(rebound.contains("int") ? 3 : 4)) {
            case 0 -> {
                BigInteger k = BigInteger.valueOf(1 + random.nextInt(999));
                yield Optional.of(List.of(Span.code("(" + value.add(k) + " - " + k + ")")));
            }
            case 1 -> {
                BigInteger k = BigInteger.valueOf(1 + random.nextInt(0xFFFF));
                yield Optional.of(List.of(Span.code("(" + value.xor(k) + " ^ " + k + ")")));
            }
            case 2 -> {
                BigInteger m = BigInteger.valueOf(2 + random.nextInt(8));
                BigInteger[] qr = value.divideAndRemainder(m);
                yield Optional.of(List.of(Span.code("(" + m + " * " + qr[0] + " + " + qr[1] + ")")));
            }
            default -> Optional.of(List.of(
                    Span.code("int("), Span.lockedLiteral("'" + value + "'"), Span.code(")")));
        };
    }

    /**
     * Insert definitions for helpers registered during this attempt but not yet placed in the sequence.
     */
    public List<Span> installHelpers(List<Span> spans, TechniqueRun run) {
        List<TechniqueRun.DecodeHelper> pending = run.getDecodeHelpers().values().stream()
                .filter(h -> !h.isInstalled())
                .toList();
        if (pending.isEmpty()) {
            return spans;
        }
        SourceStructure structure = SourceStructure.of(spans);
        SourceStructure.InsertionPoint point = structure.prologueInsertionPoint();
        String nl = structure.newlineStyle();

        List<Span> definitions = new ArrayList<>();
        if (point.needsLeadingNewline()) {
            definitions.add(Span.code(nl));
        }
        for (TechniqueRun.DecodeHelper helper : pending) {
            definitions.addAll(definition(helper, nl));
            helper.markInstalled();
        }
        run.declareInsertion(HELPER_OWNER);
        List<Span> owned = definitions.stream().map(s -> s.insertedBy(HELPER_OWNER)).toList();
        return new SpanRewriter(spans).insert(point.position(), owned).apply();
    }

    private static List<Span> definition(TechniqueRun.DecodeHelper helper, String nl) {
        String p = helper.getParameter();
        List<Span> spans = new ArrayList<>();
        spans.add(Span.code("def " + helper.getName() + "(" + p + "):" + nl + "    return "));
        if (helper.getBase() == 64) {
            spans.add(Span.code("__import__("));
            spans.add(Span.lockedLiteral("'base64'"));
            spans.add(Span.code(").b64decode(" + p + ").decode("));
        } else {
            spans.add(Span.code("bytes.fromhex(" + p + ").decode("));
        }
        spans.add(Span.lockedLiteral("'utf-8'"));
        spans.add(Span.code(", "));
        spans.add(Span.lockedLiteral("'surrogatepass'"));
        spans.add(Span.code(")" + nl));
        return spans;
    }

    private static BigInteger parseInteger(String digits) {
        if (digits.startsWith("0x")) {
            return new BigInteger(digits.substring(2), 16);
        }
        if (digits.startsWith("0o")) {
            return new BigInteger(digits.substring(2), 8);
        }
        if (digits.startsWith("0b")) {
            return new BigInteger(digits.substring(2), 2);
        }
        return new BigInteger(digits);
    }

    /**
     * UTF-8 that also encodes lone surrogates, matching Python's 'surrogatepass' error handler.
     */
    static byte[] utf8SurrogatePass(int[] codePoints) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int cp : codePoints) {
            if (cp < 0x80) {
                out.write(cp);
            } else if (cp < 0x800) {
                out.write(0xC0 | cp >> 6);
                out.write(0x80 | cp & 0x3F);
            } else if (cp < 0x10000) {
                out.write(0xE0 | cp >> 12);
                out.write(0x80 | cp >> 6 & 0x3F);
                out.write(0x80 | cp & 0x3F);
            } else {
                out.write(0xF0 | cp >> 18);
                out.write(0x80 | cp >> 12 & 0x3F);
                out.write(0x80 | cp >> 6 & 0x3F);
                out.write(0x80 | cp & 0x3F);
            }
        }
        return out.toByteArray();
    }
}
