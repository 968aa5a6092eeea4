package com.codeveil.infrastructure.obfuscation.scanner;

import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.SpanKind;
import com.codeveil.infrastructure.obfuscation.ScanException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Python 3 source into an ordered, gap-free sequence of spans.
 *
 * Literal boundaries are exact: concatenating the span texts reproduces the input.
 * Interpolated literals (f/t prefixes) are one locked span each, including nested
 * replacement fields. A plain string that starts a logical line outside brackets
 * (docstring or bare string statement) is also locked.
 */
@Component
public class PythonScanner {

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "t",
            "br", "rb", "fr", "rf", "tr", "rt"
    );

    private static final Pattern NUMBER = Pattern.compile(
            "0[xX](?:_?[0-9a-fA-F])+"
                    + "|0[oO](?:_?[0-7])+"
                    + "|0[bB](?:_?[01])+"
                    + "|(?:[0-9](?:_?[0-9])*(?:\\.(?:[0-9](?:_?[0-9])*)?)?|\\.[0-9](?:_?[0-9])*)"
                    + "(?:[eE][+-]?[0-9](?:_?[0-9])*)?[jJ]?"
    );

    /**
     * Scan the complete source text.
     *
     * @throws ScanException on an unterminated string or interpolated literal
     */
    public List<Span> scan(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        return new Cursor(source).run();
    }

    public static boolean isStringPrefix(String word) {
        return STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT));
    }

    static boolean isIdentifierStart(int cp) {
        return cp == '_' || Character.isUnicodeIdentifierStart(cp);
    }

    static boolean isIdentifierPart(int cp) {
        return cp == '_' || Character.isUnicodeIdentifierPart(cp) && !Character.isIdentifierIgnorable(cp);
    }

    static int identifierEnd(String text, int pos) {
        int i = pos;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (i == pos ? !isIdentifierStart(cp) : !isIdentifierPart(cp)) {
                break;
            }
            i += Character.charCount(cp);
        }
        return i;
    }

    /**
     * Single-use scanning state over one source text.
     */
    private static final class Cursor {

        private final String src;
        private final int n;
        private final List<Span> spans = new ArrayList<>();
        private int codeStart;
        private int depth;
        private boolean lineStart = true;

        Cursor(String src) {
            this.src = src;
            this.n = src.length();
        }

        List<Span> run() {
            int pos = 0;
            while (pos < n) {
                char c = src.charAt(pos);

                if (c == '#') {
                    flushCode(pos);
                    int end = pos;
                    while (end < n && src.charAt(end) != '\n' && src.charAt(end) != '\r') {
                        end++;
                    }
                    spans.add(Span.scanned(SpanKind.COMMENT, pos, end, src.substring(pos, end), false));
                    codeStart = end;
                    pos = end;
                    continue;
                }

                if (c == '\'' || c == '"') {
                    pos = literal(pos, pos, "");
                    continue;
                }

                int cp = src.codePointAt(pos);
                if (isIdentifierStart(cp)) {
                    int wordEnd = identifierEnd(src, pos);
                    String word = src.substring(pos, wordEnd);
                    if (wordEnd < n && isQuote(src.charAt(wordEnd)) && isStringPrefix(word)) {
                        pos = literal(pos, wordEnd, word);
                        continue;
                    }
                    lineStart = false;
                    pos = wordEnd;
                    continue;
                }

                if (isDigit(c) || c == '.' && pos + 1 < n && isDigit(src.charAt(pos + 1))) {
                    Matcher m = NUMBER.matcher(src).region(pos, n);
                    if (m.lookingAt()) {
                        flushCode(pos);
                        spans.add(Span.scanned(SpanKind.NUMERIC_LITERAL, pos, m.end(), m.group(), false));
                        codeStart = m.end();
                        lineStart = false;
                        pos = m.end();
                        continue;
                    }
                }

                if (c == '\\' && pos + 1 < n && isNewline(src.charAt(pos + 1))) {
                    pos = skipNewline(pos + 1);
                    continue;
                }

                if (c == '\n' || c == '\r') {
                    if (depth == 0) {
                        lineStart = true;
                    }
                    pos++;
                    continue;
                }

                switch (c) {
                    case '(', '[', '{' -> depth++;
                    case ')', ']', '}' -> depth = Math.max(0, depth - 1);
                    default -> { }
                }
                if (c != ' ' && c != '\t' && c != '\f') {
                    lineStart = false;
                }
                pos++;
            }
            flushCode(n);
            return spans;
        }

        private int literal(int start, int quotePos, String prefix) {
            flushCode(start);
            String lower = prefix.toLowerCase(Locale.ROOT);
            boolean interpolated = lower.indexOf('f') >= 0 || lower.indexOf('t') >= 0;
            int end = interpolated
                    ? scanInterpolated(start, quotePos)
                    : scanPlain(start, quotePos);
            String text = src.substring(start, end);
            if (interpolated) {
                spans.add(Span.scanned(SpanKind.INTERPOLATED_LITERAL, start, end, text, true));
            } else {
                boolean statementStart = lineStart && depth == 0;
                spans.add(Span.scanned(SpanKind.STRING_LITERAL, start, end, text, statementStart));
            }
            codeStart = end;
            lineStart = false;
            return end;
        }

        private int scanPlain(int start, int quotePos) {
            char quote = src.charAt(quotePos);
            boolean triple = isTriple(quotePos, quote);
            int pos = quotePos + (triple ? 3 : 1);
            while (pos < n) {
                char c = src.charAt(pos);
                if (c == '\\') {
                    pos = skipEscape(start, pos);
                    continue;
                }
                if (closes(pos, quote, triple)) {
                    return pos + (triple ? 3 : 1);
                }
                if (!triple && isNewline(c)) {
                    throw unterminated(start);
                }
                pos++;
            }
            throw unterminated(start);
        }

        private int scanInterpolated(int start, int quotePos) {
            char quote = src.charAt(quotePos);
            boolean triple = isTriple(quotePos, quote);
            int pos = quotePos + (triple ? 3 : 1);
            while (pos < n) {
                char c = src.charAt(pos);
                if (c == '\\') {
                    pos = skipEscape(start, pos);
                    continue;
                }
                if (closes(pos, quote, triple)) {
                    return pos + (triple ? 3 : 1);
                }
                if (!triple && isNewline(c)) {
                    throw unterminated(start);
                }
                if (c == '{') {
                    if (pos + 1 < n && src.charAt(pos + 1) == '{') {
                        pos += 2;
                        continue;
                    }
                    pos = replacementField(start, pos + 1, quote, triple);
                    continue;
                }
                pos++;
            }
            throw unterminated(start);
        }

        /**
         * Scan an expression slot up to and including its closing brace.
         */
        private int replacementField(int start, int pos, char quote, boolean triple) {
            int nested = 0;
            while (pos < n) {
                char c = src.charAt(pos);
                if (c == '\'' || c == '"') {
                    pos = nestedLiteral(start, pos, pos, "");
                    continue;
                }
                int cp = src.codePointAt(pos);
                if (isIdentifierStart(cp)) {
                    int wordEnd = identifierEnd(src, pos);
                    String word = src.substring(pos, wordEnd);
                    if (wordEnd < n && isQuote(src.charAt(wordEnd)) && isStringPrefix(word)) {
                        pos = nestedLiteral(start, pos, wordEnd, word);
                    } else {
                        pos = wordEnd;
                    }
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') {
                    nested++;
                } else if ((c == ')' || c == ']' || c == '}') && nested > 0) {
                    nested--;
                } else if (c == '}') {
                    return pos + 1;
                } else if (c == ':' && nested == 0) {
                    return formatSpec(start, pos + 1, quote, triple);
                }
                pos++;
            }
            throw unterminated(start);
        }

        private int formatSpec(int start, int pos, char quote, boolean triple) {
            while (pos < n) {
                char c = src.charAt(pos);
                if (c == '{') {
                    pos = replacementField(start, pos + 1, quote, triple);
                    continue;
                }
                if (c == '}') {
                    return pos + 1;
                }
                if (c == '\\') {
                    pos = skipEscape(start, pos);
                    continue;
                }
                if (closes(pos, quote, triple) || !triple && isNewline(c)) {
                    throw unterminated(start);
                }
                pos++;
            }
            throw unterminated(start);
        }

        private int nestedLiteral(int outerStart, int start, int quotePos, String prefix) {
            String lower = prefix.toLowerCase(Locale.ROOT);
            try {
                return lower.indexOf('f') >= 0 || lower.indexOf('t') >= 0
                        ? scanInterpolated(start, quotePos)
                        : scanPlain(start, quotePos);
            } catch (ScanException e) {
                throw unterminated(outerStart);
            }
        }

        private int skipEscape(int start, int pos) {
            if (pos + 1 >= n) {
                throw unterminated(start);
            }
            char next = src.charAt(pos + 1);
            if (isNewline(next)) {
                return skipNewline(pos + 1);
            }
            return pos + 2;
        }

        private int skipNewline(int pos) {
            if (src.charAt(pos) == '\r' && pos + 1 < n && src.charAt(pos + 1) == '\n') {
                return pos + 2;
            }
            return pos + 1;
        }

        private boolean isTriple(int quotePos, char quote) {
            return quotePos + 2 < n && src.charAt(quotePos + 1) == quote && src.charAt(quotePos + 2) == quote;
        }

        private boolean closes(int pos, char quote, boolean triple) {
            if (src.charAt(pos) != quote) {
                return false;
            }
            return !triple || pos + 2 < n && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote;
        }

        private void flushCode(int end) {
            if (end > codeStart) {
                spans.add(Span.scanned(SpanKind.CODE, codeStart, end, src.substring(codeStart, end), false));
            }
            codeStart = end;
        }

        private ScanException unterminated(int start) {
            int line = 1;
            int lineBegin = 0;
            for (int i = 0; i < start; i++) {
                char c = src.charAt(i);
                if (c == '\n' || c == '\r' && (i + 1 >= n || src.charAt(i + 1) != '\n')) {
                    line++;
                    lineBegin = i + 1;
                }
            }
            return new ScanException("Unterminated string literal", line, start - lineBegin + 1);
        }

        private static boolean isQuote(char c) {
            return c == '\'' || c == '"';
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static boolean isNewline(char c) {
            return c == '\n' || c == '\r';
        }
    }
}
