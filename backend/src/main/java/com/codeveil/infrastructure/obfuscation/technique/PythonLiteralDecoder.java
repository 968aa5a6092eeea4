package com.codeveil.infrastructure.obfuscation.technique;

import java.util.Arrays;
import java.util.Locale;

/**
 * Evaluates a Python string literal's source text to the exact code point sequence it denotes.
 */
public final class PythonLiteralDecoder {

    private PythonLiteralDecoder() {
    }

    public static String prefixOf(String literal) {
        int i = 0;
        while (i < literal.length() && literal.charAt(i) != '\'' && literal.charAt(i) != '"') {
            i++;
        }
        return literal.substring(0, i);
    }

    public static boolean isBytes(String literal) {
        return prefixOf(literal).toLowerCase(Locale.ROOT).indexOf('b') >= 0;
    }

    public static boolean isRaw(String literal) {
        return prefixOf(literal).toLowerCase(Locale.ROOT).indexOf('r') >= 0;
    }

    /**
     * Literal contents without prefix and quotes, line breaks untranslated.
     */
    public static String body(String literal) {
        int quoteAt = prefixOf(literal).length();
        char quote = literal.charAt(quoteAt);
        boolean triple = literal.startsWith(String.valueOf(quote).repeat(3), quoteAt)
                && literal.length() - quoteAt >= 6;
        int width = triple ? 3 : 1;
        return literal.substring(quoteAt + width, literal.length() - width);
    }

    /**
     * @throws IllegalArgumentException for an escape Python rejects (bad \x, \N{unknown name})
     */
    public static int[] decode(String literal) {
        String body = normalizeLineBreaks(body(literal));
        if (isRaw(literal)) {
            return body.codePoints().toArray();
        }

        int[] out = new int[body.length()];
        int size = 0;
        int i = 0;
        int n = body.length();
        while (i < n) {
            int cp = body.codePointAt(i);
            if (cp != '\\' || i + 1 >= n) {
                out[size++] = cp;
                i += Character.charCount(cp);
                continue;
            }
            char e = body.charAt(i + 1);
            switch (e) {
                case '\n' -> i += 2;
                case '\\', '\'', '"' -> {
                    out[size++] = e;
                    i += 2;
                }
                case 'a' -> { out[size++] = 7; i += 2; }
                case 'b' -> { out[size++] = 8; i += 2; }
                case 'f' -> { out[size++] = 12; i += 2; }
                case 'n' -> { out[size++] = '\n'; i += 2; }
                case 'r' -> { out[size++] = '\r'; i += 2; }
                case 't' -> { out[size++] = '\t'; i += 2; }
                case 'v' -> { out[size++] = 11; i += 2; }
                case 'x' -> {
                    out[size++] = hex(body, i + 2, 2);
                    i += 4;
                }
                case 'u' -> {
                    out[size++] = hex(body, i + 2, 4);
                    i += 6;
                }
                case 'U' -> {
                    int value = hex(body, i + 2, 8);
                    if (value > Character.MAX_CODE_POINT) {
                        throw new IllegalArgumentException("Escape out of range: \\U" + body.substring(i + 2, i + 10));
                    }
                    out[size++] = value;
                    i += 10;
                }
                case 'N' -> {
                    int close = body.indexOf('}', i);
                    if (i + 2 >= n || body.charAt(i + 2) != '{' || close < 0) {
                        throw new IllegalArgumentException("Malformed \\N escape");
                    }
                    out[size++] = Character.codePointOf(body.substring(i + 3, close));
                    i = close + 1;
                }
                default -> {
                    if (e >= '0' && e <= '7') {
                        int j = i + 1;
                        int value = 0;
                        while (j < n && j < i + 4 && body.charAt(j) >= '0' && body.charAt(j) <= '7') {
                            value = value * 8 + (body.charAt(j) - '0');
                            j++;
                        }
                        out[size++] = value;
                        i = j;
                    } else {
                        out[size++] = '\\';
                        i++;
                    }
                }
            }
        }
        return Arrays.copyOf(out, size);
    }

    private static int hex(String body, int from, int digits) {
        if (from + digits > body.length()) {
            throw new IllegalArgumentException("Truncated escape at offset " + from);
        }
        String text = body.substring(from, from + digits);
        for (int k = 0; k < text.length(); k++) {
            if (Character.digit(text.charAt(k), 16) < 0) {
                throw new IllegalArgumentException("Invalid hex escape: " + text);
            }
        }
        return Integer.parseInt(text, 16);
    }

    private static String normalizeLineBreaks(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
