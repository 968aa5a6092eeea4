package com.codeveil.domain.obfuscation.model;

/**
 * Value object for a classified, boundary-exact slice of source text.
 * Span sequences are never mutated; every pass builds a new list.
 *
 * @param kind       what the slice holds
 * @param start      start offset in the scanned source, -1 for synthesized text
 * @param end        end offset (exclusive) in the scanned source, -1 for synthesized text
 * @param text       the exact characters of this span
 * @param locked     true if no technique may alter these characters (protected span)
 * @param insertedBy technique that inserted this span as a free-standing block, or null
 */
public record Span(
        SpanKind kind,
        int start,
        int end,
        String text,
        boolean locked,
        String insertedBy
) {

    public static Span scanned(SpanKind kind, int start, int end, String text, boolean locked) {
        return new Span(kind, start, end, text, locked, null);
    }

    /**
     * Synthesized, rewritable code.
     */
    public static Span code(String text) {
        return new Span(SpanKind.CODE, -1, -1, text, false, null);
    }

    /**
     * Synthesized literal that later passes must leave alone (encoded payloads, helper arguments).
     */
    public static Span lockedLiteral(String text) {
        return new Span(SpanKind.STRING_LITERAL, -1, -1, text, true, null);
    }

    public Span insertedBy(String technique) {
        return new Span(kind, start, end, text, locked, technique);
    }

    public boolean isSynthetic() {
        return start < 0;
    }

    public int length() {
        return text.length();
    }
}
