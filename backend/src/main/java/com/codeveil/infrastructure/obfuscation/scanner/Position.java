package com.codeveil.infrastructure.obfuscation.scanner;

/**
 * A point inside a span sequence: the character at {@code offset} within span {@code spanIndex}.
 * A position with {@code spanIndex == spans.size()} marks the end of the sequence.
 */
public record Position(int spanIndex, int offset) implements Comparable<Position> {

    public static Position startOf(int spanIndex) {
        return new Position(spanIndex, 0);
    }

    @Override
    public int compareTo(Position other) {
        int bySpan = Integer.compare(spanIndex, other.spanIndex);
        return bySpan != 0 ? bySpan : Integer.compare(offset, other.offset);
    }
}
