package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.SpanKind;
import com.codeveil.infrastructure.obfuscation.scanner.Position;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Collects edits against a span sequence and applies them in one pass, producing a new sequence.
 *
 * Locked spans are only ever kept whole or replaced whole. Adjacent unlocked code spans that
 * share an inserter are merged afterwards.
 */
public class SpanRewriter {

    private record Edit(Position from, Position to, List<Span> replacement, int order) {}

    private final List<Span> spans;
    private final List<Edit> edits = new ArrayList<>();

    public SpanRewriter(List<Span> spans) {
        this.spans = spans;
    }

    public SpanRewriter replace(Position from, Position to, List<Span> replacement) {
        if (from.compareTo(to) > 0) {
            throw new IllegalArgumentException("Edit range is reversed: " + from + " > " + to);
        }
        edits.add(new Edit(from, to, List.copyOf(replacement), edits.size()));
        return this;
    }

    public SpanRewriter replaceSpan(int spanIndex, List<Span> replacement) {
        return replace(Position.startOf(spanIndex), Position.startOf(spanIndex + 1), replacement);
    }

    public SpanRewriter insert(Position at, List<Span> inserted) {
        return replace(at, at, inserted);
    }

    public boolean hasEdits() {
        return !edits.isEmpty();
    }

    public List<Span> apply() {
        List<Edit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparing(Edit::from).thenComparingInt(Edit::order));

        List<Span> out = new ArrayList<>();
        Position cursor = Position.startOf(0);
        for (Edit edit : ordered) {
            if (edit.from().compareTo(cursor) < 0) {
                throw new IllegalStateException("Overlapping edits at " + edit.from());
            }
            copy(cursor, edit.from(), out);
            out.addAll(edit.replacement());
            cursor = edit.to();
        }
        copy(cursor, new Position(spans.size(), 0), out);
        return merge(out);
    }

    private void copy(Position from, Position to, List<Span> out) {
        for (int i = from.spanIndex(); i <= to.spanIndex() && i < spans.size(); i++) {
            Span span = spans.get(i);
            int startOffset = i == from.spanIndex() ? from.offset() : 0;
            int endOffset = i == to.spanIndex() ? to.offset() : span.length();
            if (endOffset <= startOffset) {
                continue;
            }
            if (startOffset == 0 && endOffset == span.length()) {
                out.add(span);
                continue;
            }
            if (span.locked() || span.kind() != SpanKind.CODE && span.kind() != SpanKind.COMMENT) {
                throw new IllegalStateException("Cannot split " + span.kind() + " span at " + i);
            }
            out.add(new Span(
                    span.kind(),
                    span.isSynthetic() ? -1 : span.start() + startOffset,
                    span.isSynthetic() ? -1 : span.start() + endOffset,
                    span.text().substring(startOffset, endOffset),
                    false,
                    span.insertedBy()));
        }
    }

    private static List<Span> merge(List<Span> input) {
        List<Span> out = new ArrayList<>();
        for (Span span : input) {
            if (span.text().isEmpty()) {
                continue;
            }
            if (!out.isEmpty()) {
                Span previous = out.get(out.size() - 1);
                if (mergeable(previous, span)) {
                    boolean contiguous = !previous.isSynthetic() && !span.isSynthetic() && previous.end() == span.start();
                    out.set(out.size() - 1, new Span(
                            SpanKind.CODE,
                            contiguous ? previous.start() : -1,
                            contiguous ? span.end() : -1,
                            previous.text() + span.text(),
                            false,
                            previous.insertedBy()));
                    continue;
                }
            }
            out.add(span);
        }
        return out;
    }

    private static boolean mergeable(Span a, Span b) {
        return a.kind() == SpanKind.CODE && b.kind() == SpanKind.CODE
                && !a.locked() && !b.locked()
                && Objects.equals(a.insertedBy(), b.insertedBy());
    }
}
