package com.codeveil.infrastructure.obfuscation.scanner;

import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.SpanKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Token stream and logical-line layout of a span sequence, shared by all techniques and the syntax checker.
 */
public final class SourceStructure {

    /**
     * Where module-level helper definitions go.
     *
     * @param position            insertion position
     * @param needsLeadingNewline true if the preceding text does not end with a line break
     */
    public record InsertionPoint(Position position, boolean needsLeadingNewline) {}

    private record Block(int indentWidth, BlockKind kind) {}

    private final List<Span> spans;
    private final List<PythonToken> tokens;
    private final List<LogicalLine> lines;
    private final Map<Integer, Integer> tokenIndexBySpan;
    private final Map<Integer, LogicalLine> lineBySpan;
    private final int prologueEnd;
    private final String newlineStyle;

    private SourceStructure(List<Span> spans) {
        this.spans = List.copyOf(spans);
        this.tokens = PythonTokenizer.tokenize(this.spans);
        this.lines = buildLines();
        this.tokenIndexBySpan = new HashMap<>();
        this.lineBySpan = new HashMap<>();
        indexLiteralSpans();
        this.prologueEnd = findPrologueEnd();
        this.newlineStyle = tokens.stream()
                .filter(t -> t.type() == PythonToken.Type.NEWLINE)
                .map(PythonToken::text)
                .findFirst()
                .orElse("\n");
    }

    public static SourceStructure of(List<Span> spans) {
        return new SourceStructure(spans);
    }

    public List<Span> spans() {
        return spans;
    }

    public List<PythonToken> tokens() {
        return tokens;
    }

    public List<LogicalLine> lines() {
        return lines;
    }

    /**
     * Index of the first logical line after the module docstring and {@code from __future__} imports.
     */
    public int prologueEnd() {
        return prologueEnd;
    }

    public String newlineStyle() {
        return newlineStyle;
    }

    public Position end() {
        return new Position(spans.size(), 0);
    }

    public Set<String> identifiers() {
        Set<String> names = new LinkedHashSet<>();
        for (PythonToken token : tokens) {
            if (token.type() == PythonToken.Type.NAME) {
                names.add(token.text());
            }
        }
        return names;
    }

    /**
     * Token index of a non-code span, or -1 for code spans.
     */
    public int tokenIndexOfSpan(int spanIndex) {
        return tokenIndexBySpan.getOrDefault(spanIndex, -1);
    }

    /**
     * Logical line holding a non-code span, or null if it sits outside any line (a comment).
     */
    public LogicalLine lineOfSpan(int spanIndex) {
        return lineBySpan.get(spanIndex);
    }

    public PythonToken previousSignificant(int tokenIndex) {
        for (int i = tokenIndex - 1; i >= 0; i--) {
            if (tokens.get(i).isSignificant()) {
                return tokens.get(i);
            }
        }
        return null;
    }

    public PythonToken nextSignificant(int tokenIndex) {
        for (int i = tokenIndex + 1; i < tokens.size(); i++) {
            if (tokens.get(i).isSignificant()) {
                return tokens.get(i);
            }
        }
        return null;
    }

    public InsertionPoint prologueInsertionPoint() {
        if (prologueEnd == 0) {
            if (!lines.isEmpty()) {
                return new InsertionPoint(lines.get(0).first().start(), false);
            }
            return new InsertionPoint(end(), !endsWithLineBreak());
        }
        LogicalLine last = lines.get(prologueEnd - 1);
        if (last.newline() != null) {
            return new InsertionPoint(last.newline().end(), false);
        }
        return new InsertionPoint(end(), true);
    }

    public static int indentWidth(String indent) {
        int width = 0;
        for (int i = 0; i < indent.length(); i++) {
            char c = indent.charAt(i);
            if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c == '\f') {
                width = 0;
            } else {
                width++;
            }
        }
        return width;
    }

    private boolean endsWithLineBreak() {
        if (spans.isEmpty()) {
            return true;
        }
        String text = spans.get(spans.size() - 1).text();
        return text.endsWith("\n") || text.endsWith("\r");
    }

    private List<LogicalLine> buildLines() {
        List<LogicalLine> result = new ArrayList<>();
        Deque<Block> blocks = new ArrayDeque<>();
        List<PythonToken> current = new ArrayList<>();
        int depth = 0;
        int firstIndex = -1;
        int lastIndex = -1;

        for (int i = 0; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (token.isSignificant()) {
                if (current.isEmpty()) {
                    firstIndex = i;
                }
                current.add(token);
                lastIndex = i;
                if (token.isOpening()) {
                    depth++;
                } else if (token.isClosing()) {
                    depth = Math.max(0, depth - 1);
                }
            } else if (token.type() == PythonToken.Type.NEWLINE && depth == 0 && !current.isEmpty()) {
                result.add(finishLine(result.size(), current, firstIndex, lastIndex, token, blocks));
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            result.add(finishLine(result.size(), current, firstIndex, lastIndex, null, blocks));
        }
        return Collections.unmodifiableList(result);
    }

    private LogicalLine finishLine(int index, List<PythonToken> lineTokens, int firstIndex, int lastIndex,
                                   PythonToken newline, Deque<Block> blocks) {
        String indent = "";
        if (firstIndex > 0 && tokens.get(firstIndex - 1).type() == PythonToken.Type.WHITESPACE
                && (firstIndex == 1 || tokens.get(firstIndex - 2).type() == PythonToken.Type.NEWLINE)) {
            indent = tokens.get(firstIndex - 1).text();
        }
        int width = indentWidth(indent);
        while (!blocks.isEmpty() && blocks.peek().indentWidth() >= width) {
            blocks.pop();
        }
        BlockKind enclosing = blocks.isEmpty() ? BlockKind.MODULE : blocks.peek().kind();
        LogicalLine line = new LogicalLine(index, List.copyOf(lineTokens), firstIndex, lastIndex,
                width, indent, enclosing, newline);
        if (line.isBlockHeader() && line.isDefinitionHeader()) {
            blocks.push(new Block(width, line.keyword().equals("class") ? BlockKind.CLASS : BlockKind.FUNCTION));
        }
        return line;
    }

    private void indexLiteralSpans() {
        for (int i = 0; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (spans.get(token.spanIndex()).kind() != SpanKind.CODE) {
                tokenIndexBySpan.put(token.spanIndex(), i);
            }
        }
        for (LogicalLine line : lines) {
            for (int i = line.firstTokenIndex(); i <= line.lastTokenIndex(); i++) {
                PythonToken token = tokens.get(i);
                if (tokenIndexBySpan.containsKey(token.spanIndex()) && tokenIndexBySpan.get(token.spanIndex()) == i) {
                    lineBySpan.put(token.spanIndex(), line);
                }
            }
        }
    }

    private int findPrologueEnd() {
        int index = 0;
        if (!lines.isEmpty() && lines.get(0).tokens().size() == 1
                && lines.get(0).first().type() == PythonToken.Type.STRING) {
            index = 1;
        }
        while (index < lines.size() && isFutureImport(lines.get(index))) {
            index++;
        }
        return index;
    }

    public static boolean isFutureImport(LogicalLine line) {
        return line.startsWith("from") && line.tokens().size() > 1 && line.tokens().get(1).isName("__future__");
    }
}
