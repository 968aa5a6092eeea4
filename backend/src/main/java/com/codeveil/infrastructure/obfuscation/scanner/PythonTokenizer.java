package com.codeveil.infrastructure.obfuscation.scanner;

import com.codeveil.domain.obfuscation.model.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexes a span sequence into tokens. Only code spans are split; every other span is a single token.
 */
public final class PythonTokenizer {

    private static final String[] THREE_CHAR_OPS = {"**=", "//=", ">>=", "<<=", "..."};
    private static final String[] TWO_CHAR_OPS = {
            "->", ":=", "==", "!=", "<=", ">=", "**", "//", "<<", ">>",
            "+=", "-=", "*=", "/=", "%=", "@=", "&=", "|=", "^="
    };

    private PythonTokenizer() {
    }

    public static List<PythonToken> tokenize(List<Span> spans) {
        List<PythonToken> tokens = new ArrayList<>();
        for (int i = 0; i < spans.size(); i++) {
            Span span = spans.get(i);
            switch (span.kind()) {
                case CODE -> lexCode(span.text(), i, tokens);
                case STRING_LITERAL -> tokens.add(new PythonToken(PythonToken.Type.STRING, span.text(), i, 0));
                case INTERPOLATED_LITERAL -> tokens.add(new PythonToken(PythonToken.Type.INTERPOLATED, span.text(), i, 0));
                case NUMERIC_LITERAL -> tokens.add(new PythonToken(PythonToken.Type.NUMBER, span.text(), i, 0));
                case COMMENT -> tokens.add(new PythonToken(PythonToken.Type.COMMENT, span.text(), i, 0));
            }
        }
        return tokens;
    }

    private static void lexCode(String text, int spanIndex, List<PythonToken> out) {
        int pos = 0;
        int n = text.length();
        while (pos < n) {
            char c = text.charAt(pos);
            int end;
            PythonToken.Type type;
            if (c == ' ' || c == '\t' || c == '\f') {
                end = pos + 1;
                while (end < n && (text.charAt(end) == ' ' || text.charAt(end) == '\t' || text.charAt(end) == '\f')) {
                    end++;
                }
                type = PythonToken.Type.WHITESPACE;
            } else if (c == '\r' || c == '\n') {
                end = newlineEnd(text, pos);
                type = PythonToken.Type.NEWLINE;
            } else if (c == '\\' && pos + 1 < n && (text.charAt(pos + 1) == '\n' || text.charAt(pos + 1) == '\r')) {
                end = newlineEnd(text, pos + 1);
                type = PythonToken.Type.CONTINUATION;
            } else if (PythonScanner.isIdentifierStart(text.codePointAt(pos))) {
                end = PythonScanner.identifierEnd(text, pos);
                type = PythonToken.Type.NAME;
            } else if (c >= '0' && c <= '9') {
                // synthesized arithmetic is emitted as plain code text
                end = pos + 1;
                while (end < n && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_'
                        || text.charAt(end) == '.')) {
                    end++;
                }
                type = PythonToken.Type.NUMBER;
            } else {
                end = pos + operatorLength(text, pos);
                type = PythonToken.Type.OP;
            }
            out.add(new PythonToken(type, text.substring(pos, end), spanIndex, pos));
            pos = end;
        }
    }

    private static int newlineEnd(String text, int pos) {
        if (text.charAt(pos) == '\r' && pos + 1 < text.length() && text.charAt(pos + 1) == '\n') {
            return pos + 2;
        }
        return pos + 1;
    }

    private static int operatorLength(String text, int pos) {
        for (String op : THREE_CHAR_OPS) {
            if (text.startsWith(op, pos)) {
                return 3;
            }
        }
        for (String op : TWO_CHAR_OPS) {
            if (text.startsWith(op, pos)) {
                return 2;
            }
        }
        return Character.charCount(text.codePointAt(pos));
    }
}
