package com.codeveil.infrastructure.obfuscation.scanner;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One logical line: the significant tokens between two NEWLINE tokens at bracket depth 0.
 *
 * @param index           position of this line among the module's logical lines
 * @param tokens          significant tokens (names, numbers, operators, literals)
 * @param firstTokenIndex index of the first significant token in the full token list
 * @param lastTokenIndex  index of the last significant token in the full token list
 * @param indentWidth     indentation width with tabs expanded to multiples of 8
 * @param indent          the indentation text as written
 * @param enclosingBlock  innermost def/class body containing this line
 * @param newline         the terminating NEWLINE token, null if the line ends at end of input
 */
public record LogicalLine(
        int index,
        List<PythonToken> tokens,
        int firstTokenIndex,
        int lastTokenIndex,
        int indentWidth,
        String indent,
        BlockKind enclosingBlock,
        PythonToken newline
) {

    private static final Set<String> COMPOUND_KEYWORDS = Set.of(
            "if", "elif", "else", "for", "while", "try", "except", "finally",
            "with", "def", "class", "async"
    );

    private static final Set<String> SOFT_COMPOUND_KEYWORDS = Set.of("match", "case");

    public PythonToken first() {
        return tokens.get(0);
    }

    public PythonToken last() {
        return tokens.get(tokens.size() - 1);
    }

    /**
     * Leading keyword, looking through {@code async}. Empty if the line does not start with a name.
     */
    public String keyword() {
        PythonToken first = first();
        if (first.type() != PythonToken.Type.NAME) {
            return "";
        }
        if (first.text().equals("async") && tokens.size() > 1 && tokens.get(1).type() == PythonToken.Type.NAME) {
            return tokens.get(1).text();
        }
        return first.text();
    }

    public boolean startsWith(String word) {
        return first().isName(word);
    }

    public boolean isCompound() {
        String first = first().type() == PythonToken.Type.NAME ? first().text() : "";
        if (COMPOUND_KEYWORDS.contains(first)) {
            return true;
        }
        if (SOFT_COMPOUND_KEYWORDS.contains(first) && tokens.size() > 1) {
            PythonToken second = tokens.get(1);
            boolean looksLikeExpression = second.type() == PythonToken.Type.OP
                    && (second.text().equals("=") || second.text().equals(".") || second.text().endsWith("=")
                    || second.text().equals(")") || second.text().equals(","));
            return !looksLikeExpression && topLevelColonIndex() >= 0;
        }
        return false;
    }

    public boolean isBlockHeader() {
        return isCompound() && last().is(":");
    }

    public boolean isDecorator() {
        return first().is("@");
    }

    public boolean isDefinitionHeader() {
        String keyword = keyword();
        return keyword.equals("def") || keyword.equals("class");
    }

    /**
     * Index within {@link #tokens()} of the first ':' outside brackets, or -1.
     * Colons inside a lambda at depth 0 are not distinguished.
     */
    public int topLevelColonIndex() {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (token.isOpening()) {
                depth++;
            } else if (token.isClosing()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is(":")) {
                return i;
            }
        }
        return -1;
    }

    public String render() {
        return tokens.stream().map(PythonToken::text).collect(Collectors.joining(" "));
    }
}
