package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.infrastructure.obfuscation.scanner.LogicalLine;
import com.codeveil.infrastructure.obfuscation.scanner.PythonToken;
import com.codeveil.infrastructure.obfuscation.scanner.SourceStructure;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds builtin names that a source unit binds itself, in any scope.
 *
 * The scan over-approximates: keyword-argument keys and subscripted targets count as bindings.
 * A star import may bind anything, so it reports every builtin.
 */
final class BuiltinShadowing {

    private static final Set<String> BINDING_KEYWORDS = Set.of("def", "class", "as", "global", "nonlocal", "import");

    private static final Set<String> ASSIGNMENT_OPS = Set.of(
            "=", ":=", "+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=", ">>=", "<<=", "**="
    );

    private BuiltinShadowing() {
    }

    static Set<String> reboundIn(SourceStructure structure) {
        Set<String> rebound = new TreeSet<>();
        for (LogicalLine line : structure.lines()) {
            if (scanLine(line, rebound)) {
                return new TreeSet<>(PythonNames.BUILTINS);
            }
        }
        return rebound;
    }

    /**
     * Subset of {@code required} that the unit rebinds, in name order.
     */
    static Set<String> reboundAmong(SourceStructure structure, Collection<String> required) {
        Set<String> rebound = reboundIn(structure);
        rebound.retainAll(required);
        return rebound;
    }

    /**
     * @return true if the line holds a star import
     */
    private static boolean scanLine(LogicalLine line, Set<String> rebound) {
        List<PythonToken> tokens = line.tokens();
        boolean annotated = !line.isCompound() && tokens.size() > 1 && tokens.get(1).is(":");
        int lastAssignment = annotated ? -1 : lastTopLevelAssignment(tokens);
        boolean importStatement = false;
        int regionDepth = -1;
        String regionEnd = null;
        int depth = 0;

        for (int i = 0; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            PythonToken previous = i > 0 ? tokens.get(i - 1) : null;
            PythonToken next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

            if (token.isName("import")) {
                importStatement = true;
                if (next != null && next.is("*")) {
                    return true;
                }
            } else if (token.is(";")) {
                importStatement = false;
            }

            if (token.isOpening()) {
                if (token.is("(") && i >= 2 && tokens.get(i - 2).isName("def")) {
                    regionDepth = depth;
                    regionEnd = ")";
                }
                depth++;
                continue;
            }
            if (token.isClosing()) {
                depth = Math.max(0, depth - 1);
                if (")".equals(regionEnd) && depth == regionDepth) {
                    regionEnd = null;
                }
                continue;
            }
            if (token.isName("for") || token.isName("lambda")) {
                regionDepth = depth;
                regionEnd = token.isName("for") ? "in" : ":";
                continue;
            }
            if (regionEnd != null && depth == regionDepth
                    && (token.isName(regionEnd) || token.is(regionEnd))) {
                regionEnd = null;
                continue;
            }

            if (token.type() != PythonToken.Type.NAME || !PythonNames.BUILTINS.contains(token.text())) {
                continue;
            }
            boolean dotted = previous != null && previous.is(".");
            boolean aliased = next != null && next.isName("as");
            boolean bound;
            if (annotated) {
                bound = i == 0;
            } else if (importStatement) {
                bound = !dotted && !aliased && previous != null
                        && (previous.isName("import") || previous.is(",") || previous.is("("))
                        || previous != null && previous.isName("as");
            } else {
                bound = previous != null && previous.type() == PythonToken.Type.NAME
                        && BINDING_KEYWORDS.contains(previous.text())
                        || next != null && next.type() == PythonToken.Type.OP && ASSIGNMENT_OPS.contains(next.text())
                        || ")".equals(regionEnd) && depth == regionDepth + 1 && startsParameter(previous)
                        || regionEnd != null && !")".equals(regionEnd) && !dotted
                        || i < lastAssignment && !dotted && !isAccessed(next);
            }
            if (bound) {
                rebound.add(token.text());
            }
        }
        return false;
    }

    private static boolean startsParameter(PythonToken previous) {
        return previous != null && (previous.is("(") || previous.is(",") || previous.is("*") || previous.is("**"));
    }

    private static boolean isAccessed(PythonToken next) {
        return next != null && (next.is(".") || next.is("(") || next.is("["));
    }

    private static int lastTopLevelAssignment(List<PythonToken> tokens) {
        int depth = 0;
        int last = -1;
        for (int i = 0; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (token.isOpening()) {
                depth++;
            } else if (token.isClosing()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is("=")) {
                last = i;
            }
        }
        return last;
    }
}
