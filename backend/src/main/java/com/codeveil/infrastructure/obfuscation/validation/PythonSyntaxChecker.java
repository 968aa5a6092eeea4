package com.codeveil.infrastructure.obfuscation.validation;

import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.ValidationIssue;
import com.codeveil.domain.obfuscation.model.ValidationIssueType;
import com.codeveil.infrastructure.obfuscation.scanner.BlockKind;
import com.codeveil.infrastructure.obfuscation.scanner.LogicalLine;
import com.codeveil.infrastructure.obfuscation.scanner.PythonToken;
import com.codeveil.infrastructure.obfuscation.scanner.SourceStructure;
import com.codeveil.infrastructure.obfuscation.technique.PythonNames;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural syntax checks over a scanned span sequence. Catches the classes of damage a rewrite
 * can do: broken bracket nesting, broken indentation and clause chains, operands glued together,
 * and misplaced statements.
 */
@Component
public class PythonSyntaxChecker {

    private static final Map<String, Set<String>> CLAUSE_PREDECESSORS = Map.of(
            "elif", Set.of("if", "elif"),
            "else", Set.of("if", "elif", "for", "while", "try", "except"),
            "except", Set.of("try", "except"),
            "finally", Set.of("try", "except", "else")
    );

    private static final Set<String> SOFT_KEYWORD_LEADS = Set.of("match", "case", "type");

    private static final Map<String, String> PAIRS = Map.of(")", "(", "]", "[", "}", "{");

    public List<ValidationIssue> check(List<Span> spans) {
        SourceStructure structure = SourceStructure.of(spans);
        List<ValidationIssue> issues = new ArrayList<>();
        checkBrackets(structure.tokens(), issues);
        checkLines(structure.lines(), issues);
        return issues;
    }

    private void checkBrackets(List<PythonToken> tokens, List<ValidationIssue> issues) {
        Deque<PythonToken> open = new ArrayDeque<>();
        for (PythonToken token : tokens) {
            if (token.isOpening()) {
                open.push(token);
            } else if (token.isClosing()) {
                if (open.isEmpty() || !open.peek().text().equals(PAIRS.get(token.text()))) {
                    issues.add(ValidationIssue.error(ValidationIssueType.UNBALANCED_BRACKET,
                            "Unmatched '" + token.text() + "'", token.text()));
                    return;
                }
                open.pop();
            }
        }
        if (!open.isEmpty()) {
            issues.add(ValidationIssue.error(ValidationIssueType.UNBALANCED_BRACKET,
                    "'" + open.peek().text() + "' was never closed", open.peek().text()));
        }
    }

    private void checkLines(List<LogicalLine> lines, List<ValidationIssue> issues) {
        Deque<Integer> indents = new ArrayDeque<>();
        indents.push(0);
        Map<Integer, String> lastKeywordAtIndent = new HashMap<>();
        LogicalLine previous = null;
        boolean seenStatement = false;

        for (LogicalLine line : lines) {
            int width = line.indentWidth();

            // indentation
            if (previous != null && previous.isBlockHeader()) {
                if (width <= indents.peek()) {
                    issues.add(error(ValidationIssueType.INDENTATION, "Expected an indented block", previous));
                } else {
                    indents.push(width);
                }
            } else if (width > indents.peek()) {
                issues.add(error(ValidationIssueType.INDENTATION, "Unexpected indent", line));
            } else {
                while (width < indents.peek()) {
                    indents.pop();
                }
                if (width != indents.peek()) {
                    issues.add(error(ValidationIssueType.INDENTATION, "Unindent does not match any outer level", line));
                }
            }
            lastKeywordAtIndent.keySet().removeIf(w -> w > width);

            // clause chains
            String keyword = line.keyword();
            Set<String> predecessors = CLAUSE_PREDECESSORS.get(keyword);
            if (predecessors != null && line.isCompound()) {
                String before = lastKeywordAtIndent.get(width);
                if (before == null || !predecessors.contains(before)) {
                    issues.add(error(ValidationIssueType.CLAUSE_ORDER,
                            "'" + keyword + "' does not follow a matching clause", line));
                }
            }
            lastKeywordAtIndent.put(width, line.isCompound() ? keyword : "");

            // header colon
            if (line.isCompound() && line.topLevelColonIndex() < 0) {
                issues.add(error(ValidationIssueType.BLOCK_STRUCTURE, "Compound statement without ':'", line));
            }

            checkAdjacentOperands(line, issues);

            // statement placement
            if (SourceStructure.isFutureImport(line)) {
                if (seenStatement) {
                    issues.add(error(ValidationIssueType.FUTURE_IMPORT_PLACEMENT,
                            "from __future__ imports must occur at the beginning of the file", line));
                }
            } else if (!(line.index() == 0 && line.tokens().size() == 1 && line.first().type() == PythonToken.Type.STRING)) {
                seenStatement = true;
            }
            if (line.startsWith("return") && line.enclosingBlock() != BlockKind.FUNCTION) {
                issues.add(error(ValidationIssueType.RETURN_OUTSIDE_FUNCTION, "'return' outside function", line));
            }

            previous = line;
        }
        if (previous != null && previous.isBlockHeader()) {
            issues.add(error(ValidationIssueType.INDENTATION, "Expected an indented block at end of input", previous));
        }
    }

    private void checkAdjacentOperands(LogicalLine line, List<ValidationIssue> issues) {
        List<PythonToken> tokens = line.tokens();
        for (int i = 1; i < tokens.size(); i++) {
            PythonToken a = tokens.get(i - 1);
            PythonToken b = tokens.get(i);
            if (a.isStringLike() && b.isStringLike()) {
                continue;
            }
            boolean softKeywordLead = i == 1 && SOFT_KEYWORD_LEADS.contains(a.text());
            if (endsOperand(a) && !softKeywordLead && startsOperand(b)) {
                issues.add(ValidationIssue.error(ValidationIssueType.ADJACENT_OPERANDS,
                        "Invalid syntax between '" + a.text() + "' and '" + b.text() + "'", line.render()));
                return;
            }
        }
    }

    private static boolean endsOperand(PythonToken token) {
        return isOperandName(token) || token.isLiteral() || token.isClosing();
    }

    private static boolean startsOperand(PythonToken token) {
        return isOperandName(token) || token.isLiteral();
    }

    private static boolean isOperandName(PythonToken token) {
        return token.type() == PythonToken.Type.NAME && !PythonNames.isKeyword(token.text());
    }

    private static ValidationIssue error(ValidationIssueType type, String message, LogicalLine line) {
        return ValidationIssue.error(type, message + " (logical line " + (line.index() + 1) + ")", line.render());
    }
}
