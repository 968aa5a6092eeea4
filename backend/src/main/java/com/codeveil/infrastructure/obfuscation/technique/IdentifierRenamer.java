package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.RenameMap;
import com.codeveil.domain.obfuscation.model.RenameMap.DeclarationKind;
import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.SpanKind;
import com.codeveil.infrastructure.obfuscation.scanner.BlockKind;
import com.codeveil.infrastructure.obfuscation.scanner.LogicalLine;
import com.codeveil.infrastructure.obfuscation.scanner.PythonToken;
import com.codeveil.infrastructure.obfuscation.scanner.SourceStructure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renames locally declared identifiers consistently across the whole source unit.
 *
 * Names that may be reached from outside the declaring text (attributes, keyword arguments,
 * class-body members, imported names, names spelled inside literals) are left alone. Class names,
 * decorated functions and names read through {@code __name__} or {@code __qualname__} keep their
 * spelling since it is visible at runtime. A unit with a star import is not renamed at all.
 */
@Slf4j
@Component
public class IdentifierRenamer implements ObfuscationTechnique {

    public static final String NAME = "identifier_renaming";

    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private static final Set<String> NAME_ATTRIBUTES = Set.of("__name__", "__qualname__");

    private static final Set<String> AUGMENTED_OPS = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=", ">>=", "<<=", "**="
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Span> apply(List<Span> spans, TechniqueRun run) {
        SourceStructure structure = SourceStructure.of(spans);
        Collector collector = new Collector();
        for (LogicalLine line : structure.lines()) {
            collector.visit(line);
        }
        collector.excludeLiteralText(spans);
        if (collector.starImport) {
            run.warn(NAME, "Skipped: a star import binds names that cannot be resolved statically");
            return spans;
        }

        RenameMap renameMap = run.getRenameMap();
        for (Map.Entry<String, DeclarationKind> entry : collector.declared.entrySet()) {
            String name = entry.getKey();
            if (renameMap.contains(name) || !isRenamable(name, collector.excluded, run)) {
                continue;
            }
            renameMap.put(name, run.getAllocator().allocate(), entry.getValue());
        }

        if (renameMap.isEmpty()) {
            run.info(NAME, "No renamable identifiers found");
            return spans;
        }

        SpanRewriter rewriter = new SpanRewriter(spans);
        List<PythonToken> tokens = structure.tokens();
        int occurrences = 0;
        for (int i = 0; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (token.type() != PythonToken.Type.NAME || collector.importTokens.contains(token)) {
                continue;
            }
            Span span = spans.get(token.spanIndex());
            String generated = renameMap.get(token.text());
            if (span.locked() || generated == null) {
                continue;
            }
            PythonToken previous = structure.previousSignificant(i);
            if (previous != null && previous.is(".")) {
                continue;
            }
            rewriter.replace(token.start(), token.end(), List.of(Span.code(generated).insertedBy(span.insertedBy())));
            occurrences++;
        }

        log.debug("[IdentifierRenamer] names={}, occurrences={}", renameMap.size(), occurrences);
        run.info(NAME, "Renamed " + renameMap.size() + " identifier(s) at " + occurrences + " site(s)");
        return rewriter.apply();
    }

    private static boolean isRenamable(String name, Set<String> excluded, TechniqueRun run) {
        return !PythonNames.isReserved(name)
                && !PythonNames.isDunder(name)
                && !excluded.contains(name)
                && !run.getExclusions().isExcluded(name);
    }

    /**
     * Gathers declarations and exclusions line by line.
     */
    private static final class Collector {

        private final Map<String, DeclarationKind> declared = new LinkedHashMap<>();
        private final Set<String> excluded = new HashSet<>();
        private final Set<PythonToken> importTokens = new HashSet<>();
        private boolean starImport;
        private boolean decorated;

        void visit(LogicalLine line) {
            List<PythonToken> tokens = line.tokens();
            scanReferences(tokens);

            boolean classBody = line.enclosingBlock() == BlockKind.CLASS;
            boolean afterDecorator = decorated;
            decorated = line.isDecorator();
            if (line.isCompound()) {
                int colon = line.topLevelColonIndex();
                List<PythonToken> header = colon >= 0 ? tokens.subList(0, colon) : tokens;
                visitHeader(header, classBody, afterDecorator);
                if (colon >= 0 && colon + 1 < tokens.size()) {
                    boolean inlineClassBody = line.keyword().equals("class");
                    for (List<PythonToken> statement : splitStatements(tokens.subList(colon + 1, tokens.size()))) {
                        visitSimple(statement, classBody || inlineClassBody);
                    }
                }
            } else if (!line.isDecorator()) {
                for (List<PythonToken> statement : splitStatements(tokens)) {
                    visitSimple(statement, classBody);
                }
            }
            scanBindingsAnywhere(tokens, classBody);
        }

        private void visitHeader(List<PythonToken> header, boolean classBody, boolean afterDecorator) {
            String keyword = header.get(0).isName("async") && header.size() > 1 ? header.get(1).text() : header.get(0).text();
            int nameIndex = header.get(0).isName("async") ? 2 : 1;
            if ((keyword.equals("def") || keyword.equals("class")) && nameIndex < header.size()
                    && header.get(nameIndex).type() == PythonToken.Type.NAME) {
                boolean function = keyword.equals("def");
                declare(header.get(nameIndex).text(),
                        function ? DeclarationKind.FUNCTION : DeclarationKind.CLASS,
                        classBody || !function || afterDecorator);
                if (keyword.equals("def")) {
                    declareParameters(header, nameIndex + 1);
                }
            }
        }

        private void declareParameters(List<PythonToken> header, int openIndex) {
            if (openIndex >= header.size() || !header.get(openIndex).is("(")) {
                return;
            }
            int depth = 0;
            boolean expectName = true;
            for (int i = openIndex; i < header.size(); i++) {
                PythonToken token = header.get(i);
                if (token.isOpening()) {
                    depth++;
                    continue;
                }
                if (token.isClosing()) {
                    depth--;
                    if (depth == 0) {
                        return;
                    }
                    continue;
                }
                if (depth != 1) {
                    continue;
                }
                if (token.is(",")) {
                    expectName = true;
                } else if (token.is(":") || token.is("=")) {
                    expectName = false;
                } else if (expectName && token.type() == PythonToken.Type.NAME) {
                    declare(token.text(), DeclarationKind.PARAMETER, false);
                    expectName = false;
                }
            }
        }

        private void visitSimple(List<PythonToken> statement, boolean classBody) {
            if (statement.isEmpty()) {
                return;
            }
            PythonToken first = statement.get(0);
            if (first.isName("import") || first.isName("from")) {
                visitImport(statement);
                return;
            }
            if (first.isName("global") || first.isName("nonlocal")) {
                for (PythonToken token : statement.subList(1, statement.size())) {
                    if (token.type() == PythonToken.Type.NAME) {
                        declare(token.text(), DeclarationKind.GLOBAL, classBody);
                    }
                }
                return;
            }
            if (first.type() == PythonToken.Type.NAME && PythonNames.isKeyword(first.text())) {
                return;
            }

            if (first.type() == PythonToken.Type.NAME && statement.size() > 1 && statement.get(1).is(":")) {
                declare(first.text(), DeclarationKind.VARIABLE, classBody);
                return;
            }

            List<Integer> assignments = new ArrayList<>();
            int depth = 0;
            for (int i = 0; i < statement.size(); i++) {
                PythonToken token = statement.get(i);
                if (token.isOpening()) {
                    depth++;
                } else if (token.isClosing()) {
                    depth = Math.max(0, depth - 1);
                } else if (depth == 0 && token.type() == PythonToken.Type.OP) {
                    if (token.text().equals("=")) {
                        assignments.add(i);
                    } else if (AUGMENTED_OPS.contains(token.text())) {
                        declareTargets(statement.subList(0, i), classBody);
                        return;
                    }
                }
            }
            int from = 0;
            for (int index : assignments) {
                declareTargets(statement.subList(from, index), classBody);
                from = index + 1;
            }
        }

        private void visitImport(List<PythonToken> statement) {
            importTokens.addAll(statement);
            int start = 1;
            if (statement.get(0).isName("from")) {
                start = statement.size();
                for (int i = 0; i < statement.size(); i++) {
                    if (statement.get(i).isName("import")) {
                        start = i + 1;
                        break;
                    }
                }
            }
            List<PythonToken> item = new ArrayList<>();
            for (int i = start; i <= statement.size(); i++) {
                PythonToken token = i < statement.size() ? statement.get(i) : null;
                if (token == null || token.is(",")) {
                    excludeImportBinding(item, statement.get(0).isName("import"));
                    item.clear();
                } else if (token.is("*")) {
                    starImport = true;
                } else if (!token.is("(") && !token.is(")")) {
                    item.add(token);
                }
            }
        }

        private void excludeImportBinding(List<PythonToken> item, boolean plainImport) {
            if (item.isEmpty()) {
                return;
            }
            for (int i = 0; i < item.size() - 1; i++) {
                if (item.get(i).isName("as")) {
                    excluded.add(item.get(i + 1).text());
                    return;
                }
            }
            // "import a.b" binds "a"; "from m import b" binds "b"
            PythonToken bound = plainImport ? item.get(0) : item.get(item.size() - 1);
            if (bound.type() == PythonToken.Type.NAME) {
                excluded.add(bound.text());
            }
        }

        private void declareTargets(List<PythonToken> segment, boolean classBody) {
            Deque<Boolean> trailers = new ArrayDeque<>();
            for (int i = 0; i < segment.size(); i++) {
                PythonToken token = segment.get(i);
                PythonToken previous = i > 0 ? segment.get(i - 1) : null;
                if (token.isOpening()) {
                    trailers.push(previous != null && startsTrailer(previous));
                    continue;
                }
                if (token.isClosing()) {
                    if (!trailers.isEmpty()) {
                        trailers.pop();
                    }
                    continue;
                }
                if (token.type() != PythonToken.Type.NAME || trailers.contains(Boolean.TRUE)) {
                    continue;
                }
                PythonToken next = i + 1 < segment.size() ? segment.get(i + 1) : null;
                boolean dotted = previous != null && previous.is(".");
                boolean accessed = next != null && (next.is(".") || next.is("(") || next.is("["));
                if (!dotted && !accessed && !PythonNames.isKeyword(token.text())) {
                    declare(token.text(), DeclarationKind.VARIABLE, classBody);
                }
            }
        }

        /**
         * Loop targets, context-manager and exception aliases, and assignment expressions anywhere in the line.
         */
        private void scanBindingsAnywhere(List<PythonToken> tokens, boolean classBody) {
            if (tokens.get(0).isName("import") || tokens.get(0).isName("from")) {
                return;
            }
            for (int i = 0; i < tokens.size(); i++) {
                PythonToken token = tokens.get(i);
                if (token.isName("for")) {
                    int depth = 0;
                    List<PythonToken> targets = new ArrayList<>();
                    for (int j = i + 1; j < tokens.size(); j++) {
                        PythonToken t = tokens.get(j);
                        if (depth == 0 && t.isName("in")) {
                            break;
                        }
                        if (t.isOpening()) {
                            depth++;
                        } else if (t.isClosing()) {
                            depth--;
                        }
                        targets.add(t);
                    }
                    declareTargets(targets, classBody);
                } else if (token.isName("as") && i + 1 < tokens.size()) {
                    PythonToken next = tokens.get(i + 1);
                    if (next.type() == PythonToken.Type.NAME) {
                        declare(next.text(), DeclarationKind.ALIAS, classBody);
                    } else if (next.is("(")) {
                        for (int j = i + 2; j < tokens.size() && !tokens.get(j).is(")"); j++) {
                            if (tokens.get(j).type() == PythonToken.Type.NAME) {
                                declare(tokens.get(j).text(), DeclarationKind.ALIAS, classBody);
                            }
                        }
                    }
                } else if (token.type() == PythonToken.Type.NAME && i + 1 < tokens.size() && tokens.get(i + 1).is(":=")) {
                    declare(token.text(), DeclarationKind.VARIABLE, classBody);
                }
            }
        }

        /**
         * Attributes, keyword-argument keys and names whose {@code __name__} is read.
         */
        private void scanReferences(List<PythonToken> tokens) {
            Deque<Boolean> calls = new ArrayDeque<>();
            for (int i = 0; i < tokens.size(); i++) {
                PythonToken token = tokens.get(i);
                PythonToken previous = i > 0 ? tokens.get(i - 1) : null;
                if (token.isOpening()) {
                    boolean parameterList = i >= 2 && tokens.get(i - 2).isName("def");
                    calls.push(token.is("(") && previous != null && startsTrailer(previous) && !parameterList);
                    continue;
                }
                if (token.isClosing()) {
                    if (!calls.isEmpty()) {
                        calls.pop();
                    }
                    continue;
                }
                if (token.type() != PythonToken.Type.NAME) {
                    continue;
                }
                if (previous != null && previous.is(".")) {
                    excluded.add(token.text());
                }
                if (i + 2 < tokens.size() && tokens.get(i + 1).is(".")
                        && NAME_ATTRIBUTES.contains(tokens.get(i + 2).text())) {
                    excluded.add(token.text());
                }
                boolean keywordArgument = !calls.isEmpty() && calls.peek()
                        && i + 1 < tokens.size() && tokens.get(i + 1).is("=")
                        && previous != null && (previous.is("(") || previous.is(","));
                if (keywordArgument) {
                    excluded.add(token.text());
                }
            }
        }

        void excludeLiteralText(List<Span> spans) {
            for (Span span : spans) {
                if (span.kind() == SpanKind.INTERPOLATED_LITERAL) {
                    excludeIdentifiersIn(span.text());
                } else if (span.kind() == SpanKind.STRING_LITERAL) {
                    // eval('counter + 1') and getattr(obj, 'name') both reach names through text
                    excludeIdentifiersIn(literalValue(span.text()));
                }
            }
        }

        private void excludeIdentifiersIn(String text) {
            Matcher m = IDENTIFIER.matcher(text);
            while (m.find()) {
                excluded.add(m.group());
            }
        }

        private static String literalValue(String literal) {
            try {
                int[] codePoints = PythonLiteralDecoder.decode(literal);
                return new String(codePoints, 0, codePoints.length);
            } catch (IllegalArgumentException e) {
                return PythonLiteralDecoder.body(literal);
            }
        }

        private void declare(String name, DeclarationKind kind, boolean classBody) {
            if (classBody) {
                excluded.add(name);
            }
            declared.putIfAbsent(name, kind);
        }

        private static List<List<PythonToken>> splitStatements(List<PythonToken> tokens) {
            List<List<PythonToken>> statements = new ArrayList<>();
            int depth = 0;
            int from = 0;
            for (int i = 0; i < tokens.size(); i++) {
                PythonToken token = tokens.get(i);
                if (token.isOpening()) {
                    depth++;
                } else if (token.isClosing()) {
                    depth = Math.max(0, depth - 1);
                } else if (depth == 0 && token.is(";")) {
                    statements.add(tokens.subList(from, i));
                    from = i + 1;
                }
            }
            statements.add(tokens.subList(from, tokens.size()));
            return statements;
        }

        private static boolean startsTrailer(PythonToken previous) {
            return previous.type() == PythonToken.Type.NAME && !PythonNames.isKeyword(previous.text())
                    || previous.isClosing()
                    || previous.isStringLike();
        }
    }
}
