package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.SpanKind;
import com.codeveil.infrastructure.obfuscation.scanner.LogicalLine;
import com.codeveil.infrastructure.obfuscation.scanner.PythonToken;
import com.codeveil.infrastructure.obfuscation.scanner.SourceStructure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rewrites static import statements into equivalent dynamic-import assignments whose module and
 * member names are encoded by the {@link LiteralEncoder}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportIndirector implements ObfuscationTechnique {

    public static final String NAME = "import_indirection";

    private static final Set<String> IMPORT_BUILTINS = Set.of("__import__", "getattr", "globals");

    private final LiteralEncoder literalEncoder;

    /**
     * One imported name: the dotted module path or member, and the name it binds.
     */
    private record ImportItem(String target, String alias) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Span> apply(List<Span> spans, TechniqueRun run) {
        SourceStructure structure = SourceStructure.of(spans);
        Set<String> required = new HashSet<>(IMPORT_BUILTINS);
        required.addAll(literalEncoder.textBuiltins(run));
        Set<String> rebound = BuiltinShadowing.reboundAmong(structure, required);
        if (!rebound.isEmpty()) {
            run.warn(NAME, "Skipped: the source rebinds " + String.join(", ", rebound));
            return spans;
        }
        SpanRewriter rewriter = new SpanRewriter(spans);
        int rewritten = 0;
        int skipped = 0;

        for (LogicalLine line : structure.lines()) {
            if (!line.startsWith("import") && !line.startsWith("from") || SourceStructure.isFutureImport(line)) {
                continue;
            }
            List<PythonToken> statement = firstStatement(line.tokens());
            PythonToken last = statement.get(statement.size() - 1);
            if (containsNonCode(structure, line, statement.get(0), last)) {
                skipped++;
                continue;
            }
            List<Span> replacement = line.startsWith("import")
                    ? rewritePlainImport(statement, run)
                    : rewriteFromImport(statement, run);
            if (replacement == null) {
                skipped++;
                continue;
            }
            rewriter.replace(statement.get(0).start(), last.end(), replacement);
            rewritten++;
        }

        log.debug("[ImportIndirector] rewritten={}, skipped={}", rewritten, skipped);
        run.info(NAME, "Rewrote " + rewritten + " import statement(s), left " + skipped + " unchanged");
        return literalEncoder.installHelpers(rewriter.apply(), run);
    }

    private List<Span> rewritePlainImport(List<PythonToken> statement, TechniqueRun run) {
        List<ImportItem> items = parseItems(statement.subList(1, statement.size()));
        if (items == null || items.isEmpty()) {
            return null;
        }
        List<Span> out = new ArrayList<>();
        for (ImportItem item : items) {
            separate(out);
            if (item.alias() == null) {
                String bound = item.target().contains(".") ? item.target().substring(0, item.target().indexOf('.')) : item.target();
                out.add(Span.code(bound + " = __import__("));
                out.addAll(literalEncoder.encodeText(item.target(), run));
                out.add(Span.code(")"));
            } else if (!item.target().contains(".")) {
                out.add(Span.code(item.alias() + " = __import__("));
                out.addAll(literalEncoder.encodeText(item.target(), run));
                out.add(Span.code(")"));
            } else {
                out.add(Span.code(item.alias() + " = __import__("));
                out.addAll(literalEncoder.encodeText("importlib", run));
                out.add(Span.code(").import_module("));
                out.addAll(literalEncoder.encodeText(item.target(), run));
                out.add(Span.code(")"));
            }
        }
        return out;
    }

    private List<Span> rewriteFromImport(List<PythonToken> statement, TechniqueRun run) {
        int i = 1;
        int level = 0;
        while (i < statement.size() && (statement.get(i).is(".") || statement.get(i).is("..."))) {
            level += statement.get(i).text().length();
            i++;
        }
        StringBuilder module = new StringBuilder();
        while (i < statement.size() && !statement.get(i).isName("import")) {
            module.append(statement.get(i).text());
            i++;
        }
        if (i >= statement.size()) {
            return null;
        }
        List<PythonToken> names = new ArrayList<>();
        for (PythonToken token : statement.subList(i + 1, statement.size())) {
            if (token.is("*")) {
                return null;
            }
            if (!token.is("(") && !token.is(")")) {
                names.add(token);
            }
        }
        List<ImportItem> items = parseItems(names);
        if (items == null || items.isEmpty()) {
            return null;
        }

        List<Span> out = new ArrayList<>();
        for (ImportItem item : items) {
            separate(out);
            String bound = item.alias() != null ? item.alias() : item.target();
            out.add(Span.code(bound + " = getattr(__import__("));
            out.addAll(literalEncoder.encodeText(module.toString(), run));
            if (level == 0) {
                out.add(Span.code(", fromlist=["));
                out.addAll(literalEncoder.encodeText(item.target(), run));
                out.add(Span.code("]), "));
            } else {
                out.add(Span.code(", globals(), None, ["));
                out.addAll(literalEncoder.encodeText(item.target(), run));
                out.add(Span.code("], " + level + "), "));
            }
            out.addAll(literalEncoder.encodeText(item.target(), run));
            out.add(Span.code(")"));
        }
        return out;
    }

    /**
     * Parse "a.b as c, d" style lists. Null if the tokens do not have that shape.
     */
    private static List<ImportItem> parseItems(List<PythonToken> tokens) {
        List<ImportItem> items = new ArrayList<>();
        StringBuilder target = new StringBuilder();
        String alias = null;
        boolean expectAlias = false;
        for (int i = 0; i <= tokens.size(); i++) {
            PythonToken token = i < tokens.size() ? tokens.get(i) : null;
            if (token == null || token.is(",")) {
                if (target.length() > 0) {
                    items.add(new ImportItem(target.toString(), alias));
                } else if (token != null) {
                    return null;
                }
                target.setLength(0);
                alias = null;
                expectAlias = false;
            } else if (token.isName("as")) {
                expectAlias = true;
            } else if (expectAlias && token.type() == PythonToken.Type.NAME) {
                alias = token.text();
            } else if (token.type() == PythonToken.Type.NAME || token.is(".")) {
                target.append(token.text());
            } else {
                return null;
            }
        }
        return items;
    }

    private static void separate(List<Span> out) {
        if (!out.isEmpty()) {
            out.add(Span.code("; "));
        }
    }

    private static List<PythonToken> firstStatement(List<PythonToken> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).is(";")) {
                return tokens.subList(0, i);
            }
        }
        return tokens;
    }

    private static boolean containsNonCode(SourceStructure structure, LogicalLine line, PythonToken first, PythonToken last) {
        for (int i = line.firstTokenIndex(); i <= line.lastTokenIndex(); i++) {
            PythonToken token = structure.tokens().get(i);
            if (token.start().compareTo(first.start()) < 0) {
                continue;
            }
            if (token.start().compareTo(last.start()) > 0) {
                break;
            }
            if (structure.spans().get(token.spanIndex()).kind() != SpanKind.CODE) {
                return true;
            }
        }
        return false;
    }
}
