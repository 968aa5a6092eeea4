package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.infrastructure.obfuscation.scanner.BlockKind;
import com.codeveil.infrastructure.obfuscation.scanner.LogicalLine;
import com.codeveil.infrastructure.obfuscation.scanner.Position;
import com.codeveil.infrastructure.obfuscation.scanner.SourceStructure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Inserts statements with no observable effect after complete simple statements.
 * Inserted names are fresh and never read.
 */
@Slf4j
@Component
public class DeadCodeInjector implements ObfuscationTechnique {

    public static final String NAME = "dead_code_insertion";

    private static final List<String> FALSE_PREDICATES = List.of(
            "(7 * 6) != 42",
            "(10 % 3) == 0",
            "(5 + 5) < 9",
            "(2 ** 3) > 8"
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Span> apply(List<Span> spans, TechniqueRun run) {
        SourceStructure structure = SourceStructure.of(spans);
        double density = run.getConfig().deadCodeDensity();
        Random random = run.getRandom();
        Set<String> reserved = run.getDeclaredInsertions();
        String nl = structure.newlineStyle();
        SpanRewriter rewriter = new SpanRewriter(spans);
        int inserted = 0;

        List<LogicalLine> lines = structure.lines();
        for (int i = structure.prologueEnd(); i < lines.size(); i++) {
            LogicalLine line = lines.get(i);
            if (!isBoundary(line)) {
                continue;
            }
            Position at = line.newline().end();
            if (touchesReservedInsertion(spans, at, reserved)) {
                continue;
            }
            if (random.nextDouble() >= density) {
                continue;
            }
            String statement = statementFor(line.enclosingBlock(), random, run);
            rewriter.insert(at, List.of(Span.code(line.indent() + statement + nl).insertedBy(NAME)));
            inserted++;
        }

        log.debug("[DeadCodeInjector] inserted={}, density={}", inserted, density);
        run.info(NAME, "Inserted " + inserted + " dead statement(s)");
        return rewriter.apply();
    }

    /**
     * After a complete simple statement that is followed by a line break.
     */
    static boolean isBoundary(LogicalLine line) {
        return line.newline() != null
                && !line.isCompound()
                && !line.isDecorator()
                && !line.last().is(":");
    }

    private static boolean touchesReservedInsertion(List<Span> spans, Position at, Set<String> reserved) {
        if (reserved.isEmpty()) {
            return false;
        }
        Span before = spans.get(at.spanIndex());
        boolean atSpanEnd = at.offset() == before.length();
        Span after = atSpanEnd
                ? at.spanIndex() + 1 < spans.size() ? spans.get(at.spanIndex() + 1) : null
                : before;
        return before.insertedBy() != null && reserved.contains(before.insertedBy())
                || after != null && after.insertedBy() != null && reserved.contains(after.insertedBy());
    }

    private static String statementFor(BlockKind block, Random random, TechniqueRun run) {
        if (block == BlockKind.CLASS) {
            return "pass";
        }
        return switch (random.nextInt(4)) {
            case 0 -> run.getAllocator().allocate() + " = " + (1 + random.nextInt(50)) + " * "
                    + (1 + random.nextInt(50)) + " - " + random.nextInt(100);
            case 1 -> run.getAllocator().allocate() + " = None";
            case 2 -> "if " + FALSE_PREDICATES.get(random.nextInt(FALSE_PREDICATES.size())) + ": pass";
            default -> "pass";
        };
    }
}
