package com.codeveil.infrastructure.obfuscation.technique;

import com.codeveil.domain.obfuscation.model.Span;
import com.codeveil.domain.obfuscation.model.SpanKind;
import com.codeveil.infrastructure.obfuscation.scanner.SourceStructure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class NumericSubstitutionTechnique implements ObfuscationTechnique {

    public static final String NAME = "numeric_substitution";

    private final LiteralEncoder literalEncoder;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Span> apply(List<Span> spans, TechniqueRun run) {
        SourceStructure structure = SourceStructure.of(spans);
        Set<String> rebound = BuiltinShadowing.reboundAmong(structure, Set.of("int", "float"));
        SpanRewriter rewriter = new SpanRewriter(spans);
        int substituted = 0;

        for (int i = 0; i < spans.size(); i++) {
            Span span = spans.get(i);
            if (span.kind() != SpanKind.NUMERIC_LITERAL || !literalEncoder.isRewritable(structure, i)) {
                continue;
            }
            Optional<List<Span>> replacement = literalEncoder.encodeNumericLiteral(span.text(), run, rebound);
            if (replacement.isPresent()) {
                rewriter.replaceSpan(i, replacement.get());
                substituted++;
            }
        }

        log.debug("[NumericSubstitution] substituted={}", substituted);
        run.info(NAME, "Substituted " + substituted + " numeric literal(s)");
        return rewriter.apply();
    }
}
