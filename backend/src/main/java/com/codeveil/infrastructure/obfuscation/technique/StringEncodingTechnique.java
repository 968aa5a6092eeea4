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
public class StringEncodingTechnique implements ObfuscationTechnique {

    public static final String NAME = "string_encoding";

    private final LiteralEncoder literalEncoder;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Span> apply(List<Span> spans, TechniqueRun run) {
        SourceStructure structure = SourceStructure.of(spans);
        Set<String> rebound = BuiltinShadowing.reboundAmong(structure, literalEncoder.textBuiltins(run));
        if (!rebound.isEmpty()) {
            run.warn(NAME, "Skipped: the source rebinds " + String.join(", ", rebound));
            return spans;
        }
        SpanRewriter rewriter = new SpanRewriter(spans);
        int encoded = 0;
        int skipped = 0;

        for (int i = 0; i < spans.size(); i++) {
            Span span = spans.get(i);
            if (span.kind() != SpanKind.STRING_LITERAL) {
                continue;
            }
            if (!literalEncoder.isRewritable(structure, i)) {
                skipped++;
                continue;
            }
            Optional<List<Span>> replacement = literalEncoder.encodeStringLiteral(span.text(), run);
            if (replacement.isPresent()) {
                rewriter.replaceSpan(i, replacement.get());
                encoded++;
            } else {
                skipped++;
            }
        }

        log.debug("[StringEncoding] encoded={}, skipped={}", encoded, skipped);
        run.info(NAME, "Encoded " + encoded + " string literal(s), left " + skipped + " unchanged");
        return literalEncoder.installHelpers(rewriter.apply(), run);
    }
}
