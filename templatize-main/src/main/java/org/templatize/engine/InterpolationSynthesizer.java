package org.templatize.engine;

import org.templatize.EngineInvariantException;
import org.templatize.syntax.TemplateSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps a leaf sequence onto template segments. Literal text is escaped as one unit per run, so
 * two literals that reach this stage side by side (a raw literal next to a regular one) still
 * produce a single text segment and escaping sees the joined text.
 */
public final class InterpolationSynthesizer<N> {

    private final SyntaxAdapter<N> syntax;
    private final TemplateSyntax templateSyntax;
    private final boolean parenthesizeAll;

    public InterpolationSynthesizer(SyntaxAdapter<N> syntax, TemplateSyntax templateSyntax, boolean parenthesizeAll) {
        this.syntax = Objects.requireNonNull(syntax, "syntax");
        this.templateSyntax = Objects.requireNonNull(templateSyntax, "templateSyntax");
        this.parenthesizeAll = parenthesizeAll;
    }

    public SynthesizedResult<N> synthesize(LeafSequence<N> leaves) {
        if (leaves == null || leaves.size() == 0) {
            throw new EngineInvariantException("Nothing to synthesize");
        }

        List<Segment<N>> segments = new ArrayList<>(leaves.size());
        StringBuilder text = null;
        for (Leaf<N> leaf : leaves) {
            if (leaf instanceof Leaf.LiteralLeaf<N> literal) {
                if (text == null) {
                    text = new StringBuilder();
                }
                text.append(literal.text());
            } else if (leaf instanceof Leaf.OpaqueLeaf<N> opaque) {
                if (text != null) {
                    segments.add(new Segment.TextSegment<>(templateSyntax.escapeText(text.toString())));
                    text = null;
                }
                segments.add(new Segment.PlaceholderSegment<>(opaque.node(), embeddedText(opaque.node())));
            }
        }
        if (text != null) {
            segments.add(new Segment.TextSegment<>(templateSyntax.escapeText(text.toString())));
        }
        return new SynthesizedResult<>(segments, templateSyntax);
    }

    String embeddedText(N node) {
        String source = syntax.sourceText(node);
        if (syntax.isParenthesized(node)) {
            return source;
        }
        if (!parenthesizeAll && syntax.isPrimary(node)) {
            return source;
        }
        return "(" + source + ")";
    }
}
