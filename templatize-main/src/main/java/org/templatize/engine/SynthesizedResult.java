package org.templatize.engine;

import org.templatize.EngineInvariantException;
import org.templatize.syntax.TemplateSyntax;

import java.util.List;
import java.util.Objects;

/**
 * The description of the replacement template string: ordered segments plus the syntax they
 * were escaped for. Immutable.
 */
public final class SynthesizedResult<N> {

    private final List<Segment<N>> segments;
    private final TemplateSyntax syntax;

    public SynthesizedResult(List<Segment<N>> segments, TemplateSyntax syntax) {
        if (segments == null || segments.isEmpty()) {
            throw new EngineInvariantException("Synthesized result must contain at least one segment");
        }
        this.segments = List.copyOf(segments);
        this.syntax = Objects.requireNonNull(syntax, "syntax");
    }

    public List<Segment<N>> getSegments() {
        return segments;
    }

    public TemplateSyntax getSyntax() {
        return syntax;
    }

    public long placeholderCount() {
        return segments.stream().filter(Segment.PlaceholderSegment.class::isInstance).count();
    }

    public long textCount() {
        return segments.stream().filter(Segment.TextSegment.class::isInstance).count();
    }

    /**
     * The template expression as source text, ready to replace the original chain.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(syntax.open());
        for (Segment<N> segment : segments) {
            if (segment instanceof Segment.TextSegment<N> text) {
                sb.append(text.text());
            } else if (segment instanceof Segment.PlaceholderSegment<N> placeholder) {
                sb.append(syntax.placeholderOpen())
                  .append(placeholder.expression())
                  .append(syntax.placeholderClose());
            }
        }
        return sb.append(syntax.close()).toString();
    }

    @Override
    public String toString() {
        return "SynthesizedResult{" +
               "syntax=" + syntax.name() +
               ", segments=" + segments +
               '}';
    }
}
