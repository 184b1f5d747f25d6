package org.templatize.engine;

import java.util.Objects;

/**
 * One piece of a synthesized template string.
 */
public sealed interface Segment<N> {

    /**
     * Literal text, already escaped for the target template syntax.
     */
    record TextSegment<N>(String text) implements Segment<N> {

        public TextSegment {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * An embedded expression. {@code expression} is the node's source text, parenthesized when needed.
     */
    record PlaceholderSegment<N>(N node, String expression) implements Segment<N> {

        public PlaceholderSegment {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(expression, "expression");
        }
    }
}
