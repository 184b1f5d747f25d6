package org.templatize.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An operand of a concatenation chain that is not itself a concatenation.
 */
public sealed interface Leaf<N> {

    /**
     * A string literal operand. {@code text} holds the semantic value; {@code sourceNodes} are the
     * literal nodes it was built from, more than one after merging.
     */
    record LiteralLeaf<N>(String text, LiteralStyle style, List<N> sourceNodes) implements Leaf<N> {

        public LiteralLeaf {
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(style, "style");
            sourceNodes = List.copyOf(sourceNodes);
        }

        public static <N> LiteralLeaf<N> of(LiteralValue value, N sourceNode) {
            return new LiteralLeaf<>(value.value(), value.style(), List.of(sourceNode));
        }

        public boolean isMergeableWith(LiteralLeaf<N> other) {
            return style == LiteralStyle.REGULAR && other.style == LiteralStyle.REGULAR;
        }

        /**
         * Value-level concatenation of two regular literals.
         */
        public LiteralLeaf<N> concat(LiteralLeaf<N> next) {
            List<N> sources = new ArrayList<>(sourceNodes.size() + next.sourceNodes.size());
            sources.addAll(sourceNodes);
            sources.addAll(next.sourceNodes);
            return new LiteralLeaf<>(text + next.text, LiteralStyle.REGULAR, sources);
        }
    }

    /**
     * Any other operand, embedded whole behind a placeholder.
     */
    record OpaqueLeaf<N>(N node) implements Leaf<N> {

        public OpaqueLeaf {
            Objects.requireNonNull(node, "node");
        }
    }
}
