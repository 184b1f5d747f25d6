package org.templatize.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds runs of adjacent regular string literals into one literal, left to right.
 * Raw literals are never merged with a neighbour.
 */
public final class LiteralMerger<N> {

    private static final Logger LOG = LoggerFactory.getLogger(LiteralMerger.class);

    public LeafSequence<N> merge(LeafSequence<N> sequence) {
        List<Leaf<N>> merged = new ArrayList<>(sequence.size());
        Leaf.LiteralLeaf<N> accumulator = null;
        for (Leaf<N> leaf : sequence) {
            if (leaf instanceof Leaf.LiteralLeaf<N> literal) {
                if (accumulator != null && accumulator.isMergeableWith(literal)) {
                    accumulator = accumulator.concat(literal);
                    continue;
                }
                if (accumulator != null) {
                    merged.add(accumulator);
                }
                accumulator = literal;
                continue;
            }
            if (accumulator != null) {
                merged.add(accumulator);
                accumulator = null;
            }
            merged.add(leaf);
        }
        if (accumulator != null) {
            merged.add(accumulator);
        }

        if (merged.size() != sequence.size()) {
            LOG.debug("Merged {} leaves into {}", sequence.size(), merged.size());
        }
        return new LeafSequence<>(merged);
    }
}
