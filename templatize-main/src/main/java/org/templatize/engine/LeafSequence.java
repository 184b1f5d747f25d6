package org.templatize.engine;

import org.templatize.EngineInvariantException;

import java.util.Iterator;
import java.util.List;

/**
 * Immutable, non-empty list of leaves in left-to-right source order.
 */
public final class LeafSequence<N> implements Iterable<Leaf<N>> {

    private final List<Leaf<N>> leaves;

    public LeafSequence(List<Leaf<N>> leaves) {
        if (leaves == null || leaves.isEmpty()) {
            throw new EngineInvariantException("Leaf sequence must not be empty");
        }
        this.leaves = List.copyOf(leaves);
    }

    public List<Leaf<N>> getLeaves() {
        return leaves;
    }

    public Leaf<N> get(int index) {
        return leaves.get(index);
    }

    public int size() {
        return leaves.size();
    }

    @Override
    public Iterator<Leaf<N>> iterator() {
        return leaves.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return leaves.equals(((LeafSequence<?>) o).leaves);
    }

    @Override
    public int hashCode() {
        return leaves.hashCode();
    }

    @Override
    public String toString() {
        return "LeafSequence" + leaves;
    }
}
