package org.templatize.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.templatize.EngineInvariantException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decomposes a string concatenation chain into its leaves in source order.
 * <p>
 * Every internal node is re-classified, so a "+" nested inside the chain whose result is not a
 * string (numeric addition) stops the descent and becomes a single opaque leaf. The walk keeps
 * its own stack rather than recursing, so left-associative chains of any length are safe.
 */
public final class ChainFlattener<N, T> {

    private static final Logger LOG = LoggerFactory.getLogger(ChainFlattener.class);

    private final NodeClassifier<N, T> classifier;
    private final SyntaxAdapter<N> syntax;
    private final int checkInterval;

    public ChainFlattener(NodeClassifier<N, T> classifier, int checkInterval) {
        if (checkInterval < 1) {
            throw new IllegalArgumentException("checkInterval must be positive: " + checkInterval);
        }
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.syntax = classifier.getSyntax();
        this.checkInterval = checkInterval;
    }

    /**
     * Walks up from {@code node} while the enclosing expression is itself a string concatenation.
     * Stops at the first ancestor that is not, even when it is syntactically a "+".
     */
    public N climbToChainRoot(N node) {
        N current = node;
        Optional<N> parent = syntax.parent(current);
        int steps = 0;
        while (parent.isPresent() && classifier.isConcat(parent.get())) {
            current = parent.get();
            parent = syntax.parent(current);
            steps++;
        }
        LOG.debug("Climbed {} level(s) to chain root {}", steps, syntax.span(current));
        return current;
    }

    public LeafSequence<N> flatten(N root) {
        return flatten(root, CancellationSignal.NONE);
    }

    public LeafSequence<N> flatten(N root, CancellationSignal cancellation) {
        if (!classifier.isConcat(root)) {
            throw new EngineInvariantException("Chain root is not a string concatenation: " + syntax.span(root));
        }

        List<Leaf<N>> leaves = new ArrayList<>();
        Deque<N> pending = new ArrayDeque<>();
        pending.push(root);
        int visited = 0;
        while (!pending.isEmpty()) {
            if (++visited % checkInterval == 0) {
                cancellation.throwIfCancellationRequested("flatten");
            }
            N node = pending.pop();
            Classification classification = classifier.classify(node);
            if (classification instanceof Classification.Literal literal) {
                leaves.add(Leaf.LiteralLeaf.of(literal.value(), node));
            } else if (classification.isConcat()) {
                // right first so the left operand is popped next
                pending.push(syntax.rightOperand(node));
                pending.push(syntax.leftOperand(node));
            } else {
                leaves.add(new Leaf.OpaqueLeaf<>(node));
            }
        }
        LOG.debug("Flattened chain {} into {} leaves after visiting {} nodes", syntax.span(root), leaves.size(), visited);
        return new LeafSequence<>(leaves);
    }
}
