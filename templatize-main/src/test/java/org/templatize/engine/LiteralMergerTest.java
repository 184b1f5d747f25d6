package org.templatize.engine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class LiteralMergerTest {

    private final FakeTree tree = new FakeTree();
    private final ChainFlattener<FakeTree.Node, String> flattener =
            new ChainFlattener<>(new NodeClassifier<>(FakeTree.SYNTAX, FakeTree.TYPES), 64);
    private final LiteralMerger<FakeTree.Node> merger = new LiteralMerger<>();

    @Test
    void adjacentRegularLiterals_mergeByValue() {
        FakeTree.Node a = tree.str("a\n");
        FakeTree.Node b = tree.str("{b}");

        LeafSequence<FakeTree.Node> merged = merger.merge(flattener.flatten(tree.chain(a, b)));

        assertThat(merged.getLeaves()).containsExactly(
                new Leaf.LiteralLeaf<>("a\n{b}", LiteralStyle.REGULAR, List.of(a, b)));
    }

    @Test
    void rawLiteral_neverMerges() {
        FakeTree.Node a = tree.str("a");
        FakeTree.Node b = tree.raw("b");
        FakeTree.Node c = tree.str("c");

        LeafSequence<FakeTree.Node> merged = merger.merge(flattener.flatten(tree.chain(a, b, c)));

        assertThat(merged.getLeaves()).containsExactly(
                new Leaf.LiteralLeaf<>("a", LiteralStyle.REGULAR, List.of(a)),
                new Leaf.LiteralLeaf<>("b", LiteralStyle.RAW, List.of(b)),
                new Leaf.LiteralLeaf<>("c", LiteralStyle.REGULAR, List.of(c)));
    }

    @Test
    void twoRawLiterals_stayApart() {
        LeafSequence<FakeTree.Node> merged = merger.merge(flattener.flatten(tree.chain(tree.raw("a"), tree.raw("b"))));

        assertThat(merged.size()).isEqualTo(2);
    }

    @Test
    void opaqueLeaf_breaksRun() {
        FakeTree.Node x = tree.name("x", FakeTree.STRING);
        LeafSequence<FakeTree.Node> merged = merger.merge(flattener.flatten(
                tree.chain(tree.str("a"), tree.str("b"), x, tree.str("c"), tree.str("d"), tree.str("e"))));

        assertThat(merged.size()).isEqualTo(3);
        assertThat(((Leaf.LiteralLeaf<FakeTree.Node>) merged.get(0)).text()).isEqualTo("ab");
        assertThat(merged.get(1)).isEqualTo(new Leaf.OpaqueLeaf<>(x));
        assertThat(((Leaf.LiteralLeaf<FakeTree.Node>) merged.get(2)).text()).isEqualTo("cde");
    }

    @Test
    void merge_isIdempotentAndMaximal_onRandomChains() {
        Random random = new Random(7);
        for (int round = 0; round < 200; round++) {
            FakeTree.Node root = randomOperand(random, round);
            int length = 2 + random.nextInt(12);
            for (int i = 1; i < length; i++) {
                root = tree.add(root, randomOperand(random, i));
            }
            if (!FakeTree.TYPES.hasStringType(root)) {
                continue;
            }

            LeafSequence<FakeTree.Node> flat = flattener.flatten(root);
            LeafSequence<FakeTree.Node> once = merger.merge(flat);
            LeafSequence<FakeTree.Node> twice = merger.merge(once);

            assertThat(twice).isEqualTo(once);
            assertThat(once.size()).isLessThanOrEqualTo(flat.size());
            assertNoAdjacentRegularLiterals(once);
            assertThat(sourceOrder(flat)).isSorted();
            assertThat(sourceOrder(once)).isEqualTo(sourceOrder(flat));
        }
    }

    private FakeTree.Node randomOperand(Random random, int i) {
        return switch (random.nextInt(3)) {
            case 0 -> tree.str("s" + i);
            case 1 -> tree.raw("r" + i);
            default -> tree.name("v" + i, FakeTree.STRING);
        };
    }

    private static void assertNoAdjacentRegularLiterals(LeafSequence<FakeTree.Node> leaves) {
        for (int i = 1; i < leaves.size(); i++) {
            if (leaves.get(i - 1) instanceof Leaf.LiteralLeaf<FakeTree.Node> previous
                    && leaves.get(i) instanceof Leaf.LiteralLeaf<FakeTree.Node> current) {
                assertThat(previous.isMergeableWith(current))
                        .as("leaves %d and %d are both regular literals", i - 1, i)
                        .isFalse();
            }
        }
    }

    private static List<Integer> sourceOrder(LeafSequence<FakeTree.Node> leaves) {
        List<Integer> ids = new ArrayList<>();
        for (Leaf<FakeTree.Node> leaf : leaves) {
            if (leaf instanceof Leaf.OpaqueLeaf<FakeTree.Node> opaque) {
                ids.add(opaque.node().id);
            } else {
                ((Leaf.LiteralLeaf<FakeTree.Node>) leaf).sourceNodes().forEach(node -> ids.add(node.id));
            }
        }
        return ids;
    }
}
