package org.templatize.engine;

import org.junit.jupiter.api.Test;
import org.templatize.EngineInvariantException;
import org.templatize.OperationCanceledException;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainFlattenerTest {

    private final FakeTree tree = new FakeTree();
    private final ChainFlattener<FakeTree.Node, String> flattener =
            new ChainFlattener<>(new NodeClassifier<>(FakeTree.SYNTAX, FakeTree.TYPES), 4);

    @Test
    void flatten_keepsSourceOrder() {
        FakeTree.Node x = tree.name("x", FakeTree.STRING);
        FakeTree.Node root = tree.chain(tree.str("a"), x, tree.str("b"));

        LeafSequence<FakeTree.Node> leaves = flattener.flatten(root);

        assertThat(leaves.size()).isEqualTo(3);
        assertThat(leaves.get(0)).isInstanceOf(Leaf.LiteralLeaf.class);
        assertThat(((Leaf.LiteralLeaf<FakeTree.Node>) leaves.get(0)).text()).isEqualTo("a");
        assertThat(leaves.get(1)).isEqualTo(new Leaf.OpaqueLeaf<>(x));
        assertThat(((Leaf.LiteralLeaf<FakeTree.Node>) leaves.get(2)).text()).isEqualTo("b");
    }

    @Test
    void flatten_inlinesRightNestedConcatenation() {
        // "a" + (x + "b") without parentheses in the tree: a right-nested string "+"
        FakeTree.Node x = tree.name("x", FakeTree.STRING);
        FakeTree.Node root = tree.add(tree.str("a"), tree.add(x, tree.str("b")));

        assertThat(texts(flattener.flatten(root))).containsExactly("\"a\"", "x", "\"b\"");
    }

    @Test
    void flatten_keepsNumericAdditionWhole() {
        FakeTree.Node sum = tree.add(tree.name("x", FakeTree.INT), tree.name("y", FakeTree.INT));
        FakeTree.Node root = tree.chain(sum, tree.str("a"));

        LeafSequence<FakeTree.Node> leaves = flattener.flatten(root);

        assertThat(leaves.getLeaves()).containsExactly(
                new Leaf.OpaqueLeaf<>(sum),
                new Leaf.LiteralLeaf<>("a", LiteralStyle.REGULAR, List.of(root.right)));
    }

    @Test
    void flatten_rejectsNonConcatRoot() {
        assertThatThrownBy(() -> flattener.flatten(tree.name("x", FakeTree.STRING)))
                .isInstanceOf(EngineInvariantException.class);
    }

    @Test
    void climb_reachesTopOfChainFromMiddleOperator() {
        FakeTree.Node first = tree.add(tree.str("a"), tree.name("x", FakeTree.STRING));
        FakeTree.Node root = tree.add(first, tree.str("b"));

        assertThat(flattener.climbToChainRoot(first)).isSameAs(root);
        assertThat(flattener.flatten(flattener.climbToChainRoot(first)).size()).isEqualTo(3);
    }

    @Test
    void climb_stopsAtNonStringAncestor() {
        // (x + "a") is a string, but its parenthesized parent is not a "+"
        FakeTree.Node inner = tree.add(tree.name("x", FakeTree.STRING), tree.str("a"));
        FakeTree.Node paren = tree.paren(inner);
        tree.add(paren, tree.str("b"));

        assertThat(flattener.climbToChainRoot(inner)).isSameAs(inner);
    }

    @Test
    void climb_stopsAtNumericPlus() {
        FakeTree.Node x = tree.name("x", FakeTree.INT);
        FakeTree.Node sum = tree.add(x, tree.name("y", FakeTree.INT));

        assertThat(flattener.climbToChainRoot(x)).isSameAs(x);
        assertThat(flattener.climbToChainRoot(sum)).isSameAs(sum);
    }

    @Test
    void flatten_handlesVeryLongChains() {
        FakeTree.Node root = tree.str("start");
        for (int i = 0; i < 50_000; i++) {
            root = tree.add(root, tree.name("v" + i, FakeTree.STRING));
        }

        LeafSequence<FakeTree.Node> leaves = flattener.flatten(root);

        assertThat(leaves.size()).isEqualTo(50_001);
        assertThat(leaves.get(50_000)).isInstanceOf(Leaf.OpaqueLeaf.class);
    }

    @Test
    void flatten_checksCancellationPeriodically() {
        FakeTree.Node root = tree.str("start");
        for (int i = 0; i < 100; i++) {
            root = tree.add(root, tree.name("v" + i, FakeTree.STRING));
        }
        AtomicInteger polls = new AtomicInteger();
        CancellationSignal cancelOnThirdPoll = () -> polls.incrementAndGet() >= 3;
        FakeTree.Node chain = root;

        assertThatThrownBy(() -> flattener.flatten(chain, cancelOnThirdPoll))
                .isInstanceOf(OperationCanceledException.class)
                .hasMessageContaining("flatten");
        assertThat(polls.get()).isEqualTo(3);
    }

    @Test
    void constructor_rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new ChainFlattener<>(new NodeClassifier<>(FakeTree.SYNTAX, FakeTree.TYPES), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<String> texts(LeafSequence<FakeTree.Node> leaves) {
        return leaves.getLeaves().stream()
                .map(leaf -> leaf instanceof Leaf.OpaqueLeaf<FakeTree.Node> opaque
                        ? opaque.node().text()
                        : ((Leaf.LiteralLeaf<FakeTree.Node>) leaf).sourceNodes().get(0).text())
                .toList();
    }
}
