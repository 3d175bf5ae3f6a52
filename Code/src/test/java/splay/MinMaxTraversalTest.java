package splay;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

/**
 * Read-only queries: min, max, contains and in-order traversal never reshape the tree.
 */
class MinMaxTraversalTest {

    @Test
    void min_and_max_on_empty_tree_are_absent() {
        SplayTree<Integer,String> t = new SplayTree<>();
        assertNull(t.min());
        assertNull(t.max());
        assertNull(t.min(null));
        assertNull(t.max(null));
        assertFalse(t.contains(1));
        assertTrue(t.inOrder().isEmpty());
    }

    @Test
    void min_and_max_find_extremes_without_moving_root() {
        SplayTree<Integer,String> t = new SplayTree<>();
        int[] keys = {50, 25, 75, 10, 30, 60, 80, 5, 15, 27, 35};
        for (int k : keys) t.insert(k, "v" + k);
        t.search(30);

        SplayTree.Node<Integer,String> root = t.getRoot();
        int height = t.height();

        assertEquals(5, t.min().getKey());
        assertEquals(80, t.max().getKey());
        assertSame(root, t.getRoot(), "min/max must not splay");
        assertEquals(height, t.height());
    }

    @Test
    void min_and_max_of_supplied_subtree() {
        SplayTree<Integer,String> t = new SplayTree<>();
        for (int k : new int[]{50, 25, 75, 10, 30, 60, 80}) t.insert(k, "v" + k);
        t.search(50);

        SplayTree.Node<Integer,String> root = t.getRoot();
        assertEquals(50, root.getKey());
        assertEquals(10, t.min(root.getLeft()).getKey());
        assertEquals(30, t.max(root.getLeft()).getKey());
        assertEquals(60, t.min(root.getRight()).getKey());
        assertEquals(80, t.max(root.getRight()).getKey());
    }

    @Test
    void contains_does_not_splay() {
        SplayTree<Integer,Integer> t = new SplayTree<>();
        for (int i = 0; i < 100; i++) t.insert(i, i);

        SplayTree.Node<Integer,Integer> root = t.getRoot();
        for (int i = -5; i < 105; i++) {
            assertEquals(i >= 0 && i < 100, t.contains(i), "contains " + i);
        }
        assertSame(root, t.getRoot());
        assertEquals(99, root.getKey());
    }

    @Test
    void inOrder_is_ascending_and_restartable() {
        SplayTree<Integer,Integer> t = new SplayTree<>();
        Random rnd = new Random(5);
        TreeSet<Integer> ref = new TreeSet<>();
        for (int i = 0; i < 300; i++) {
            int k = rnd.nextInt(1000);
            t.insert(k, k);
            ref.add(k);
        }

        List<Integer> first = keysOf(t.inOrder());
        assertEquals(new ArrayList<>(ref), first);

        // reshaping the tree must not change the sequence
        t.search(ref.first());
        t.search(ref.last());
        assertEquals(first, keysOf(t.inOrder()));
    }

    @Test
    void inOrder_visitor_walks_only_the_given_subtree() {
        SplayTree<Integer,Integer> t = new SplayTree<>();
        for (int k : new int[]{1, 2, 3, 4, 5, 6, 7}) t.insert(k, k * 10);
        t.search(4);

        SplayTree.Node<Integer,Integer> root = t.getRoot();
        List<Integer> left = new ArrayList<>();
        t.inOrder(root.getLeft(), n -> left.add(n.getValue()));
        assertEquals(Arrays.asList(10, 20, 30), left);

        List<Integer> none = new ArrayList<>();
        t.inOrder(null, n -> none.add(n.getKey()));
        assertTrue(none.isEmpty());
    }

    /* ---- helpers ---- */

    private static <V> List<Integer> keysOf(List<SplayTree.Node<Integer,V>> nodes) {
        List<Integer> keys = new ArrayList<>();
        for (SplayTree.Node<Integer,V> n : nodes) keys.add(n.getKey());
        return keys;
    }
}
