package splay;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Self-adjusting binary search tree (Sleator and Tarjan, 1985).
 *
 * Every access (search, insert, remove) splays the accessed key, or the last
 * node reached when the key is absent, to the root through zig, zig-zig and
 * zig-zag rotations. Amortized O(log n) per operation, worst case O(n).
 *
 * Splay and traversal keep their path on an explicit stack, so a degenerate
 * linear tree never exhausts the thread stack.
 *
 * Not thread-safe: callers sharing a tree must serialize access themselves.
 *
 * @param <K> key type, totally ordered by its natural ordering
 * @param <V> value type
 */
public class SplayTree<K extends Comparable<? super K>, V> {
    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------

    /**
     * One stored key-value pair. Exposed read-only so callers can walk the
     * current shape of the tree; links only change through the owning tree.
     */
    public static final class Node<E extends Comparable<? super E>, V> {
        final E key;
        V value;
        Node<E,V> left;
        Node<E,V> right;

        Node(final E key, final V value) {
            this.key = key;
            this.value = value;
        }

        public E getKey() { return key; }
        public V getValue() { return value; }
        public Node<E,V> getLeft() { return left; }
        public Node<E,V> getRight() { return right; }
        public boolean hasLeft() { return left != null; }
        public boolean hasRight() { return right != null; }

        @Override
        public String toString() {
            return key + "=" + value;
        }
    }

    // Two-level step taken on the way down; replayed bottom-up by splay().
    // The side names where the target lies relative to the frame's node.
    private enum Step {
        ZIG_LEFT, ZIG_ZIG_LEFT, ZIG_ZAG_LEFT,
        ZIG_RIGHT, ZIG_ZIG_RIGHT, ZIG_ZAG_RIGHT
    }

    private Node<K,V> root;
    private int size;

    public SplayTree() {
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - search / get       : splaying lookup
// - insert / putIfAbsent
// - remove
// - contains           : non-splaying lookup
// - min / max / inOrder
//--------------------------------------------------------------------------------

    public final int size() { return size; }
    public final boolean isEmpty() { return root == null; }

    /** Current root, or null for an empty tree. */
    public final Node<K,V> getRoot() { return root; }

    public final void clear() {
        root = null;
        size = 0;
    }

    /**
     * Splays {@code key} to the root. If the key is absent the last node on
     * its search path becomes the root instead.
     *
     * @throws IllegalStateException if the tree is empty
     */
    public final void splay(final K key) {
        Objects.requireNonNull(key, "key");
        if (root == null) throw new IllegalStateException("cannot splay an empty tree");
        root = splay(root, key);
    }

    /**
     * Returns the node holding {@code key}, or null. Reshapes the tree even on
     * a miss: the closest node on the search path is left at the root.
     */
    public final Node<K,V> search(final K key) {
        Objects.requireNonNull(key, "key");
        if (root == null) return null;
        root = splay(root, key);
        return key.compareTo(root.key) == 0 ? root : null;
    }

    /** Value lookup with the same splaying side effect as {@link #search}. */
    public final V get(final K key) {
        final Node<K,V> n = search(key);
        return n == null ? null : n.value;
    }

    /**
     * Inserts or overwrites the mapping for {@code key}; the key ends up at the
     * root either way.
     *
     * @return the previous value, or null if the key was absent
     */
    public final V insert(final K key, final V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (root == null) {
            root = new Node<>(key, value);
            size++;
            return null;
        }
        root = splay(root, key);
        if (key.compareTo(root.key) == 0) {
            final V old = root.value;
            root.value = value;
            return old;
        }
        link(new Node<>(key, value));
        return null;
    }

    /**
     * Inserts only if {@code key} is absent; an existing value is kept.
     *
     * @return the existing value, or null if the mapping was added
     */
    public final V putIfAbsent(final K key, final V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (root == null) {
            root = new Node<>(key, value);
            size++;
            return null;
        }
        root = splay(root, key);
        if (key.compareTo(root.key) == 0) return root.value;
        link(new Node<>(key, value));
        return null;
    }

    /**
     * Removes {@code key} by splitting the tree at the splayed root and joining
     * the two halves. The new root is the maximum of the left half, or the
     * right child when there is no left half.
     *
     * @return the removed value, or null if the key was absent
     */
    public final V remove(final K key) {
        Objects.requireNonNull(key, "key");
        if (root == null) return null;
        root = splay(root, key);
        if (key.compareTo(root.key) != 0) return null;

        final Node<K,V> removed = root;
        if (removed.left == null) {
            root = removed.right;
        } else {
            final Node<K,V> r = removed.right;
            // every key on the left is smaller, so this lands the left max at the
            // root with an empty right slot
            root = splay(removed.left, key);
            root.right = r;
        }
        removed.left = null;
        removed.right = null;
        size--;
        return removed.value;
    }

    /** Existence check that leaves the tree shape untouched. */
    public final boolean contains(final K key) {
        Objects.requireNonNull(key, "key");
        Node<K,V> n = root;
        while (n != null) {
            final int c = key.compareTo(n.key);
            if (c == 0) return true;
            n = (c < 0) ? n.left : n.right;
        }
        return false;
    }

    public final Node<K,V> min() {
        return min(root);
    }

    /**
     * Leftmost node below {@code from}, or below the root when {@code from} is
     * null. Does not splay.
     */
    public final Node<K,V> min(final Node<K,V> from) {
        Node<K,V> n = (from != null) ? from : root;
        if (n == null) return null;
        while (n.left != null) n = n.left;
        return n;
    }

    public final Node<K,V> max() {
        return max(root);
    }

    /** Mirror of {@link #min(Node)}. */
    public final Node<K,V> max(final Node<K,V> from) {
        Node<K,V> n = (from != null) ? from : root;
        if (n == null) return null;
        while (n.right != null) n = n.right;
        return n;
    }

    /** Nodes in ascending key order, collected from the current shape. */
    public final List<Node<K,V>> inOrder() {
        final List<Node<K,V>> out = new ArrayList<>(size);
        inOrder(root, out::add);
        return out;
    }

    public final void inOrder(final Consumer<? super Node<K,V>> action) {
        inOrder(root, action);
    }

    /** Visits the subtree under {@code from} in ascending key order; null visits nothing. */
    public final void inOrder(final Node<K,V> from, final Consumer<? super Node<K,V>> action) {
        Objects.requireNonNull(action, "action");
        final ArrayDeque<Node<K,V>> stack = new ArrayDeque<>();
        Node<K,V> n = from;
        while (n != null || !stack.isEmpty()) {
            while (n != null) {
                stack.push(n);
                n = n.left;
            }
            n = stack.pop();
            action.accept(n);
            n = n.right;
        }
    }

    //--------------------------------------------------------------------------------
    // SPLAY AND ROTATIONS
    //--------------------------------------------------------------------------------

    // Makes n the new root; root has already been splayed around n.key.
    private void link(final Node<K,V> n) {
        if (n.key.compareTo(root.key) < 0) {
            n.left = root.left;
            n.right = root;
            root.left = null;
        } else {
            n.right = root.right;
            n.left = root;
            root.right = null;
        }
        root = n;
        size++;
    }

    /**
     * Splays the subtree rooted at {@code n} around {@code key} and returns its
     * new root.
     *
     * The descent consumes two levels per frame, recording a zig-zig, zig-zag
     * or a final zig for each. Frames are then replayed deepest first, each
     * taking the already-splayed grandchild subtree and lifting it two levels.
     */
    static <K extends Comparable<? super K>, V> Node<K,V> splay(Node<K,V> n, final K key) {
        final ArrayDeque<Node<K,V>> path = new ArrayDeque<>();
        final ArrayDeque<Step> steps = new ArrayDeque<>();
        Node<K,V> sub = null;

        while (n != null) {
            final int c = key.compareTo(n.key);
            if (c < 0) {
                if (n.left == null) { sub = n; break; }
                final int cl = key.compareTo(n.left.key);
                path.push(n);
                if (cl < 0) {
                    steps.push(Step.ZIG_ZIG_LEFT);
                    n = n.left.left;
                } else if (cl > 0) {
                    steps.push(Step.ZIG_ZAG_LEFT);
                    n = n.left.right;
                } else {
                    steps.push(Step.ZIG_LEFT);
                    break;
                }
            } else if (c > 0) {
                if (n.right == null) { sub = n; break; }
                final int cr = key.compareTo(n.right.key);
                path.push(n);
                if (cr > 0) {
                    steps.push(Step.ZIG_ZIG_RIGHT);
                    n = n.right.right;
                } else if (cr < 0) {
                    steps.push(Step.ZIG_ZAG_RIGHT);
                    n = n.right.left;
                } else {
                    steps.push(Step.ZIG_RIGHT);
                    break;
                }
            } else {
                sub = n;
                break;
            }
        }

        while (!path.isEmpty()) {
            Node<K,V> p = path.pop();
            switch (steps.pop()) {
                case ZIG_ZIG_LEFT:
                    p.left.left = sub;
                    p = rotateRight(p);
                    sub = (p.left == null) ? p : rotateRight(p);
                    break;
                case ZIG_ZAG_LEFT:
                    p.left.right = sub;
                    if (p.left.right != null) p.left = rotateLeft(p.left);
                    sub = rotateRight(p);
                    break;
                case ZIG_LEFT:
                    sub = rotateRight(p);
                    break;
                case ZIG_ZIG_RIGHT:
                    p.right.right = sub;
                    p = rotateLeft(p);
                    sub = (p.right == null) ? p : rotateLeft(p);
                    break;
                case ZIG_ZAG_RIGHT:
                    p.right.left = sub;
                    if (p.right.left != null) p.right = rotateRight(p.right);
                    sub = rotateLeft(p);
                    break;
                case ZIG_RIGHT:
                    sub = rotateLeft(p);
                    break;
                default:
                    throw new AssertionError();
            }
        }
        return sub;
    }

    /** Lifts the left child of {@code n} above it. Requires a left child. */
    static <K extends Comparable<? super K>, V> Node<K,V> rotateRight(final Node<K,V> n) {
        final Node<K,V> l = n.left;
        if (l == null) throw new IllegalStateException("rotateRight needs a left child: " + n.key);
        n.left = l.right;
        l.right = n;
        return l;
    }

    /** Lifts the right child of {@code n} above it. Requires a right child. */
    static <K extends Comparable<? super K>, V> Node<K,V> rotateLeft(final Node<K,V> n) {
        final Node<K,V> r = n.right;
        if (r == null) throw new IllegalStateException("rotateLeft needs a right child: " + n.key);
        n.right = r.left;
        r.left = n;
        return r;
    }

    /**
     *
     * DEBUG CODE (FOR TESTBED)
     *
     */

    public int sizeStructural() {
        final int[] count = {0};
        inOrder(root, n -> count[0]++);
        return count[0];
    }

    /** Number of nodes on the longest root-to-leaf path; 0 for an empty tree. */
    public int height() {
        if (root == null) return 0;
        final ArrayDeque<Node<K,V>> level = new ArrayDeque<>();
        level.add(root);
        int h = 0;
        while (!level.isEmpty()) {
            h++;
            for (int i = level.size(); i > 0; i--) {
                final Node<K,V> n = level.poll();
                if (n.left != null) level.add(n.left);
                if (n.right != null) level.add(n.right);
            }
        }
        return h;
    }

    /**
     * True when keys are strictly ascending in order, every node is reachable
     * through exactly one parent slot, and the node count matches size().
     */
    public boolean isWellFormed() {
        final Map<Node<K,V>, Boolean> seen = new IdentityHashMap<>();
        final ArrayDeque<Node<K,V>> stack = new ArrayDeque<>();
        Node<K,V> prev = null;
        Node<K,V> n = root;
        while (n != null || !stack.isEmpty()) {
            while (n != null) {
                if (seen.put(n, Boolean.TRUE) != null) return false;
                stack.push(n);
                n = n.left;
            }
            n = stack.pop();
            if (prev != null && prev.key.compareTo(n.key) >= 0) return false;
            prev = n;
            n = n.right;
        }
        return seen.size() == size;
    }
}
