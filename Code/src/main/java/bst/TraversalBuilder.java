package bst;

import bst.BinarySearchTree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconstructs a tree from two of its depth-first walks, one of which must be in-order.
 * <p>
 * Elements need consistent {@code equals}/{@code hashCode}: the in-order sequence is indexed
 * by value. The shape follows from index arithmetic alone, so sequences that do not describe
 * a real search tree produce an inconsistent tree; callers check their input.
 */
final class TraversalBuilder<T extends Comparable<? super T>> {
    private static final Logger log = LoggerFactory.getLogger(TraversalBuilder.class);

    private final List<? extends T> walk;
    private final Map<T, Integer> inorderIndex;
    private int cursor;

    private TraversalBuilder(final List<? extends T> walk, final List<? extends T> inorder, final int cursor) {
        this.walk = walk;
        this.inorderIndex = new HashMap<>(inorder.size() * 2);
        for (int i = 0; i < inorder.size(); i++) {
            inorderIndex.put(inorder.get(i), i);
        }
        this.cursor = cursor;
    }

    static <T extends Comparable<? super T>> BinarySearchTree<T> preorderInorder(final List<? extends T> preorder,
                                                                               final List<? extends T> inorder) {
        final BinarySearchTree<T> tree = new BinarySearchTree<>();
        if (!usable(preorder, inorder)) return tree;

        final TraversalBuilder<T> builder = new TraversalBuilder<>(preorder, inorder, 0);
        tree.adopt(builder.fromPreorder(0, inorder.size() - 1), preorder.size());
        return tree;
    }

    static <T extends Comparable<? super T>> BinarySearchTree<T> inorderPostorder(final List<? extends T> inorder,
                                                                                final List<? extends T> postorder) {
        final BinarySearchTree<T> tree = new BinarySearchTree<>();
        if (!usable(postorder, inorder)) return tree;

        final TraversalBuilder<T> builder = new TraversalBuilder<>(postorder, inorder, postorder.size() - 1);
        tree.adopt(builder.fromPostorder(0, inorder.size() - 1), postorder.size());
        return tree;
    }

    private static boolean usable(final List<?> walk, final List<?> inorder) {
        if (walk.isEmpty() || walk.size() != inorder.size()) {
            log.debug("Ignoring traversal pair of sizes {} and {}, building an empty tree", walk.size(), inorder.size());
            return false;
        }
        return true;
    }

    // pending subtree: in-order range [from, to] hanging off parent on the given side
    private static final class Frame<T> {
        final int from;
        final int to;
        final Node<T> parent;
        final boolean onLeft;

        Frame(final int from, final int to, final Node<T> parent, final boolean onLeft) {
            this.from = from;
            this.to = to;
            this.parent = parent;
            this.onLeft = onLeft;
        }
    }

    // pre-order is consumed left to right: root, then the left range, then the right range.
    // Iterative so linear-height trees do not overflow the stack.
    private Node<T> fromPreorder(final int from, final int to) {
        Node<T> root = null;
        final ArrayDeque<Frame<T>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(from, to, null, false));
        while (!stack.isEmpty()) {
            final Frame<T> f = stack.pop();
            if (f.from > f.to) continue;

            final Node<T> node = attach(walk.get(cursor++), f);
            if (f.parent == null) root = node;
            final int split = indexOf(node.value);

            // left is popped first
            stack.push(new Frame<>(split + 1, f.to, node, false));
            stack.push(new Frame<>(f.from, split - 1, node, true));
        }
        return root;
    }

    // post-order is consumed right to left, so the right range is rebuilt first
    private Node<T> fromPostorder(final int from, final int to) {
        Node<T> root = null;
        final ArrayDeque<Frame<T>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(from, to, null, false));
        while (!stack.isEmpty()) {
            final Frame<T> f = stack.pop();
            if (f.from > f.to) continue;

            final Node<T> node = attach(walk.get(cursor--), f);
            if (f.parent == null) root = node;
            final int split = indexOf(node.value);

            stack.push(new Frame<>(f.from, split - 1, node, true));
            stack.push(new Frame<>(split + 1, f.to, node, false));
        }
        return root;
    }

    private static <T> Node<T> attach(final T value, final Frame<T> f) {
        final Node<T> node = new Node<>(value, f.parent);
        if (f.parent != null) {
            if (f.onLeft) f.parent.left = node;
            else f.parent.right = node;
        }
        return node;
    }

    private int indexOf(final T value) {
        if (value == null) throw new NullPointerException("traversal element");
        final Integer index = inorderIndex.get(value);
        if (index == null) {
            throw new IllegalArgumentException("Element " + value + " does not occur in the in-order sequence");
        }
        return index;
    }
}
