package bst;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Unbalanced binary search tree holding unique elements in ascending order.
 * <p>
 * Not thread safe. Any structural mutation (insert, erase, clear) may invalidate
 * positions that reference the touched nodes or rely on the path through them.
 */
public class BinarySearchTree<T extends Comparable<? super T>> implements Iterable<T> {
    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------
    static final class Node<E> {
        E value;
        Node<E> left;
        Node<E> right;
        // lookup only, used for successor/predecessor walks
        Node<E> parent;

        Node(final E value, final Node<E> parent) {
            this.value = value;
            this.parent = parent;
        }
    }

    //--------------------------------------------------------------------------------
    // Class: Position, MutablePosition, InsertResult
    //--------------------------------------------------------------------------------

    /**
     * Read-only cursor over the in-order sequence. A position either references a node
     * or is the end sentinel; stepping back from the end lands on the maximum element.
     */
    public static class Position<E extends Comparable<? super E>> {
        Node<E> node;
        final BinarySearchTree<E> tree;

        Position(final Node<E> node, final BinarySearchTree<E> tree) {
            this.node = node;
            this.tree = tree;
        }

        public E get() {
            if (node == null) throw new NoSuchElementException("end position has no element");
            return node.value;
        }

        public boolean isEnd() {
            return node == null;
        }

        /** Moves to the in-order successor, or to the end when this was the maximum. */
        public Position<E> next() {
            if (node == null) throw new NoSuchElementException("cannot advance past end");
            node = successor(node);
            return this;
        }

        /** Moves to the in-order predecessor. From the end this is the maximum of the tree. */
        public Position<E> previous() {
            if (node == null) {
                node = maximum(tree.root);
            } else {
                node = predecessor(node);
            }
            return this;
        }

        public Position<E> copy() {
            return new Position<>(node, tree);
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (!(o instanceof Position)) return false;
            return node == ((Position<?>) o).node;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(node);
        }

        @Override
        public String toString() {
            return node == null ? "Position[end]" : "Position[" + node.value + "]";
        }
    }

    /** Position that can also remove the element it references from the tree. */
    public static final class MutablePosition<E extends Comparable<? super E>> extends Position<E> {

        MutablePosition(final Node<E> node, final BinarySearchTree<E> tree) {
            super(node, tree);
        }

        @Override
        public MutablePosition<E> next() {
            super.next();
            return this;
        }

        @Override
        public MutablePosition<E> previous() {
            super.previous();
            return this;
        }

        @Override
        public MutablePosition<E> copy() {
            return new MutablePosition<>(node, tree);
        }

        public Position<E> readOnly() {
            return new Position<>(node, tree);
        }

        /**
         * Erases the referenced element and returns the position now holding its successor.
         * This position must not be used afterwards.
         */
        public MutablePosition<E> remove() {
            if (node == null) throw new NoSuchElementException("end position has no element");
            return new MutablePosition<>(tree.eraseNode(node), tree);
        }
    }

    /** Outcome of {@link #emplace}: where the element lives and whether it was added. */
    public static final class InsertResult<E extends Comparable<? super E>> {
        private final MutablePosition<E> position;
        private final boolean inserted;

        InsertResult(final MutablePosition<E> position, final boolean inserted) {
            this.position = position;
            this.inserted = inserted;
        }

        public MutablePosition<E> position() {
            return position;
        }

        public boolean inserted() {
            return inserted;
        }
    }

    //--------------------------------------------------------------------------------
    // TREE
    //--------------------------------------------------------------------------------
    Node<T> root;
    private int size;

    public BinarySearchTree() {
    }

    /** Inserts the values one by one; later duplicates are ignored. */
    public BinarySearchTree(final Iterable<? extends T> values) {
        for (T value : values) insert(value);
    }

    /** Deep structural copy. Elements themselves are shared, not cloned. */
    public BinarySearchTree(final BinarySearchTree<T> other) {
        this.root = cloneGraph(other.root);
        this.size = other.size;
    }

    @SafeVarargs
    public static <T extends Comparable<? super T>> BinarySearchTree<T> of(final T... values) {
        return new BinarySearchTree<>(List.of(values));
    }

    public static <T extends Comparable<? super T>> BinarySearchTree<T> copyOf(final BinarySearchTree<T> other) {
        return new BinarySearchTree<>(other);
    }

    /** Takes over the node graph of {@code source}, which is left empty. */
    public static <T extends Comparable<? super T>> BinarySearchTree<T> moveOf(final BinarySearchTree<T> source) {
        BinarySearchTree<T> tree = new BinarySearchTree<>();
        tree.moveFrom(source);
        return tree;
    }

    /**
     * Rebuilds the tree whose pre-order and in-order walks are the given sequences.
     * Empty or differently sized sequences give an empty tree. The shape is taken from
     * the sequences as is and never checked against the ordering of the elements.
     */
    public static <T extends Comparable<? super T>> BinarySearchTree<T> fromPreorderInorder(final List<? extends T> preorder,
                                                                                          final List<? extends T> inorder) {
        return TraversalBuilder.preorderInorder(preorder, inorder);
    }

    /** Post-order counterpart of {@link #fromPreorderInorder}. */
    public static <T extends Comparable<? super T>> BinarySearchTree<T> fromInorderPostorder(final List<? extends T> inorder,
                                                                                           final List<? extends T> postorder) {
        return TraversalBuilder.inorderPostorder(inorder, postorder);
    }

    // installs a graph built without comparisons; the caller vouches for the count
    void adopt(final Node<T> newRoot, final int count) {
        this.root = newRoot;
        this.size = count;
    }

    /** Copy assignment: replaces the contents with a deep copy of {@code other}. */
    public void assign(final BinarySearchTree<T> other) {
        if (other == this) return;
        this.root = cloneGraph(other.root);
        this.size = other.size;
    }

    /**
     * Move assignment: takes the node graph of {@code source} and empties it.
     * Positions obtained from either tree beforehand are invalid afterwards; in particular
     * {@link MutablePosition#remove()} on them would update the wrong tree's count.
     */
    public void moveFrom(final BinarySearchTree<T> source) {
        if (source == this) return;
        this.root = source.root;
        this.size = source.size;
        source.root = null;
        source.size = 0;
    }

    /**
     * Exchanges the contents of the two trees. As with {@link #moveFrom}, positions taken
     * from either tree before the swap must not be used afterwards.
     */
    public void swap(final BinarySearchTree<T> other) {
        final Node<T> r = other.root;
        final int s = other.size;
        other.root = this.root;
        other.size = this.size;
        this.root = r;
        this.size = s;
    }

//--------------------------------------------------------------------------------
// CAPACITY
//--------------------------------------------------------------------------------

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

//--------------------------------------------------------------------------------
// MODIFIERS:
// - emplace : InsertResult
// - insert  : MutablePosition
// - erase   : MutablePosition of the successor
// - clear
//--------------------------------------------------------------------------------

    /** PRECONDITION: the factory CANNOT PRODUCE NULL **/
    public InsertResult<T> emplace(final Supplier<? extends T> factory) {
        final T value = Objects.requireNonNull(factory.get(), "value");

        if (root == null) {
            root = new Node<>(value, null);
            size++;
            return new InsertResult<>(position(root), true);
        }

        Node<T> current = root;
        Node<T> parent = null;
        boolean goLeft = false;
        while (current != null) {
            parent = current;
            if (value.compareTo(current.value) < 0) {
                current = current.left;
                goLeft = true;
            } else if (current.value.compareTo(value) < 0) {
                current = current.right;
                goLeft = false;
            } else {
                return new InsertResult<>(position(current), false); // already present
            }
        }

        final Node<T> created = new Node<>(value, parent);
        if (goLeft) parent.left = created;
        else parent.right = created;
        size++;
        return new InsertResult<>(position(created), true);
    }

    /** PRECONDITION: value CANNOT BE NULL **/
    public MutablePosition<T> insert(final T value) {
        if (value == null) throw new NullPointerException();
        return emplace(() -> value).position();
    }

    /**
     * Removes {@code key} if present. Returns the position holding the in-order successor
     * of the removed element, or {@link #end()} when the key was absent or the maximum.
     * <p>
     * A node with two children keeps its identity and receives its successor's value;
     * positions that referenced the successor node become stale.
     */
    public MutablePosition<T> erase(final T key) {
        final Node<T> target = findNode(key);
        if (target == null) return end();
        return position(eraseNode(target));
    }

    // returns the node holding the successor value after removal, null if none
    Node<T> eraseNode(final Node<T> target) {
        final Node<T> next;
        if (target.left != null && target.right != null) {
            final Node<T> successor = minimum(target.right);
            target.value = successor.value;
            unlink(successor);
            next = target;
        } else {
            next = successor(target);
            unlink(target);
        }
        size--;
        return next;
    }

    // node has at most one child; that child (or nothing) takes its slot
    private void unlink(final Node<T> node) {
        final Node<T> child = (node.left != null) ? node.left : node.right;
        final Node<T> parent = node.parent;
        if (child != null) child.parent = parent;

        if (parent == null) root = child;
        else if (parent.left == node) parent.left = child;
        else parent.right = child;

        node.left = null;
        node.right = null;
        node.parent = null;
    }

    public void clear() {
        root = null;
        size = 0;
    }

//--------------------------------------------------------------------------------
// LOOKUP
//--------------------------------------------------------------------------------

    /** PRECONDITION: key CANNOT BE NULL **/
    public MutablePosition<T> find(final T key) {
        return position(findNode(key));
    }

    /** Read-only variant of {@link #find}. */
    public Position<T> cfind(final T key) {
        return new Position<>(findNode(key), this);
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public boolean contains(final T key) {
        return findNode(key) != null;
    }

    public T first() {
        if (root == null) throw new NoSuchElementException();
        return minimum(root).value;
    }

    public T last() {
        if (root == null) throw new NoSuchElementException();
        return maximum(root).value;
    }

    private Node<T> findNode(final T key) {
        if (key == null) throw new NullPointerException();
        Node<T> current = root;
        while (current != null) {
            if (key.compareTo(current.value) < 0) current = current.left;
            else if (current.value.compareTo(key) < 0) current = current.right;
            else return current;
        }
        return null;
    }

//--------------------------------------------------------------------------------
// POSITIONS
//--------------------------------------------------------------------------------

    public MutablePosition<T> begin() {
        return position(minimum(root));
    }

    public MutablePosition<T> end() {
        return position(null);
    }

    public Position<T> cbegin() {
        return new Position<>(minimum(root), this);
    }

    public Position<T> cend() {
        return new Position<>(null, this);
    }

    private MutablePosition<T> position(final Node<T> node) {
        return new MutablePosition<>(node, this);
    }

    /** Ascending iterator; {@link Iterator#remove()} erases through the tree. */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            private Node<T> next = minimum(root);
            private Node<T> lastReturned;

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public T next() {
                if (next == null) throw new NoSuchElementException();
                lastReturned = next;
                next = successor(next);
                return lastReturned.value;
            }

            @Override
            public void remove() {
                if (lastReturned == null) throw new IllegalStateException();
                // two-child removal moves the successor value into lastReturned
                next = eraseNode(lastReturned);
                lastReturned = null;
            }
        };
    }

    static <E> Node<E> minimum(Node<E> node) {
        if (node == null) return null;
        while (node.left != null) node = node.left;
        return node;
    }

    static <E> Node<E> maximum(Node<E> node) {
        if (node == null) return null;
        while (node.right != null) node = node.right;
        return node;
    }

    static <E> Node<E> successor(Node<E> node) {
        if (node.right != null) return minimum(node.right);
        Node<E> p = node.parent;
        while (p != null && node == p.right) {
            node = p;
            p = p.parent;
        }
        return p;
    }

    static <E> Node<E> predecessor(Node<E> node) {
        if (node.left != null) return maximum(node.left);
        Node<E> p = node.parent;
        while (p != null && node == p.left) {
            node = p;
            p = p.parent;
        }
        return p;
    }

//--------------------------------------------------------------------------------
// TRAVERSALS
// Visitors may read elements but must not change the tree while a walk is running.
//--------------------------------------------------------------------------------

    /** Left subtree, node, right subtree: ascending order. */
    public void inOrder(final Consumer<? super T> visitor) {
        for (Node<T> n = minimum(root); n != null; n = successor(n)) {
            visitor.accept(n.value);
        }
    }

    /** Node, left subtree, right subtree. */
    public void preOrder(final Consumer<? super T> visitor) {
        if (root == null) return;
        final ArrayDeque<Node<T>> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final Node<T> n = stack.pop();
            visitor.accept(n.value);
            if (n.right != null) stack.push(n.right);
            if (n.left != null) stack.push(n.left);
        }
    }

    /** Left subtree, right subtree, node. */
    public void postOrder(final Consumer<? super T> visitor) {
        final ArrayDeque<Node<T>> stack = new ArrayDeque<>();
        Node<T> n = root;
        Node<T> lastVisited = null;
        while (n != null || !stack.isEmpty()) {
            if (n != null) {
                stack.push(n);
                n = n.left;
            } else {
                final Node<T> top = stack.peek();
                if (top.right != null && top.right != lastVisited) {
                    n = top.right;
                } else {
                    visitor.accept(top.value);
                    lastVisited = stack.pop();
                }
            }
        }
    }

    // clones shape and parent links; iterative so degenerate trees do not overflow the stack
    private static <E> Node<E> cloneGraph(final Node<E> source) {
        if (source == null) return null;
        final Node<E> copy = new Node<>(source.value, null);
        final ArrayDeque<Node<E>> from = new ArrayDeque<>();
        final ArrayDeque<Node<E>> to = new ArrayDeque<>();
        from.push(source);
        to.push(copy);
        while (!from.isEmpty()) {
            final Node<E> s = from.pop();
            final Node<E> c = to.pop();
            if (s.left != null) {
                c.left = new Node<>(s.left.value, c);
                from.push(s.left);
                to.push(c.left);
            }
            if (s.right != null) {
                c.right = new Node<>(s.right.value, c);
                from.push(s.right);
                to.push(c.right);
            }
        }
        return copy;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[");
        for (Node<T> n = minimum(root); n != null; n = successor(n)) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(n.value);
        }
        return sb.append(']').toString();
    }

    /**
     *
     * DEBUG CODE (FOR TESTBED)
     *
     */

    public int sizeStructural() {
        if (root == null) return 0;
        int count = 0;
        final ArrayDeque<Node<T>> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final Node<T> n = stack.pop();
            count++;
            if (n.left != null) stack.push(n.left);
            if (n.right != null) stack.push(n.right);
        }
        return count;
    }

    public int height() {
        if (root == null) return 0;
        int max = 0;
        final ArrayDeque<Node<T>> nodes = new ArrayDeque<>();
        final ArrayDeque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);
        while (!nodes.isEmpty()) {
            final Node<T> n = nodes.pop();
            final int d = depths.pop();
            if (d > max) max = d;
            if (n.left != null) { nodes.push(n.left); depths.push(d + 1); }
            if (n.right != null) { nodes.push(n.right); depths.push(d + 1); }
        }
        return max;
    }

    /** Checks ordering, parent links and the cached size against the node graph. */
    public boolean isValid() {
        if (root == null) return size == 0;
        if (root.parent != null) return false;

        final ArrayDeque<Node<T>> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final Node<T> n = stack.pop();
            if (n.left != null) {
                if (n.left.parent != n) return false;
                stack.push(n.left);
            }
            if (n.right != null) {
                if (n.right.parent != n) return false;
                stack.push(n.right);
            }
        }

        T previous = null;
        for (Node<T> n = minimum(root); n != null; n = successor(n)) {
            if (previous != null && previous.compareTo(n.value) >= 0) return false;
            previous = n.value;
        }
        return size == sizeStructural();
    }
}
