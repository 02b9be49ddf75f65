package bst;

import org.junit.jupiter.api.Test;

import java.util.*;
import static org.junit.jupiter.api.Assertions.*;

class PositionTest {

    @Test
    void retreatFromEnd_landsOnMaximum() {
        BinarySearchTree<Integer> bst = BinarySearchTree.of(10, 5, 15, 3, 7, 12, 18);

        BinarySearchTree.MutablePosition<Integer> it = bst.end();
        assertEquals(18, it.previous().get());
        assertEquals(15, it.previous().get());
        assertEquals(18, it.next().get());
        assertTrue(it.next().isEnd());
        assertEquals(bst.end(), it);
    }

    @Test
    void walkBackward_visitsDescendingOrder() {
        BinarySearchTree<Integer> bst = BinarySearchTree.of(50, 30, 70, 20, 40, 60, 80, 35, 45);

        List<Integer> descending = new ArrayList<>();
        BinarySearchTree.Position<Integer> it = bst.cend();
        while (!it.previous().isEnd()) descending.add(it.get());
        assertEquals(List.of(80, 70, 60, 50, 45, 40, 35, 30, 20), descending);
    }

    @Test
    void walkForward_matchesInOrderTraversal() {
        BinarySearchTree<Integer> bst = new BinarySearchTree<>();
        Random rnd = new Random(99);
        for (int i = 0; i < 300; i++) bst.insert(rnd.nextInt(1000));

        List<Integer> viaPositions = new ArrayList<>();
        for (BinarySearchTree.Position<Integer> it = bst.cbegin(); !it.equals(bst.cend()); it.next()) {
            viaPositions.add(it.get());
        }
        List<Integer> viaVisitor = new ArrayList<>();
        bst.inOrder(viaVisitor::add);
        assertEquals(viaVisitor, viaPositions);
    }

    @Test
    void previousFromBegin_reachesEnd() {
        BinarySearchTree<Integer> bst = BinarySearchTree.of(2, 1, 3);
        assertTrue(bst.begin().previous().isEnd());
    }

    @Test
    void emptyTree_endStaysEnd() {
        BinarySearchTree<Integer> bst = new BinarySearchTree<>();
        assertTrue(bst.end().previous().isEnd());
    }

    @Test
    void endPosition_cannotBeDereferencedOrAdvanced() {
        BinarySearchTree<Integer> bst = BinarySearchTree.of(1);
        assertThrows(NoSuchElementException.class, () -> bst.end().get());
        assertThrows(NoSuchElementException.class, () -> bst.end().next());
        assertThrows(NoSuchElementException.class, () -> bst.end().remove());
    }

    @Test
    void equality_isByNode() {
        BinarySearchTree<Integer> bst = BinarySearchTree.of(2, 1, 3);

        assertEquals(bst.find(2), bst.begin().next());
        assertEquals(bst.find(2).hashCode(), bst.begin().next().hashCode());
        assertNotEquals(bst.find(1), bst.find(3));
        assertEquals(bst.end(), bst.cend());

        // mutable converts to read-only, the reverse needs no support
        BinarySearchTree.Position<Integer> widened = bst.find(3);
        assertEquals(bst.cfind(3), widened);
        assertEquals(bst.cfind(3), bst.find(3).readOnly());
    }

    @Test
    void copy_advancesIndependently() {
        BinarySearchTree<Integer> bst = BinarySearchTree.of(2, 1, 3);
        BinarySearchTree.MutablePosition<Integer> it = bst.begin();
        BinarySearchTree.MutablePosition<Integer> saved = it.copy();

        it.next().next();
        assertEquals(3, it.get());
        assertEquals(1, saved.get());
    }

    @Test
    void mutablePosition_removeReturnsSuccessor() {
        BinarySearchTree<Integer> bst = BinarySearchTree.of(10, 5, 15, 3, 7, 12, 18);

        BinarySearchTree.MutablePosition<Integer> it = bst.find(5);
        BinarySearchTree.MutablePosition<Integer> next = it.remove();
        assertEquals(7, next.get());
        assertEquals(6, bst.size());
        assertEquals("[3, 7, 10, 12, 15, 18]", bst.toString());
        assertTrue(bst.isValid());
    }

    @Test
    void iterator_removeEvenElements() {
        BinarySearchTree<Integer> bst = new BinarySearchTree<>();
        Random rnd = new Random(3);
        TreeSet<Integer> ref = new TreeSet<>();
        for (int i = 0; i < 400; i++) {
            int k = rnd.nextInt(2000);
            bst.insert(k);
            ref.add(k);
        }

        List<Integer> all = new ArrayList<>(ref);
        List<Integer> seen = new ArrayList<>();
        for (Iterator<Integer> it = bst.iterator(); it.hasNext(); ) {
            int v = it.next();
            seen.add(v);
            if (v % 2 == 0) it.remove();
        }
        ref.removeIf(v -> v % 2 == 0);

        // removal must not skip or repeat elements, whatever the node shape
        assertEquals(all, seen);
        List<Integer> left = new ArrayList<>();
        bst.forEach(left::add);
        assertEquals(new ArrayList<>(ref), left);
        assertEquals(ref.size(), bst.size());
        assertTrue(bst.isValid());
    }

    @Test
    void iterator_contract() {
        BinarySearchTree<Integer> bst = BinarySearchTree.of(1);
        Iterator<Integer> it = bst.iterator();

        assertThrows(IllegalStateException.class, it::remove);
        assertEquals(1, it.next());
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
        it.remove();
        assertThrows(IllegalStateException.class, it::remove);
        assertTrue(bst.isEmpty());
    }
}
