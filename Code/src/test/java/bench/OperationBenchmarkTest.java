package bench;

import org.junit.jupiter.api.Test;

import java.util.List;
import static org.junit.jupiter.api.Assertions.*;

class OperationBenchmarkTest {

    @Test
    void bothImplementations_agreeOnEveryPhase() {
        List<OperationBenchmark.Result> tree =
            OperationBenchmark.runTest("BinarySearchTree", new OperationBenchmark.TreeWrapper(), 2_000, 2, 42);
        List<OperationBenchmark.Result> reference =
            OperationBenchmark.runTest("TreeSet", new OperationBenchmark.TreeSetWrapper(), 2_000, 2, 42);

        assertEquals(OperationBenchmark.OpType.values().length, tree.size());
        for (int i = 0; i < tree.size(); i++) {
            assertEquals(reference.get(i).opType, tree.get(i).opType);
            assertEquals(reference.get(i).checksum, tree.get(i).checksum, "checksum of " + tree.get(i).opType);
            assertTrue(tree.get(i).ops > 0);
        }
    }
}
