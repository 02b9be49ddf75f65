package bench;

import bst.BinarySearchTree;
import java.util.*;

/**
 * Single-threaded benchmark comparing operation types separately.
 * Runs the same random key stream against BinarySearchTree and java.util.TreeSet.
 *
 * Usage: OperationBenchmark [elements] [rounds]
 */
public class OperationBenchmark {

    interface SetInterface {
        void insert(int k);
        void erase(int k);
        boolean contains(int k);
        long sumAll();
        int size();
    }

    static class TreeWrapper implements SetInterface {
        private final BinarySearchTree<Integer> tree = new BinarySearchTree<>();
        public void insert(int k) { tree.insert(k); }
        public void erase(int k) { tree.erase(k); }
        public boolean contains(int k) { return tree.contains(k); }
        public long sumAll() {
            long sum = 0;
            for (int v : tree) sum += v;
            return sum;
        }
        public int size() { return tree.size(); }
    }

    static class TreeSetWrapper implements SetInterface {
        private final TreeSet<Integer> set = new TreeSet<>();
        public void insert(int k) { set.add(k); }
        public void erase(int k) { set.remove(k); }
        public boolean contains(int k) { return set.contains(k); }
        public long sumAll() {
            long sum = 0;
            for (int v : set) sum += v;
            return sum;
        }
        public int size() { return set.size(); }
    }

    enum OpType {
        INSERT, FIND, ERASE, ITERATE
    }

    static class Result {
        String impl;
        OpType opType;
        long ops;
        long nanos;
        long checksum;

        long opsPerSecond() {
            return nanos == 0 ? 0 : (long) (ops * 1_000_000_000.0 / nanos);
        }

        @Override
        public String toString() {
            return String.format("%-14s %-8s ops=%-9d %,12d ops/s  checksum=%d",
                impl, opType, ops, opsPerSecond(), checksum);
        }
    }

    /**
     * Runs the four phases in order on one structure: inserts, lookups, erases of half the
     * keys, then full iterations. Keys are drawn from a seeded random stream so every
     * implementation sees the same workload.
     */
    static List<Result> runTest(String impl, SetInterface ds, int elements, int rounds, long seed) {
        List<Result> results = new ArrayList<>();
        int keyRange = elements * 4;

        Random rnd = new Random(seed);
        long t0 = System.nanoTime();
        for (int i = 0; i < elements; i++) ds.insert(rnd.nextInt(keyRange));
        results.add(result(impl, OpType.INSERT, elements, System.nanoTime() - t0, ds.size()));

        rnd = new Random(seed + 1);
        long hits = 0;
        t0 = System.nanoTime();
        for (int i = 0; i < elements; i++) {
            if (ds.contains(rnd.nextInt(keyRange))) hits++;
        }
        results.add(result(impl, OpType.FIND, elements, System.nanoTime() - t0, hits));

        rnd = new Random(seed + 2);
        t0 = System.nanoTime();
        for (int i = 0; i < elements / 2; i++) ds.erase(rnd.nextInt(keyRange));
        results.add(result(impl, OpType.ERASE, elements / 2, System.nanoTime() - t0, ds.size()));

        long sum = 0;
        t0 = System.nanoTime();
        for (int r = 0; r < rounds; r++) sum = ds.sumAll();
        results.add(result(impl, OpType.ITERATE, (long) rounds * ds.size(), System.nanoTime() - t0, sum));

        return results;
    }

    private static Result result(String impl, OpType op, long ops, long nanos, long checksum) {
        Result r = new Result();
        r.impl = impl;
        r.opType = op;
        r.ops = ops;
        r.nanos = nanos;
        r.checksum = checksum;
        return r;
    }

    public static void main(String[] args) {
        int elements = (args.length >= 1) ? Integer.parseInt(args[0]) : 200_000;
        int rounds = (args.length >= 2) ? Integer.parseInt(args[1]) : 20;
        long seed = 42;

        System.out.println("========================================");
        System.out.println("BinarySearchTree Operation Benchmark");
        System.out.println("elements=" + elements + ", iteration rounds=" + rounds);
        System.out.println("========================================\n");

        // warm-up
        runTest("warmup", new TreeWrapper(), Math.min(elements, 20_000), 2, seed);
        runTest("warmup", new TreeSetWrapper(), Math.min(elements, 20_000), 2, seed);

        List<Result> tree = runTest("BinarySearchTree", new TreeWrapper(), elements, rounds, seed);
        List<Result> reference = runTest("TreeSet", new TreeSetWrapper(), elements, rounds, seed);

        boolean consistent = true;
        for (int i = 0; i < tree.size(); i++) {
            System.out.println(tree.get(i));
            System.out.println(reference.get(i));
            if (tree.get(i).checksum != reference.get(i).checksum) consistent = false;
        }

        System.out.println();
        if (consistent) {
            System.out.println("✓ Both implementations agree on every phase");
        } else {
            System.err.println("❌ Checksum mismatch between BinarySearchTree and TreeSet");
            System.exit(1);
        }
    }
}
