package bench;

import dict.OrderedMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeMap;

/**
 * Single-threaded throughput of OrderedMap against java.util.TreeMap.
 * Ascending insertion degrades the unbalanced tree into a chain, random
 * insertion keeps it near logarithmic height.
 *
 * Usage: MicroBench [elements] [rounds]
 */
public class MicroBench {

    interface KV {
        void insert(int k);
        void delete(int k);
        boolean contains(int k);
        int size();
        String name();
    }

    static class OrderedMapKV implements KV {
        final OrderedMap<Integer,Integer> map = new OrderedMap<>();
        public void insert(int k) { map.insert(k, k); }
        public void delete(int k) { map.remove(k); }
        public boolean contains(int k) { return map.contains(k); }
        public int size() { return map.size(); }
        public String name() { return "OrderedMap"; }
    }

    static class TreeMapKV implements KV {
        final TreeMap<Integer,Integer> map = new TreeMap<>();
        public void insert(int k) { map.put(k, k); }
        public void delete(int k) { map.remove(k); }
        public boolean contains(int k) { return map.containsKey(k); }
        public int size() { return map.size(); }
        public String name() { return "TreeMap"; }
    }

    static final class Result {
        final String structure;
        final String order;
        final long ops;
        final long nanos;

        Result(String structure, String order, long ops, long nanos) {
            this.structure = structure;
            this.order = order;
            this.ops = ops;
            this.nanos = nanos;
        }

        double mopsPerSec() {
            return nanos == 0 ? 0.0 : ops / (nanos / 1e9) / 1_000_000.0;
        }

        @Override
        public String toString() {
            return String.format("%-10s %-9s ops=%d time=%.3fs throughput=%.2f Mops/s",
                    structure, order, ops, nanos / 1e9, mopsPerSec());
        }
    }

    /** Keys 0..n-1, ascending or shuffled with the given seed. */
    static int[] keys(int n, boolean ascending, long seed) {
        int[] keys = new int[n];
        for (int i = 0; i < n; i++) keys[i] = i;
        if (!ascending) {
            Random rnd = new Random(seed);
            for (int i = n - 1; i > 0; i--) {
                int j = rnd.nextInt(i + 1);
                int t = keys[i]; keys[i] = keys[j]; keys[j] = t;
            }
        }
        return keys;
    }

    /**
     * Each round inserts every key, looks every key up, then deletes every key.
     * Throws IllegalStateException if the structure loses or keeps an element.
     */
    static Result run(KV ds, String order, int[] keys, int rounds) {
        long ops = 0;
        long start = System.nanoTime();
        for (int r = 0; r < rounds; r++) {
            for (int k : keys) ds.insert(k);
            if (ds.size() != keys.length)
                throw new IllegalStateException(ds.name() + ": size " + ds.size() + " after inserting " + keys.length);
            for (int k : keys) {
                if (!ds.contains(k)) throw new IllegalStateException(ds.name() + ": lost key " + k);
            }
            for (int k : keys) ds.delete(k);
            if (ds.size() != 0)
                throw new IllegalStateException(ds.name() + ": size " + ds.size() + " after deleting all");
            ops += 3L * keys.length;
        }
        return new Result(ds.name(), order, ops, System.nanoTime() - start);
    }

    static List<Result> runAll(int elements, int rounds) {
        int[] random = keys(elements, false, 42);
        int[] ascending = keys(elements, true, 42);
        List<Result> results = new ArrayList<>();
        results.add(run(new OrderedMapKV(), "random", random, rounds));
        results.add(run(new TreeMapKV(), "random", random, rounds));
        results.add(run(new OrderedMapKV(), "ascending", ascending, rounds));
        results.add(run(new TreeMapKV(), "ascending", ascending, rounds));
        return results;
    }

    public static void main(String[] args) {
        int elements = (args.length >= 1) ? Integer.parseInt(args[0]) : 5_000;
        int rounds = (args.length >= 2) ? Integer.parseInt(args[1]) : 3;

        System.out.printf("Elements=%d, Rounds=%d%n", elements, rounds);
        for (Result r : runAll(elements, rounds)) {
            System.out.println(r);
        }
    }
}
