package bench;

import splay.SplayTree;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded throughput of SplayTree against java.util.TreeMap.
 *
 * Usage: MicroBench [seconds] [keyRange] [hotPercent]
 * hotPercent is the share of lookups aimed at the lowest 1% of the key range;
 * 0 gives a uniform workload.
 */
public class MicroBench {

    interface KV {
        void insert(int k);
        void delete(int k);
        Integer get(int k);
    }

    static class SplayKV implements KV {
        private final SplayTree<Integer,Integer> map = new SplayTree<>();
        public void insert(int k) { map.insert(k, k); }
        public void delete(int k) { map.remove(k); }
        public Integer get(int k) { return map.get(k); }
    }

    static class TreeMapKV implements KV {
        private final TreeMap<Integer,Integer> map = new TreeMap<>();
        public void insert(int k) { map.put(k, k); }
        public void delete(int k) { map.remove(k); }
        public Integer get(int k) { return map.get(k); }
    }

    /**
     * Runs {@code ops} operations (80% gets, 10% inserts, 10% deletes) and
     * returns how many gets hit. The same seed gives the same sequence for any KV.
     */
    static long runOps(KV ds, long ops, int keyRange, int hotPercent, long seed) {
        Random rnd = new Random(seed);
        int hotRange = Math.max(1, keyRange / 100);
        long hits = 0;
        for (long i = 0; i < ops; i++) {
            int r = rnd.nextInt(100);
            if (r < 80) {
                int k = (rnd.nextInt(100) < hotPercent) ? rnd.nextInt(hotRange) : rnd.nextInt(keyRange);
                if (ds.get(k) != null) hits++;
            } else if (r < 90) {
                ds.insert(rnd.nextInt(keyRange));
            } else {
                ds.delete(rnd.nextInt(keyRange));
            }
        }
        return hits;
    }

    static void preload(KV ds, int keyRange) {
        // every other key, shuffled so the splay tree does not start as a path
        Random rnd = new Random(7);
        for (int i = 0; i < keyRange / 2; i++) ds.insert(rnd.nextInt(keyRange));
    }

    static double measure(String name, KV ds, int seconds, int keyRange, int hotPercent) {
        preload(ds, keyRange);
        final long endAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
        long totalOps = 0;
        long seed = 1;
        while (System.nanoTime() < endAt) {
            runOps(ds, 10_000, keyRange, hotPercent, seed++);
            totalOps += 10_000;
        }
        double mopsPerSec = totalOps / (double)seconds / 1_000_000.0;
        System.out.printf("%-8s Time=%ds, KeyRange=%d, Hot=%d%%, TotalOps=%d, Throughput=%.2f Mops/s%n",
                name, seconds, keyRange, hotPercent, totalOps, mopsPerSec);
        return mopsPerSec;
    }

    public static void main(String[] args) {
        int seconds = (args.length >= 1) ? Integer.parseInt(args[0]) : 3;
        int keyRange = (args.length >= 2) ? Integer.parseInt(args[1]) : 200_000;
        int hotPercent = (args.length >= 3) ? Integer.parseInt(args[2]) : 90;

        double splay = measure("Splay", new SplayKV(), seconds, keyRange, hotPercent);
        double treeMap = measure("TreeMap", new TreeMapKV(), seconds, keyRange, hotPercent);

        System.out.printf("Splay/TreeMap throughput ratio: %.2f%n", splay / treeMap);
    }
}
