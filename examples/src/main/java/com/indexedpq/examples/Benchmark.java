package com.indexedpq.examples;

import com.indexedpq.core.IndexedPriorityQueue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Times the common queue workloads: building by repeated insertion, copying,
 * draining a copy and updating every key.
 * <p>
 * Configured through the environment: {@code BENCH_SIZE} (queue size, default
 * 10000), {@code BENCH_REPEAT} (runs per workload, default 100) and
 * {@code BENCH_SEED}.
 */
public class Benchmark {

    static IndexedPriorityQueue<Double, Double, Double> buildQueue(int n, Random random) {
        IndexedPriorityQueue<Double, Double, Double> queue = IndexedPriorityQueue.minQueue();
        for (int i = 0; i < n; i++) {
            queue.setPriority(random.nextDouble(), random.nextDouble());
        }
        return queue;
    }

    static IndexedPriorityQueue<Double, Double, Double> updateAll(IndexedPriorityQueue<Double, Double, Double> queue) {
        List<Double> keys = new ArrayList<>(queue.size());
        queue.forEach(keys::add);
        for (Double key : keys) {
            queue.setPriority(key, queue.get(key) + 0.001);
        }
        return queue;
    }

    static int consume(IndexedPriorityQueue<Double, Double, Double> queue) {
        int popped = 0;
        while (!queue.isEmpty()) {
            queue.popTopItem();
            popped++;
        }
        return popped;
    }

    /**
     * Total wall time of {@code repeat} runs, in seconds.
     */
    static double time(Supplier<?> task, int repeat) {
        long start = System.nanoTime();
        for (int i = 0; i < repeat; i++) {
            task.get();
        }
        return (System.nanoTime() - start) / 1e9;
    }

    public static void main(String[] args) {
        int size = Integer.parseInt(System.getenv().getOrDefault("BENCH_SIZE", "10000"));
        int repeat = Integer.parseInt(System.getenv().getOrDefault("BENCH_REPEAT", "100"));
        long seed = Long.parseLong(System.getenv().getOrDefault("BENCH_SEED", "1298472"));

        Random random = new Random(seed);
        IndexedPriorityQueue<Double, Double, Double> queue = buildQueue(size, random);
        int buildSize = Math.max(1, size / 10);

        System.out.println("Time it takes to create a queue of " + buildSize + " items:");
        System.out.println(time(() -> buildQueue(buildSize, random), repeat));

        System.out.println("Time it takes to copy a queue of " + size + " items:");
        System.out.println(time(queue::copy, repeat));

        System.out.println("Time it takes to drain the queue after copy():");
        System.out.println(time(() -> consume(queue.copy()), repeat));

        System.out.println("Time it takes to update all keys in the queue:");
        System.out.println(time(() -> updateAll(queue), repeat));
    }
}
