package com.indexedpq.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Bulk selection and sorting of map keys by priority, built on
 * {@link IndexedPriorityQueue}.
 */
public final class PriorityQueues {

    private PriorityQueues() {
    }

    /**
     * Returns the keys of the {@code n} largest values in descending order,
     * or all keys if the mapping has fewer than {@code n} entries. Runs in
     * O(m log n) for a mapping of m entries.
     */
    public static <K, V extends Comparable<? super V>> List<K> nLargest(int n,
            Map<? extends K, ? extends V> mapping) {
        return nBest(n, mapping, Function.<V>identity(), Precedence.<V>naturalOrder());
    }

    /**
     * Like {@link #nLargest(int, Map)}, ranking values by {@code keyFn}.
     */
    public static <K, V, P extends Comparable<? super P>> List<K> nLargest(int n,
            Map<? extends K, ? extends V> mapping, Function<? super V, ? extends P> keyFn) {
        return nBest(n, mapping, keyFn, Precedence.<P>naturalOrder());
    }

    /**
     * Returns the keys of the {@code n} smallest values in ascending order,
     * or all keys if the mapping has fewer than {@code n} entries.
     */
    public static <K, V extends Comparable<? super V>> List<K> nSmallest(int n,
            Map<? extends K, ? extends V> mapping) {
        return nBest(n, mapping, Function.<V>identity(), Precedence.<V>reverseOrder());
    }

    public static <K, V, P extends Comparable<? super P>> List<K> nSmallest(int n,
            Map<? extends K, ? extends V> mapping, Function<? super V, ? extends P> keyFn) {
        return nBest(n, mapping, keyFn, Precedence.<P>reverseOrder());
    }

    /**
     * All keys of {@code mapping}, smallest value first. Keys with equal
     * values come out in no particular order.
     */
    public static <K, V extends Comparable<? super V>> List<K> sortedByPriority(
            Map<? extends K, ? extends V> mapping) {
        return sortedByPriority(mapping, Precedence.<V>naturalOrder());
    }

    public static <K, V> List<K> sortedByPriority(Map<? extends K, ? extends V> mapping,
            Precedence<? super V> precedence) {
        IndexedPriorityQueue<K, V, V> queue = IndexedPriorityQueue.create(mapping, precedence);
        return drainKeys(queue);
    }

    /*
     * The queue holds the best n seen so far with the worst of them on top,
     * so each remaining entry either bounces straight off or evicts the top.
     */
    private static <K, V, P> List<K> nBest(int n, Map<? extends K, ? extends V> mapping,
            Function<? super V, ? extends P> keyFn, Precedence<? super P> worstFirst) {
        IndexedPriorityQueue<K, V, P> queue = new IndexedPriorityQueue<>(worstFirst, keyFn);
        Iterator<? extends Map.Entry<? extends K, ? extends V>> it = mapping.entrySet().iterator();
        for (int i = 0; i < n && it.hasNext(); i++) {
            Map.Entry<? extends K, ? extends V> entry = it.next();
            queue.addItem(entry.getKey(), entry.getValue());
        }
        while (it.hasNext()) {
            Map.Entry<? extends K, ? extends V> entry = it.next();
            queue.pushThenPopTop(entry.getKey(), entry.getValue());
        }
        List<K> out = drainKeys(queue);
        Collections.reverse(out);
        return out;
    }

    private static <K> List<K> drainKeys(IndexedPriorityQueue<K, ?, ?> queue) {
        List<K> out = new ArrayList<>(queue.size());
        Iterator<K> drain = queue.drainKeys();
        while (drain.hasNext()) {
            out.add(drain.next());
        }
        return out;
    }
}
