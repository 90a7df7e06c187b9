package com.indexedpq.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jgrapht.alg.util.Pair;

/**
 * A key to value mapping whose values carry priorities.
 * <p>
 * Implementations provide the primitive operations; the remaining
 * map-style conveniences are derived from them here.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface PriorityMapping<K, V> extends Iterable<K> {

    int size();

    boolean contains(K key);

    /**
     * @throws KeyNotFoundException if {@code key} is absent
     */
    V get(K key);

    /**
     * Inserts {@code key} or replaces its value.
     */
    void setPriority(K key, V value);

    /**
     * @throws KeyNotFoundException if {@code key} is absent
     */
    void remove(K key);

    default boolean isEmpty() {
        return size() == 0;
    }

    default V getOrDefault(K key, V defaultValue) {
        return contains(key) ? get(key) : defaultValue;
    }

    /**
     * Returns the value of {@code key}, first inserting {@code defaultValue}
     * if the key is absent.
     */
    default V setDefault(K key, V defaultValue) {
        if (contains(key)) {
            return get(key);
        }
        setPriority(key, defaultValue);
        return defaultValue;
    }

    default void putAll(Map<? extends K, ? extends V> entries) {
        for (Map.Entry<? extends K, ? extends V> entry : entries.entrySet()) {
            setPriority(entry.getKey(), entry.getValue());
        }
    }

    default void putAll(Iterable<? extends Pair<? extends K, ? extends V>> items) {
        for (Pair<? extends K, ? extends V> item : items) {
            setPriority(item.getFirst(), item.getSecond());
        }
    }

    default void clear() {
        List<K> keys = new ArrayList<>(size());
        for (K key : this) {
            keys.add(key);
        }
        for (K key : keys) {
            remove(key);
        }
    }

    /**
     * Snapshot of the current contents, in iteration order.
     */
    default Map<K, V> toMap() {
        Map<K, V> map = new LinkedHashMap<>();
        for (K key : this) {
            map.put(key, get(key));
        }
        return map;
    }

    /**
     * True if this mapping holds exactly the key/value pairs of {@code other}.
     * Priority order plays no part.
     */
    default boolean contentEquals(Map<?, ?> other) {
        return toMap().equals(other);
    }
}
