package com.indexedpq.core;

/**
 * One queued element. Owned by a single {@link IndexedPriorityQueue}; never
 * handed out to callers.
 */
final class Node<K, V, P> {
    K key;
    V value;
    P priority;

    Node(K key, V value, P priority) {
        this.key = key;
        this.value = value;
        this.priority = priority;
    }

    Node<K, V, P> copy() {
        return new Node<>(key, value, priority);
    }

    @Override
    public String toString() {
        return "Node(" + key + ", " + value + ", " + priority + ")";
    }
}
