package com.indexedpq.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

import org.jgrapht.alg.util.Pair;

/**
 * A priority queue of unique keys with random access by key.
 * <p>
 * Each key maps to a value; the value, optionally projected through a key
 * function, gives the element's priority. Elements are kept in a binary heap
 * ordered by a {@link Precedence}, and a hash index maps every key to its slot
 * in the heap, so besides the usual top operations the queue supports:
 * <ul>
 * <li>O(1) lookup and membership of any key,</li>
 * <li>O(log n) removal of any key,</li>
 * <li>O(log n) priority update of any key.</li>
 * </ul>
 * The default precedence ({@link #minQueue()}) puts the smallest priority on
 * top. Elements of equal priority come out in no particular order, and that
 * order can change with the history of updates and removals.
 * <p>
 * This class is not synchronized. Callers sharing an instance between
 * threads must guard every call with the same lock.
 *
 * @param <K> the key type
 * @param <V> the value type
 * @param <P> the priority type
 */
public class IndexedPriorityQueue<K, V, P> implements PriorityMapping<K, V> {

    private final Precedence<? super P> precedence;
    private final Function<? super V, ? extends P> keyFn;

    private final List<Node<K, V, P>> heap;
    private final Map<K, Integer> position; // key -> slot in heap
    private int modCount;

    /**
     * Creates an empty queue.
     *
     * @param precedence decides which of two priorities is closer to the top
     * @param keyFn derives a priority from a value; {@code null} uses the
     *            value itself as priority
     */
    public IndexedPriorityQueue(Precedence<? super P> precedence, Function<? super V, ? extends P> keyFn) {
        this.precedence = Objects.requireNonNull(precedence, "precedence");
        this.keyFn = keyFn == null ? identity() : keyFn;
        this.heap = new ArrayList<>();
        this.position = new HashMap<>();
    }

    /**
     * Creates a queue holding the given items, built in linear time.
     *
     * @throws KeyAlreadyExistsException if a key occurs more than once
     */
    public IndexedPriorityQueue(Iterable<? extends Pair<? extends K, ? extends V>> items,
            Precedence<? super P> precedence, Function<? super V, ? extends P> keyFn) {
        this(precedence, keyFn);
        for (Pair<? extends K, ? extends V> item : items) {
            append(item.getFirst(), item.getSecond());
        }
        heapify();
    }

    /**
     * Creates a queue holding the entries of {@code data}, built in linear time.
     */
    public IndexedPriorityQueue(Map<? extends K, ? extends V> data,
            Precedence<? super P> precedence, Function<? super V, ? extends P> keyFn) {
        this(precedence, keyFn);
        for (Map.Entry<? extends K, ? extends V> entry : data.entrySet()) {
            append(entry.getKey(), entry.getValue());
        }
        heapify();
    }

    public static <K, V> IndexedPriorityQueue<K, V, V> create(Precedence<? super V> precedence) {
        return new IndexedPriorityQueue<>(precedence, Function.identity());
    }

    public static <K, V> IndexedPriorityQueue<K, V, V> create(Map<? extends K, ? extends V> data,
            Precedence<? super V> precedence) {
        return new IndexedPriorityQueue<>(data, precedence, Function.identity());
    }

    /**
     * Empty queue where the smallest value has the highest priority.
     */
    public static <K, V extends Comparable<? super V>> IndexedPriorityQueue<K, V, V> minQueue() {
        return create(Precedence.<V>naturalOrder());
    }

    public static <K, V extends Comparable<? super V>> IndexedPriorityQueue<K, V, V> minQueue(
            Map<? extends K, ? extends V> data) {
        return create(data, Precedence.<V>naturalOrder());
    }

    /**
     * Empty queue where the largest value has the highest priority.
     */
    public static <K, V extends Comparable<? super V>> IndexedPriorityQueue<K, V, V> maxQueue() {
        return create(Precedence.<V>reverseOrder());
    }

    public static <K, V extends Comparable<? super V>> IndexedPriorityQueue<K, V, V> maxQueue(
            Map<? extends K, ? extends V> data) {
        return create(data, Precedence.<V>reverseOrder());
    }

    /**
     * Queue mapping every key of {@code keys} to the same {@code value}.
     */
    public static <K, V> IndexedPriorityQueue<K, V, V> fromKeys(Iterable<? extends K> keys, V value,
            Precedence<? super V> precedence) {
        IndexedPriorityQueue<K, V, V> queue = create(precedence);
        for (K key : keys) {
            queue.append(key, value);
        }
        queue.heapify();
        return queue;
    }

    @SuppressWarnings("unchecked")
    private static <V, P> Function<? super V, ? extends P> identity() {
        return (Function<? super V, ? extends P>) (Function<?, ?>) Function.identity();
    }

    public Precedence<? super P> precedence() {
        return precedence;
    }

    public Function<? super V, ? extends P> keyFunction() {
        return keyFn;
    }

    // Lookup

    @Override
    public int size() {
        return heap.size();
    }

    @Override
    public boolean contains(K key) {
        return position.containsKey(key);
    }

    @Override
    public V get(K key) {
        return nodeFor(key).value;
    }

    /**
     * @throws KeyNotFoundException if {@code key} is absent
     */
    public P getPriority(K key) {
        return nodeFor(key).priority;
    }

    /**
     * Iterates over the keys in heap order, which is not priority order. The
     * queue is left untouched; see {@link #drainKeys()} for consuming the queue
     * in priority order.
     */
    @Override
    public Iterator<K> iterator() {
        return new KeyIterator();
    }

    /**
     * A live view of the keys. Each call to {@code iterator()} on it starts a
     * fresh pass, same as {@link #iterator()}.
     */
    public Iterable<K> keys() {
        return KeyIterator::new;
    }

    // Mutation

    /**
     * Inserts {@code key} with {@code value}, or replaces the value of an
     * existing key and moves it to its new place in the heap.
     * <p>
     * If the precedence throws while an existing key is being moved, the new
     * value and priority have already been stored but the key may sit in the
     * wrong heap slot. Call {@link #reheapify(Object)} once the priorities are
     * comparable again.
     */
    @Override
    public void setPriority(K key, V value) {
        P priority = keyFn.apply(value);
        Integer pos = position.get(key);
        if (pos == null) {
            if (!heap.isEmpty()) {
                // Fail on incomparable priorities before the heap is touched.
                precedence.precedes(priority, heap.get(0).priority);
            }
            int end = heap.size();
            heap.add(new Node<>(key, value, priority));
            position.put(key, end);
            modCount++;
            swim(end, 0);
        } else {
            Node<K, V, P> node = heap.get(pos);
            node.value = value;
            node.priority = priority;
            modCount++;
            repair(pos);
        }
    }

    /**
     * @throws KeyAlreadyExistsException if {@code key} is already queued
     */
    public void addItem(K key, V value) {
        if (position.containsKey(key)) {
            throw new KeyAlreadyExistsException(key);
        }
        setPriority(key, value);
    }

    /**
     * @throws KeyNotFoundException if {@code key} is absent
     */
    public void updateItem(K key, V value) {
        if (!position.containsKey(key)) {
            throw new KeyNotFoundException(key);
        }
        setPriority(key, value);
    }

    @Override
    public void remove(K key) {
        pop(key);
    }

    /**
     * Removes the top element and returns its key.
     *
     * @throws EmptyQueueException if the queue is empty
     */
    public K pop() {
        return popTopNode().key;
    }

    /**
     * Removes {@code key} and returns its value.
     *
     * @throws KeyNotFoundException if {@code key} is absent
     */
    public V pop(K key) {
        Integer pos = position.remove(key);
        if (pos == null) {
            throw new KeyNotFoundException(key);
        }
        return removeAt(pos).value;
    }

    /**
     * Removes {@code key} and returns its value, or returns
     * {@code defaultValue} if the key is absent.
     */
    public V pop(K key, V defaultValue) {
        if (!position.containsKey(key)) {
            return defaultValue;
        }
        return pop(key);
    }

    /**
     * @throws EmptyQueueException if the queue is empty
     */
    public Pair<K, V> popTopItem() {
        Node<K, V, P> top = popTopNode();
        return new Pair<>(top.key, top.value);
    }

    public V popTopValue() {
        return popTopNode().value;
    }

    public K popTopKey() {
        return popTopNode().key;
    }

    public K popTopKeyOrDefault(K defaultKey) {
        return heap.isEmpty() ? defaultKey : popTopNode().key;
    }

    public V popTopValueOrDefault(V defaultValue) {
        return heap.isEmpty() ? defaultValue : popTopNode().value;
    }

    /**
     * Returns the key with the highest priority without removing it.
     *
     * @throws EmptyQueueException if the queue is empty
     */
    public K peekTop() {
        return topNode().key;
    }

    public V peekTopValue() {
        return topNode().value;
    }

    public Pair<K, V> peekTopItem() {
        Node<K, V, P> top = topNode();
        return new Pair<>(top.key, top.value);
    }

    public K peekTopOrDefault(K defaultKey) {
        return heap.isEmpty() ? defaultKey : heap.get(0).key;
    }

    public V peekTopValueOrDefault(V defaultValue) {
        return heap.isEmpty() ? defaultValue : heap.get(0).value;
    }

    /**
     * Inserts an item and removes the top item in a single pass. Cheaper than
     * {@link #addItem} followed by {@link #popTopItem}, with the same result.
     *
     * @return the removed item, which is the new item itself if nothing in the
     *         queue outranks it
     * @throws KeyAlreadyExistsException if {@code key} is already queued
     */
    public Pair<K, V> pushThenPopTop(K key, V value) {
        if (position.containsKey(key)) {
            throw new KeyAlreadyExistsException(key);
        }
        P priority = keyFn.apply(value);
        if (heap.isEmpty() || !precedence.precedes(heap.get(0).priority, priority)) {
            return new Pair<>(key, value);
        }
        Node<K, V, P> top = heap.get(0);
        heap.set(0, new Node<>(key, value, priority));
        position.remove(top.key);
        position.put(key, 0);
        modCount++;
        sink(0);
        return new Pair<>(top.key, top.value);
    }

    /**
     * Relabels {@code oldKey} as {@code newKey}, keeping its value and place.
     *
     * @throws KeyAlreadyExistsException if {@code newKey} is already queued
     * @throws KeyNotFoundException if {@code oldKey} is absent
     */
    public void renameKey(K oldKey, K newKey) {
        if (position.containsKey(newKey)) {
            throw new KeyAlreadyExistsException(newKey);
        }
        Integer pos = position.remove(oldKey);
        if (pos == null) {
            throw new KeyNotFoundException(oldKey);
        }
        position.put(newKey, pos);
        heap.get(pos).key = newKey;
        modCount++;
    }

    /**
     * Exchanges the values (and so the priorities) of two keys in constant
     * time. The heap is not reordered; only the key labels move.
     *
     * @throws KeyNotFoundException if either key is absent
     */
    public void swapPriorities(K keyA, K keyB) {
        Integer posA = position.get(keyA);
        if (posA == null) {
            throw new KeyNotFoundException(keyA);
        }
        Integer posB = position.get(keyB);
        if (posB == null) {
            throw new KeyNotFoundException(keyB);
        }
        heap.get(posA).key = keyB;
        heap.get(posB).key = keyA;
        position.put(keyA, posB);
        position.put(keyB, posA);
        modCount++;
    }

    /**
     * Rebuilds the whole heap, re-deriving every priority from its value.
     * Use after values were mutated in place.
     */
    public void reheapify() {
        for (Node<K, V, P> node : heap) {
            node.priority = keyFn.apply(node.value);
        }
        modCount++;
        heapify();
    }

    /**
     * Re-derives the priority of a single key whose value was mutated in
     * place and moves it to its proper slot.
     *
     * @throws KeyNotFoundException if {@code key} is absent
     */
    public void reheapify(K key) {
        Integer pos = position.get(key);
        if (pos == null) {
            throw new KeyNotFoundException(key);
        }
        Node<K, V, P> node = heap.get(pos);
        node.priority = keyFn.apply(node.value);
        modCount++;
        repair(pos);
    }

    @Override
    public void clear() {
        heap.clear();
        position.clear();
        modCount++;
    }

    /**
     * Returns an independent queue with the same configuration and contents.
     * Value objects are shared, nodes and index are not.
     */
    public IndexedPriorityQueue<K, V, P> copy() {
        IndexedPriorityQueue<K, V, P> other = new IndexedPriorityQueue<>(precedence, keyFn);
        for (Node<K, V, P> node : heap) {
            other.position.put(node.key, other.heap.size());
            other.heap.add(node.copy());
        }
        return other;
    }

    // Destructive iteration

    /**
     * Removes keys one by one in priority order as the iterator advances.
     */
    public Iterator<K> drainKeys() {
        return new DrainIterator<>(node -> node.key);
    }

    public Iterator<V> drainValues() {
        return new DrainIterator<>(node -> node.value);
    }

    public Iterator<Pair<K, V>> drainItems() {
        return new DrainIterator<>(node -> new Pair<>(node.key, node.value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexedPriorityQueue)) {
            return false;
        }
        return toMap().equals(((IndexedPriorityQueue<?, ?, ?>) o).toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("IndexedPriorityQueue{");
        for (int i = 0; i < heap.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Node<K, V, P> node = heap.get(i);
            sb.append(node.key).append(": ").append(node.value);
        }
        return sb.append('}').toString();
    }

    // Views for invariant checks in tests

    List<Node<K, V, P>> heapView() {
        return Collections.unmodifiableList(heap);
    }

    Map<K, Integer> positionView() {
        return Collections.unmodifiableMap(position);
    }

    // Heap algorithms

    private Node<K, V, P> nodeFor(K key) {
        Integer pos = position.get(key);
        if (pos == null) {
            throw new KeyNotFoundException(key);
        }
        return heap.get(pos);
    }

    private Node<K, V, P> topNode() {
        if (heap.isEmpty()) {
            throw new EmptyQueueException();
        }
        return heap.get(0);
    }

    // Adds a node without restoring heap order; callers heapify afterwards.
    private void append(K key, V value) {
        if (position.containsKey(key)) {
            throw new KeyAlreadyExistsException(key);
        }
        position.put(key, heap.size());
        heap.add(new Node<>(key, value, keyFn.apply(value)));
    }

    private Node<K, V, P> popTopNode() {
        if (heap.isEmpty()) {
            throw new EmptyQueueException();
        }
        Node<K, V, P> end = heap.remove(heap.size() - 1);
        modCount++;
        if (heap.isEmpty()) {
            position.remove(end.key);
            return end;
        }
        Node<K, V, P> top = heap.get(0);
        position.remove(top.key);
        heap.set(0, end);
        position.put(end.key, 0);
        sink(0);
        return top;
    }

    // The index entry of the removed node must already be gone.
    private Node<K, V, P> removeAt(int pos) {
        Node<K, V, P> removed = heap.get(pos);
        Node<K, V, P> end = heap.remove(heap.size() - 1);
        modCount++;
        if (end != removed) {
            heap.set(pos, end);
            position.put(end.key, pos);
            repair(pos);
        }
        return removed;
    }

    private void heapify() {
        // Leaves are already heaps.
        for (int pos = heap.size() / 2 - 1; pos >= 0; pos--) {
            sink(pos);
        }
    }

    // Moves the node at pos up or down, whichever way its priority demands.
    private void repair(int pos) {
        Node<K, V, P> node = heap.get(pos);
        int end = heap.size();
        int parentPos = (pos - 1) >> 1;
        int childPos = 2 * pos + 1;
        if (pos > 0 && precedes(node, heap.get(parentPos))) {
            swim(pos, 0);
        } else if (childPos < end) {
            int otherPos = childPos + 1;
            if (otherPos < end && !precedes(heap.get(childPos), heap.get(otherPos))) {
                childPos = otherPos;
            }
            if (precedes(heap.get(childPos), node)) {
                sink(pos);
            }
        }
    }

    /*
     * Floyd's variant: walk the hole at top down to a leaf, always promoting
     * the better child, then let the displaced node swim back up. Saves
     * comparisons when the node is heavy, as after a pop.
     */
    private void sink(int top) {
        int end = heap.size();
        int pos = top;
        Node<K, V, P> node = heap.get(pos);
        int childPos = 2 * pos + 1;
        try {
            while (childPos < end) {
                int otherPos = childPos + 1;
                if (otherPos < end && !precedes(heap.get(childPos), heap.get(otherPos))) {
                    childPos = otherPos;
                }
                Node<K, V, P> child = heap.get(childPos);
                heap.set(pos, child);
                position.put(child.key, pos);
                pos = childPos;
                childPos = 2 * pos + 1;
            }
        } finally {
            // the hole at pos always gets the node back, even if precedence threw
            heap.set(pos, node);
            position.put(node.key, pos);
        }
        swim(pos, top);
    }

    private void swim(int pos, int top) {
        Node<K, V, P> node = heap.get(pos);
        try {
            while (pos > top) {
                int parentPos = (pos - 1) >> 1;
                Node<K, V, P> parent = heap.get(parentPos);
                if (!precedes(node, parent)) {
                    break;
                }
                heap.set(pos, parent);
                position.put(parent.key, pos);
                pos = parentPos;
            }
        } finally {
            heap.set(pos, node);
            position.put(node.key, pos);
        }
    }

    private boolean precedes(Node<K, V, P> a, Node<K, V, P> b) {
        return precedence.precedes(a.priority, b.priority);
    }

    private final class KeyIterator implements Iterator<K> {
        private final int expectedModCount = modCount;
        private int cursor;

        @Override
        public boolean hasNext() {
            return cursor < heap.size();
        }

        @Override
        public K next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (cursor >= heap.size()) {
                throw new NoSuchElementException();
            }
            return heap.get(cursor++).key;
        }
    }

    private final class DrainIterator<T> implements Iterator<T> {
        private final Function<Node<K, V, P>, T> extractor;

        DrainIterator(Function<Node<K, V, P>, T> extractor) {
            this.extractor = extractor;
        }

        @Override
        public boolean hasNext() {
            return !heap.isEmpty();
        }

        @Override
        public T next() {
            if (heap.isEmpty()) {
                throw new NoSuchElementException();
            }
            return extractor.apply(popTopNode());
        }
    }
}
