package com.indexedpq.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Strict precedence between two priorities.
 * <p>
 * {@code precedes(a, b)} returns true if an element with priority {@code a}
 * belongs closer to the top of the queue than one with priority {@code b}.
 * The relation must be a strict weak order: irreflexive and transitive.
 * Priorities the relation cannot compare should make it throw; the exception
 * reaches the caller of the queue operation unchanged.
 *
 * @param <P> the priority type
 */
@FunctionalInterface
public interface Precedence<P> {

    boolean precedes(P a, P b);

    /**
     * Smaller priorities first (min-queue).
     */
    static <T extends Comparable<? super T>> Precedence<T> naturalOrder() {
        return (a, b) -> a.compareTo(b) < 0;
    }

    /**
     * Larger priorities first (max-queue).
     */
    static <T extends Comparable<? super T>> Precedence<T> reverseOrder() {
        return (a, b) -> a.compareTo(b) > 0;
    }

    static <T extends Comparable<? super T>> Precedence<T> naturalOrder(boolean reverse) {
        return reverse ? reverseOrder() : naturalOrder();
    }

    static <T> Precedence<T> fromComparator(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        return (a, b) -> comparator.compare(a, b) < 0;
    }

    /**
     * The opposite sense of this precedence: {@code b} precedes {@code a}.
     */
    default Precedence<P> reversed() {
        return (a, b) -> precedes(b, a);
    }
}
