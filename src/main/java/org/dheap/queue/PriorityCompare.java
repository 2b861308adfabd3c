package org.dheap.queue;

/**
 * Ordering strategy injected into an {@link IndexedPriorityQueue}.
 * <p>
 * The queue never knows whether it is min- or max-oriented; it only asks which of two
 * items belongs closer to the root. Implementations must be strict:
 * {@code higherPriority(x, x)} is {@code false}.
 * </p>
 *
 * @param <T> item type.
 */
@FunctionalInterface
public interface PriorityCompare<T> {

    /**
     * Returns whether {@code a} must sit closer to the root than {@code b}.
     *
     * @param a candidate item.
     * @param b item compared against.
     * @return true when {@code a} has strictly higher priority than {@code b}.
     */
    boolean higherPriority(T a, T b);
}
