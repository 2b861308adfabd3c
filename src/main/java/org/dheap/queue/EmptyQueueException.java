package org.dheap.queue;

/**
 * Thrown by {@link IndexedPriorityQueue#front()} when no item is queued.
 * <p>
 * Callers that cannot rule out an empty queue should use {@link IndexedPriorityQueue#peek()} or
 * {@link IndexedPriorityQueue#pop()}, which report emptiness as an empty {@code Optional}.
 * </p>
 */
public final class EmptyQueueException extends IllegalStateException {
    static final String DEFAULT_MESSAGE = "front() called on empty priority queue";

    public EmptyQueueException() {
        this(DEFAULT_MESSAGE);
    }

    public EmptyQueueException(String message) {
        super(message);
    }
}
