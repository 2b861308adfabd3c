package org.dheap.queue.instrumentation;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.dheap.queue.IndexedPriorityQueue;
import org.dheap.queue.OperationListener;
import org.dheap.queue.OperationType;
import org.dheap.queue.PriorityCompare;

import java.util.Objects;

/**
 * Comparator wrapper that counts how many comparisons each queue operation performs.
 * <p>
 * Attach the same instance as both the comparator and the operation listener of an
 * {@link IndexedPriorityQueue}. Comparisons made outside an operation are not counted.
 * </p>
 *
 * @param <T> item type.
 */
public final class InstrumentedPriorityCompare<T> implements PriorityCompare<T>, OperationListener {

    private final PriorityCompare<? super T> delegate;

    @Getter
    @Accessors(fluent = true)
    private final ComparisonStats stats = new ComparisonStats();

    // null between operations
    private OperationType currentOperation;

    public InstrumentedPriorityCompare(PriorityCompare<? super T> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean higherPriority(T a, T b) {
        if (currentOperation != null) {
            stats.increment(currentOperation);
        }
        return delegate.higherPriority(a, b);
    }

    @Override
    public void beforeOperation(OperationType type) {
        this.currentOperation = Objects.requireNonNull(type, "type");
    }

    @Override
    public void afterOperation(OperationType type) {
        this.currentOperation = null;
    }
}
