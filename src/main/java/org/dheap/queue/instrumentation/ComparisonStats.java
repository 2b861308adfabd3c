package org.dheap.queue.instrumentation;

import org.dheap.queue.OperationType;

import java.util.Arrays;
import java.util.Objects;

/**
 * Mutable comparison counters, one per {@link OperationType}.
 * <p>
 * <strong>Thread Safety:</strong> NOT thread-safe, like the queue it observes.
 * </p>
 */
public final class ComparisonStats {

    private final long[] counts = new long[OperationType.values().length];

    /**
     * Adds one comparison to {@code type}.
     */
    void increment(OperationType type) {
        counts[type.ordinal()]++;
    }

    /**
     * Returns comparisons recorded for {@code type}.
     */
    public long count(OperationType type) {
        return counts[Objects.requireNonNull(type, "type").ordinal()];
    }

    /**
     * Returns comparisons recorded across all operation types.
     */
    public long total() {
        long total = 0L;
        for (long count : counts) {
            total += count;
        }
        return total;
    }

    /**
     * Zeroes every counter.
     */
    public void reset() {
        Arrays.fill(counts, 0L);
    }

    /**
     * Captures the current counters as an immutable value.
     */
    public ComparisonTelemetry snapshot() {
        return ComparisonTelemetry.builder()
                .insertComparisons(count(OperationType.INSERT))
                .popComparisons(count(OperationType.POP))
                .increasePriorityComparisons(count(OperationType.INCREASE_PRIORITY))
                .decreasePriorityComparisons(count(OperationType.DECREASE_PRIORITY))
                .updatePriorityComparisons(count(OperationType.UPDATE_PRIORITY))
                .build();
    }

    @Override
    public String toString() {
        return "ComparisonStats{" +
                "insert=" + count(OperationType.INSERT) +
                ", pop=" + count(OperationType.POP) +
                ", increasePriority=" + count(OperationType.INCREASE_PRIORITY) +
                ", decreasePriority=" + count(OperationType.DECREASE_PRIORITY) +
                ", updatePriority=" + count(OperationType.UPDATE_PRIORITY) +
                ", total=" + total() +
                '}';
    }
}
