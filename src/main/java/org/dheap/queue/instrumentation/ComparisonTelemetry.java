package org.dheap.queue.instrumentation;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of comparator invocations per operation type.
 */
@Value
@Builder
public class ComparisonTelemetry {

    /**
     * Comparisons made while inserting (single or bulk).
     */
    long insertComparisons;

    /**
     * Comparisons made while extracting the root.
     */
    long popComparisons;

    /**
     * Comparisons made by increase-priority walks toward the root.
     */
    long increasePriorityComparisons;

    /**
     * Comparisons made by decrease-priority walks toward the leaves.
     */
    long decreasePriorityComparisons;

    /**
     * Comparisons made by direction-agnostic updates.
     */
    long updatePriorityComparisons;

    /**
     * Sum over every operation type.
     */
    public long totalComparisons() {
        return insertComparisons
                + popComparisons
                + increasePriorityComparisons
                + decreasePriorityComparisons
                + updatePriorityComparisons;
    }
}
