package org.dheap.queue;

import lombok.Builder;
import lombok.Value;

/**
 * Construction-time configuration for {@link IndexedPriorityQueue}.
 */
@Value
@Builder
public class PriorityQueueConfig {
    static final int DEFAULT_ARITY = 2;

    /**
     * Maximum number of children per node. Must be &gt;= 1.
     */
    @Builder.Default
    int arity = DEFAULT_ARITY;

    /**
     * Pre-allocation hint for the backing store and position index. Must be non-negative.
     */
    @Builder.Default
    int initialCapacity = 0;

    /**
     * Hooks invoked around mutating operations.
     */
    @Builder.Default
    OperationListener operationListener = OperationListener.NONE;

    /**
     * Returns the binary-heap configuration.
     */
    public static PriorityQueueConfig defaults() {
        return PriorityQueueConfig.builder().build();
    }

    /**
     * Returns a configuration with the given arity and default everything else.
     */
    public static PriorityQueueConfig ofArity(int arity) {
        return PriorityQueueConfig.builder()
                .arity(arity)
                .build();
    }
}
