package org.dheap.queue;

/**
 * Hooks invoked around every mutating queue operation that consults the comparator.
 * <p>
 * {@link #afterOperation(OperationType)} runs even when the operation fails.
 * </p>
 */
public interface OperationListener {

    /**
     * No-op listener used when nothing is attached.
     */
    OperationListener NONE = new OperationListener() {
    };

    default void beforeOperation(OperationType type) {
    }

    default void afterOperation(OperationType type) {
    }
}
