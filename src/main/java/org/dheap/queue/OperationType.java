package org.dheap.queue;

/**
 * Mutating queue operations reported to an {@link OperationListener}.
 *
 * <p>{@code insertMany} reports as {@code INSERT} and every extraction of {@code popMany}
 * as {@code POP}. By-index updates report as their identity-based counterparts.</p>
 */
public enum OperationType {
    INSERT,
    POP,
    INCREASE_PRIORITY,
    DECREASE_PRIORITY,
    UPDATE_PRIORITY
}
