package org.dheap.queue;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Caller contract violation raised by {@link IndexedPriorityQueue}.
 *
 * <p>Messages are prefixed with the deterministic reason code, for example
 * {@code [ITEM_NOT_FOUND] ...}. None of these failures are transient.</p>
 */
@Getter
@Accessors(fluent = true)
public final class PriorityQueueException extends RuntimeException {
    public static final String REASON_INVALID_ARITY = "INVALID_ARITY";
    public static final String REASON_ITEM_NOT_FOUND = "ITEM_NOT_FOUND";
    public static final String REASON_INDEX_OUT_OF_BOUNDS = "INDEX_OUT_OF_BOUNDS";
    public static final String REASON_DUPLICATE_ITEM = "DUPLICATE_ITEM";

    private final String reasonCode;

    /**
     * Creates a reason-coded queue failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public PriorityQueueException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded queue failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public PriorityQueueException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    static PriorityQueueException invalidArity(int arity) {
        return new PriorityQueueException(REASON_INVALID_ARITY, "arity must be >= 1, got " + arity);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
