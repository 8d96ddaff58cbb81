package com.dexsentinel.core.model;

/**
 * Machine-readable outcome code carried by every {@link OperationResult}.
 *
 * @since 1.0.0
 */
public enum Reason {

    OK,

    /** {@code start()} called on a running processor. */
    ALREADY_RUNNING,

    /** {@code stop()} called on a stopped processor; reported as a no-op success. */
    ALREADY_STOPPED,

    /** Ingestion attempted while the processor is stopped. */
    NOT_RUNNING,

    /** The record lacks the identity fields needed for evaluation. */
    INVALID_RECORD,

    UNKNOWN_RULE,

    UNKNOWN_CHANNEL,

    INVALID_LEVEL,

    /** Alert dropped as a duplicate of a recent one. */
    SUPPRESSED,

    /** Alert dropped because the per-minute budget is exhausted. */
    RATE_LIMITED
}
