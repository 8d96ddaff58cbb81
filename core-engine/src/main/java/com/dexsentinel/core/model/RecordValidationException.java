package com.dexsentinel.core.model;

/**
 * Thrown when a record lacks the identity fields required for evaluation.
 *
 * <p>
 * The stream processor recovers from this locally: the record is counted as
 * a processing error and no event is emitted.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RecordValidationException(String message) {
        super(message);
    }
}
