package com.dexsentinel.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Success/failure indicator returned by the public operations of the core.
 *
 * <p>
 * A result always carries a {@link Reason} and a human-readable message; a
 * successful result may additionally carry a value.
 * </p>
 *
 * @param <T> type of the carried value
 * @since 1.0.0
 */
public final class OperationResult<T> {

    private final boolean success;
    private final Reason reason;
    private final String message;
    private final T value;

    private OperationResult(boolean success, Reason reason, String message, T value) {
        this.success = success;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.message = message;
        this.value = value;
    }

    public static <T> OperationResult<T> ok(T value, String message) {
        return new OperationResult<>(true, Reason.OK, message, value);
    }

    public static <T> OperationResult<T> ok(String message) {
        return new OperationResult<>(true, Reason.OK, message, null);
    }

    /**
     * A successful result that did nothing, e.g. stopping a stopped processor.
     */
    public static <T> OperationResult<T> noop(Reason reason, String message) {
        return new OperationResult<>(true, reason, message, null);
    }

    public static <T> OperationResult<T> failure(Reason reason, String message) {
        return new OperationResult<>(false, reason, message, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public Reason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return "OperationResult{" +
                "success=" + success +
                ", reason=" + reason +
                ", message='" + message + '\'' +
                '}';
    }
}
