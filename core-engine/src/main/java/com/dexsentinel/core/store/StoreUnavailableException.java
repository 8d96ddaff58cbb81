package com.dexsentinel.core.store;

/**
 * Thrown by a {@link RecordStore} whose backend cannot be reached.
 *
 * @since 1.0.0
 */
public class StoreUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
