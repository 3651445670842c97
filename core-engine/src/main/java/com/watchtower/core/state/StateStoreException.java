package com.watchtower.core.state;

/**
 * Raised when the ephemeral or durable state store cannot serve a request.
 *
 * <p>
 * Never recovered locally: it aborts the current evaluate or commit call and
 * the caller decides whether to retry.
 * </p>
 *
 * @since 1.0.0
 */
public class StateStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
