package io.groupstream.core.error;

/**
 * Base of every failure the routing path surfaces to a client.
 * Subclasses fix the HTTP status and whether a client may retry.
 */
public abstract class RoutingException extends RuntimeException {

    protected RoutingException(final String message) {
        super(message);
    }

    protected RoutingException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public abstract int httpStatus();

    public abstract boolean retryable();
}
