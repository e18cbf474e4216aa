package io.groupstream.core.error;

/**
 * A collaborator (metadata service, log broker, deployment platform) could not
 * be reached, or a bounded wait ran out.
 */
public final class ServiceUnavailableException extends RoutingException {

    public ServiceUnavailableException(final String message) {
        super(message);
    }

    public ServiceUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public int httpStatus() {
        return 503;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
