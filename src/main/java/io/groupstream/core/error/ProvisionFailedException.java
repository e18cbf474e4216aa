package io.groupstream.core.error;

/**
 * Provisioning a group's dispatcher failed. The registry entry has already been
 * rolled back when this is thrown, so a later request starts clean.
 */
public final class ProvisionFailedException extends RoutingException {

    public ProvisionFailedException(final String message) {
        super(message);
    }

    public ProvisionFailedException(final String message, final Throwable cause) {
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
