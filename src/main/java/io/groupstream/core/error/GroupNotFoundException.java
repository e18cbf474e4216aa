package io.groupstream.core.error;

/** The entity has no known group membership. Terminal for the request. */
public final class GroupNotFoundException extends RoutingException {

    public GroupNotFoundException(final String message) {
        super(message);
    }

    @Override
    public int httpStatus() {
        return 404;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
