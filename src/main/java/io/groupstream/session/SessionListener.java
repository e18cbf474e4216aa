package io.groupstream.session;

/**
 * Callbacks from a {@link SubscriptionSession} to whatever writes it to the network.
 * Both run on the caller's thread and must not block.
 */
public interface SessionListener {

    /** Events are waiting in the session's queue. */
    void onAvailable(SubscriptionSession session);

    /** The session was closed; {@code reason} is for logs only. */
    void onClosed(SubscriptionSession session, String reason);

    SessionListener NOOP = new SessionListener() {
        @Override
        public void onAvailable(final SubscriptionSession session) {
        }

        @Override
        public void onClosed(final SubscriptionSession session, final String reason) {
        }
    };
}
