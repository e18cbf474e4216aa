package io.groupstream.config.type;

/**
 * The two ways a groupstream process can run: the public {@link #ROUTER} front door
 * or a per-group {@link #DISPATCHER}.
 */
public enum ServiceRole {
    /**
     * Resolves entities to groups, provisions dispatchers and proxies client streams.
     */
    ROUTER,
    /**
     * Consumes one group's derived log and fans events out to subscribers.
     */
    DISPATCHER
}
