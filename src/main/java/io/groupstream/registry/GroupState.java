package io.groupstream.registry;

/**
 * Lifecycle of a group as seen by the registry.
 */
public enum GroupState {
    UNKNOWN,
    /** A provisioner is running; callers wait on it. */
    PROVISIONING,
    ACTIVE,
    /** Endpoint failed health checks; next access re-provisions. */
    DEGRADED,
    STOPPED
}
