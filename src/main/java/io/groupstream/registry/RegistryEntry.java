package io.groupstream.registry;

import java.util.concurrent.CompletableFuture;

/**
 * Immutable view of one group in the registry. Transitions replace the entry.
 *
 * @param inFlight completes with the endpoint when the running provisioner
 *                 finishes; {@code null} unless {@code state} is PROVISIONING
 */
public record RegistryEntry(String label,
                            GroupState state,
                            String endpoint,
                            long lastHealthTs,
                            CompletableFuture<String> inFlight) {

    static RegistryEntry provisioning(final String label, final CompletableFuture<String> inFlight) {
        return new RegistryEntry(label, GroupState.PROVISIONING, null, 0L, inFlight);
    }

    static RegistryEntry active(final String label, final String endpoint, final long now) {
        return new RegistryEntry(label, GroupState.ACTIVE, endpoint, now, null);
    }

    RegistryEntry withState(final GroupState s) {
        return new RegistryEntry(label, s, endpoint, lastHealthTs, inFlight);
    }

    RegistryEntry healthy(final long now) {
        return new RegistryEntry(label, GroupState.ACTIVE, endpoint, now, null);
    }

    public boolean inFlightProvision() {
        return state == GroupState.PROVISIONING;
    }
}
