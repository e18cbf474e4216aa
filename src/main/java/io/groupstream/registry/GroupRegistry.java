package io.groupstream.registry;

import io.groupstream.core.error.ProvisionFailedException;
import io.groupstream.core.error.RoutingException;
import io.groupstream.core.error.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * group label -> dispatcher endpoint, with at most one provisioning in flight per group.
 * <p>
 * Entry transitions are atomic per label ({@link ConcurrentHashMap#compute}); the
 * provisioner itself runs outside any lock, on the thread of the caller that
 * installed the PROVISIONING entry. Concurrent callers for the same label wait
 * on that entry's future. Unrelated labels never contend.
 */
@Slf4j
public final class GroupRegistry {
    private final ConcurrentMap<String, RegistryEntry> entries = new ConcurrentHashMap<>();
    private final Duration waitTimeout;
    private final Clock clock;

    public GroupRegistry(final Duration waitTimeout) {
        this(waitTimeout, Clock.systemUTC());
    }

    public GroupRegistry(final Duration waitTimeout, final Clock clock) {
        this.waitTimeout = waitTimeout;
        this.clock = clock;
    }

    /**
     * Returns the endpoint of an ACTIVE entry, provisioning it first when absent,
     * DEGRADED or STOPPED.
     *
     * @throws ProvisionFailedException    when the provisioner fails; the entry is dropped
     * @throws ServiceUnavailableException when waiting on another caller's provisioning
     *                                     exceeds the wait timeout, or when a still-running
     *                                     DEGRADED dispatcher did not recover in time; the
     *                                     DEGRADED entry is then kept
     */
    public String ensure(final String label, final Provisioner provisioner) {
        final RegistryEntry fast = entries.get(label);
        if (fast != null && fast.state() == GroupState.ACTIVE) {
            return fast.endpoint();
        }

        final CompletableFuture<String> mine = new CompletableFuture<>();
        final RegistryEntry[] replaced = new RegistryEntry[1];
        final RegistryEntry current = entries.compute(label, (k, old) -> {
            if (old == null || old.state() == GroupState.DEGRADED
                    || old.state() == GroupState.STOPPED || old.state() == GroupState.UNKNOWN) {
                replaced[0] = old;
                return RegistryEntry.provisioning(k, mine);
            }
            return old;
        });

        if (current.state() == GroupState.ACTIVE) {
            return current.endpoint();
        }
        if (current.inFlight() != mine) {
            return await(label, current.inFlight());
        }
        return runProvisioner(label, provisioner, mine, replaced[0]);
    }

    private String runProvisioner(final String label,
                                  final Provisioner provisioner,
                                  final CompletableFuture<String> mine,
                                  final RegistryEntry replaced) {
        log.info("Provisioning group [{}]", label);
        final String endpoint;
        try {
            endpoint = provisioner.provision();
            if (endpoint == null || endpoint.isBlank()) {
                throw new IllegalStateException("provisioner returned no endpoint");
            }
        } catch (final Exception e) {
            final RoutingException failure = e instanceof RoutingException re
                    ? re
                    : new ProvisionFailedException("Provisioning group " + label + " failed: " + e.getMessage(), e);
            // a DEGRADED dispatcher that is still running stays registered so health checks can revive it
            final RegistryEntry restore = failure instanceof ServiceUnavailableException && replaced != null
                    && replaced.state() == GroupState.DEGRADED ? replaced : null;
            entries.computeIfPresent(label, (k, old) -> old.inFlight() == mine ? restore : old);
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            log.error("Provisioning group [{}] failed: {}", label, e.getMessage());
            mine.completeExceptionally(failure);
            throw failure;
        }

        final long now = clock.millis();
        entries.computeIfPresent(label, (k, old) -> old.inFlight() == mine ? RegistryEntry.active(k, endpoint, now) : old);
        mine.complete(endpoint);
        log.info("Group [{}] ACTIVE at {}", label, endpoint);
        return endpoint;
    }

    private String await(final String label, final CompletableFuture<String> inFlight) {
        try {
            return inFlight.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            throw new ServiceUnavailableException("Group " + label + " is still provisioning, retry later");
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for group " + label, e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof ServiceUnavailableException su) {
                throw new ServiceUnavailableException(su.getMessage(), su);
            }
            if (cause instanceof RoutingException re) {
                throw new ProvisionFailedException(re.getMessage(), re);
            }
            throw new ProvisionFailedException("Provisioning group " + label + " failed: " + cause, cause);
        }
    }

    /** ACTIVE -> DEGRADED; the next {@link #ensure} re-provisions. */
    public boolean markDegraded(final String label, final String reason) {
        final RegistryEntry after = entries.computeIfPresent(label, (k, old) ->
                old.state() == GroupState.ACTIVE ? old.withState(GroupState.DEGRADED) : old);
        final boolean degraded = after != null && after.state() == GroupState.DEGRADED;
        if (degraded) log.warn("Group [{}] DEGRADED: {}", label, reason);
        return degraded;
    }

    /** Records a passed health check; a DEGRADED entry not yet re-provisioned turns ACTIVE again. */
    public void markHealthy(final String label) {
        final long now = clock.millis();
        entries.computeIfPresent(label, (k, old) -> {
            if (old.state() == GroupState.DEGRADED) {
                log.info("Group [{}] recovered", k);
                return old.healthy(now);
            }
            return old.state() == GroupState.ACTIVE ? old.healthy(now) : old;
        });
    }

    public Optional<RegistryEntry> get(final String label) {
        return Optional.ofNullable(entries.get(label));
    }

    public Optional<RegistryEntry> remove(final String label) {
        return Optional.ofNullable(entries.remove(label));
    }

    /** Copy of all entries, sorted by label. */
    public Map<String, RegistryEntry> snapshot() {
        return new TreeMap<>(entries);
    }
}
