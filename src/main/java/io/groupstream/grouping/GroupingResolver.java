package io.groupstream.grouping;

import io.groupstream.core.backoff.Backoff;
import io.groupstream.core.error.GroupNotFoundException;
import io.groupstream.core.error.ServiceUnavailableException;
import io.groupstream.grouping.type.GroupingStrategy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * entity -> group lookups with a TTL cache in front of the grouping strategy.
 * <p>
 * Callers may see a stale group for up to one TTL after membership changes,
 * unless {@link #invalidate(String)} is called. Lookups that fail with
 * {@link ServiceUnavailableException} are retried with backoff a bounded number of times.
 */
@Slf4j
public final class GroupingResolver {
    private final GroupingStrategy strategy;
    private final long ttlMillis;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration retryInitial;

    private final ConcurrentMap<String, Cached> cache = new ConcurrentHashMap<>();

    public GroupingResolver(final GroupingStrategy strategy, final Duration ttl) {
        this(strategy, ttl, Clock.systemUTC(), 3, Duration.ofMillis(100));
    }

    public GroupingResolver(final GroupingStrategy strategy,
                            final Duration ttl,
                            final Clock clock,
                            final int maxAttempts,
                            final Duration retryInitial) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        this.strategy = strategy;
        this.ttlMillis = ttl.toMillis();
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.retryInitial = retryInitial;
    }

    /**
     * @throws GroupNotFoundException      when the entity belongs to no group
     * @throws ServiceUnavailableException when the metadata service stays unreachable
     */
    public String resolve(final String entityId) {
        final long now = clock.millis();
        final Cached hit = cache.get(entityId);
        if (hit != null && hit.expiresAt() > now) {
            return hit.group();
        }

        final String group = lookup(entityId);
        cache.put(entityId, new Cached(group, now + ttlMillis));
        log.debug("Resolved {} -> group [{}]", entityId, group);
        return group;
    }

    public void invalidate(final String entityId) {
        cache.remove(entityId);
    }

    public void invalidateAll() {
        cache.clear();
    }

    private String lookup(final String entityId) {
        final Backoff backoff = new Backoff(retryInitial, retryInitial.multipliedBy(8));
        while (true) {
            try {
                return strategy.groupOf(entityId)
                        .orElseThrow(() -> new GroupNotFoundException("No group known for entity " + entityId));
            } catch (final ServiceUnavailableException e) {
                if (backoff.getAttempts() + 1 >= maxAttempts) throw e;
                log.warn("Group lookup for {} failed (attempt {}/{}): {}",
                        entityId, backoff.getAttempts() + 1, maxAttempts, e.getMessage());
                try {
                    backoff.pause();
                } catch (final InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ServiceUnavailableException("Interrupted while resolving " + entityId, ie);
                }
            }
        }
    }

    /* A cached lookup, valid until expiresAt (epoch millis). */
    private record Cached(String group, long expiresAt) {
    }
}
