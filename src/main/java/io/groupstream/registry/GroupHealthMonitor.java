package io.groupstream.registry;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically checks every ACTIVE or DEGRADED group and updates the registry.
 * The check is a liveness check: a dispatcher waiting out a log outage is alive.
 * Checks run on the monitor thread, never inside a registry transition.
 */
@Slf4j
public final class GroupHealthMonitor implements AutoCloseable {
    private final GroupRegistry registry;
    private final EndpointProbe probe;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public GroupHealthMonitor(final GroupRegistry registry, final EndpointProbe probe, final Duration interval) {
        this.registry = registry;
        this.probe = probe;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "group-health");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        final long ms = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::checkAll, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Group health checks every {} ms", ms);
    }

    /** One revalidation pass over the registry. */
    public void checkAll() {
        for (final RegistryEntry e : registry.snapshot().values()) {
            if (e.state() != GroupState.ACTIVE && e.state() != GroupState.DEGRADED) continue;
            try {
                if (probe.check(e.label(), e.endpoint())) {
                    registry.markHealthy(e.label());
                } else {
                    registry.markDegraded(e.label(), "endpoint " + e.endpoint() + " not alive");
                }
            } catch (final RuntimeException ex) {
                registry.markDegraded(e.label(), "probe failed: " + ex.getMessage());
            }
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
