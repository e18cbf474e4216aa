package io.groupstream.routing;

import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.core.backoff.Backoff;
import io.groupstream.core.error.ProvisionFailedException;
import io.groupstream.core.error.ServiceUnavailableException;
import io.groupstream.deploy.DeploymentPlatforms;
import io.groupstream.deploy.type.DeploymentPlatform;
import io.groupstream.grouping.type.GroupingStrategy;
import io.groupstream.registry.EndpointProbe;
import io.groupstream.registry.Provisioner;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Brings one group online: derived log, dispatcher, then readiness polling until
 * the dispatcher's consumer is attached or the provisioning timeout elapses.
 * A dispatcher that was already running before this attempt is never stopped on
 * timeout; its open sessions stay attached.
 */
@Slf4j
final class GroupProvisioner {
    private final GroupingStrategy strategy;
    private final DeploymentPlatform platform;
    private final EndpointProbe probe;
    private final ServiceConfig cfg;
    private final Duration timeout;

    GroupProvisioner(final GroupingStrategy strategy,
                     final DeploymentPlatform platform,
                     final EndpointProbe probe,
                     final ServiceConfig cfg) {
        this.strategy = strategy;
        this.platform = platform;
        this.probe = probe;
        this.cfg = cfg;
        this.timeout = cfg.provisionTimeout();
    }

    Provisioner forGroup(final String group) {
        return () -> provision(group);
    }

    String provision(final String group) throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        final String serviceId = DeploymentPlatforms.serviceId(group);

        strategy.createDerivedLog(group);
        final boolean wasRunning = platform.isRunning(serviceId);
        final String endpoint = platform.ensureRunning(serviceId, cfg.forDispatcher(group, cfg.getHttpPort()));
        log.info("Dispatcher {} for group [{}] started at {}, waiting for readiness", serviceId, group, endpoint);

        final Backoff backoff = new Backoff(Duration.ofMillis(100), Duration.ofSeconds(2));
        while (true) {
            if (probe.check(group, endpoint)) {
                log.info("Dispatcher {} ready after {} probes", serviceId, backoff.getAttempts() + 1);
                return endpoint;
            }
            final long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                if (wasRunning) {
                    log.warn("Dispatcher {} still running but not ready within {} ms, keeping it", serviceId,
                            timeout.toMillis());
                    throw new ServiceUnavailableException("Dispatcher for group " + group
                            + " is running but not ready, retry later");
                }
                platform.stop(serviceId);
                throw new ProvisionFailedException("Dispatcher for group " + group + " not ready within "
                        + timeout.toMillis() + " ms");
            }
            Thread.sleep(Math.min(remainingMillis, backoff.next().toMillis()));
        }
    }
}
