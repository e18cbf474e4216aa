package io.groupstream.routing;

import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.core.error.GroupNotFoundException;
import io.groupstream.core.error.RoutingException;
import io.groupstream.deploy.DeploymentPlatforms;
import io.groupstream.deploy.type.DeploymentPlatform;
import io.groupstream.grouping.GroupingResolver;
import io.groupstream.grouping.type.GroupingStrategy;
import io.groupstream.registry.EndpointProbe;
import io.groupstream.registry.GroupRegistry;
import io.groupstream.registry.GroupState;
import io.groupstream.registry.RegistryEntry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * entity -> group -> live dispatcher endpoint.
 * <p>
 * Safe under any request concurrency: the registry guarantees one provisioning
 * per group, and an endpoint is only handed out after its dispatcher reported
 * ready (consumer attached).
 */
@Slf4j
public final class RoutingController implements AutoCloseable {
    private final GroupingResolver resolver;
    @Getter
    private final GroupRegistry registry;
    private final GroupingStrategy strategy;
    private final DeploymentPlatform platform;
    private final GroupProvisioner provisioner;
    private final ServiceConfig cfg;

    public RoutingController(final GroupingResolver resolver,
                             final GroupRegistry registry,
                             final GroupingStrategy strategy,
                             final DeploymentPlatform platform,
                             final EndpointProbe probe,
                             final ServiceConfig cfg) {
        this.resolver = resolver;
        this.registry = registry;
        this.strategy = strategy;
        this.platform = platform;
        this.provisioner = new GroupProvisioner(strategy, platform, probe, cfg);
        this.cfg = cfg;
    }

    /**
     * Initializes the platform and pre-provisions every group currently known,
     * in parallel. Groups that fail are logged and left to on-demand provisioning.
     *
     * @return number of groups provisioned
     */
    public int initialize() throws InterruptedException {
        platform.initialize();

        final List<String> groups;
        try {
            groups = strategy.groups();
        } catch (final RoutingException e) {
            log.warn("Could not enumerate groups at startup, provisioning on demand only: {}", e.getMessage());
            return 0;
        }
        if (groups.isEmpty()) {
            log.info("No groups known at startup");
            return 0;
        }

        log.info("Pre-provisioning {} groups: {}", groups.size(), groups);
        final AtomicInteger ok = new AtomicInteger();
        final ExecutorService pool = Executors.newFixedThreadPool(Math.min(groups.size(), 8), r -> {
            final Thread t = new Thread(r, "pre-provision");
            t.setDaemon(true);
            return t;
        });
        try {
            final List<CompletableFuture<Void>> all = new ArrayList<>();
            for (final String g : groups) {
                all.add(CompletableFuture.runAsync(() -> {
                    try {
                        routeGroup(g);
                        ok.incrementAndGet();
                    } catch (final RuntimeException e) {
                        log.error("Pre-provisioning group [{}] failed: {}", g, e.getMessage());
                    }
                }, pool));
            }
            CompletableFuture.allOf(all.toArray(new CompletableFuture[0]))
                    .get(cfg.getProvisionTimeoutMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (final ExecutionException | TimeoutException e) {
            log.warn("Pre-provisioning did not finish for every group: {}", e.toString());
        } finally {
            pool.shutdownNow();
        }
        log.info("Pre-provisioned {}/{} groups", ok.get(), groups.size());
        return ok.get();
    }

    /**
     * @throws io.groupstream.core.error.GroupNotFoundException      unknown entity
     * @throws io.groupstream.core.error.ServiceUnavailableException collaborator down or wait exceeded
     * @throws io.groupstream.core.error.ProvisionFailedException    dispatcher could not be brought up
     */
    public RouteDecision route(final String entityId) {
        final String group = resolver.resolve(entityId);
        final RouteDecision decision = new RouteDecision(group, routeGroup(group));
        log.debug("Routing {} -> {}", entityId, decision);
        return decision;
    }

    /**
     * Like {@link #routeGroup(String)} for a label supplied by a client: only groups
     * already registered or known to the grouping strategy are routed.
     *
     * @throws GroupNotFoundException for any other label; nothing is provisioned
     */
    public String routeKnownGroup(final String group) {
        if (registry.get(group).isEmpty() && !strategy.groups().contains(group)) {
            throw new GroupNotFoundException("Unknown group " + group);
        }
        return routeGroup(group);
    }

    /** Endpoint of a group's dispatcher, provisioning it on first use. */
    public String routeGroup(final String group) {
        return registry.ensure(group, provisioner.forGroup(group));
    }

    /**
     * Stops every known group's dispatcher, removes its derived log and forgets it.
     */
    public void teardown() {
        final TreeSet<String> groups = new TreeSet<>(registry.snapshot().keySet());
        try {
            groups.addAll(strategy.groups());
        } catch (final RoutingException e) {
            log.warn("Teardown limited to registered groups: {}", e.getMessage());
        }

        for (final String g : groups) {
            log.info("Tearing down group [{}]", g);
            platform.stop(DeploymentPlatforms.serviceId(g));
            try {
                strategy.removeDerivedLog(g);
            } catch (final RuntimeException e) {
                log.warn("Removing derived log of group [{}] failed: {}", g, e.getMessage());
            }
            registry.remove(g);
        }
        resolver.invalidateAll();
    }

    /** Ready when the grouping strategy is ready and every registered group is ACTIVE. */
    public Readiness readiness() {
        final Map<String, String> issues = new LinkedHashMap<>();
        final String grouping = strategy.readinessIssue();
        if (grouping != null) issues.put("grouping_strategy", grouping);

        for (final RegistryEntry e : registry.snapshot().values()) {
            if (e.state() != GroupState.ACTIVE) {
                issues.put("group:" + e.label(), e.state().name());
            }
        }
        return new Readiness(issues.isEmpty(), issues);
    }

    @Override
    public void close() {
        platform.close();
    }
}
