package io.groupstream.routing;

import com.fasterxml.jackson.databind.JsonNode;
import io.groupstream.config.impl.ApplicationInfo;
import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.core.error.GroupNotFoundException;
import io.groupstream.core.error.ProvisionFailedException;
import io.groupstream.core.error.ServiceUnavailableException;
import io.groupstream.deploy.DeploymentPlatforms;
import io.groupstream.deploy.impl.InProcessDeploymentPlatform;
import io.groupstream.deploy.type.DeploymentPlatform;
import io.groupstream.grouping.GroupingResolver;
import io.groupstream.grouping.impl.StaticGroupingStrategy;
import io.groupstream.registry.EndpointProbe;
import io.groupstream.registry.GroupHealthMonitor;
import io.groupstream.registry.GroupRegistry;
import io.groupstream.registry.GroupState;
import io.groupstream.support.Await;
import io.groupstream.support.InMemoryEventLog;
import io.groupstream.support.LineStream;
import io.groupstream.support.TestConfigs;
import io.groupstream.transport.client.HttpEndpointProbe;
import io.groupstream.transport.client.HttpJsonClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class RoutingControllerTest {
    private static final Map<String, String> GROUPS = Map.of(
            "ASSET-42", "Weld",
            "ASSET-43", "Weld",
            "B17", "Paint");

    /* Delegates to the in-process platform and counts start requests per service. */
    private static final class CountingPlatform implements DeploymentPlatform {
        final DeploymentPlatform delegate;
        final Map<String, AtomicInteger> starts = new ConcurrentHashMap<>();
        final Set<String> stopped = ConcurrentHashMap.newKeySet();

        CountingPlatform(final DeploymentPlatform delegate) {
            this.delegate = delegate;
        }

        @Override
        public void initialize() {
            delegate.initialize();
        }

        @Override
        public String ensureRunning(final String serviceId, final ServiceConfig dispatcherConfig) {
            starts.computeIfAbsent(serviceId, k -> new AtomicInteger()).incrementAndGet();
            return delegate.ensureRunning(serviceId, dispatcherConfig);
        }

        @Override
        public boolean isRunning(final String serviceId) {
            return delegate.isRunning(serviceId);
        }

        @Override
        public void stop(final String serviceId) {
            stopped.add(serviceId);
            delegate.stop(serviceId);
        }

        @Override
        public void close() {
            delegate.close();
        }

        int startsOf(final String group) {
            final AtomicInteger n = starts.get(DeploymentPlatforms.serviceId(group));
            return n == null ? 0 : n.get();
        }
    }

    private InMemoryEventLog eventLog;
    private HttpJsonClient http;
    private CountingPlatform platform;
    private RoutingController controller;

    @BeforeEach
    void setUp() {
        http = new HttpJsonClient();
        eventLog = new InMemoryEventLog();
        platform = new CountingPlatform(new InProcessDeploymentPlatform(eventLog,
                new ApplicationInfo("test", "groupstream")));
    }

    @AfterEach
    void tearDown() {
        if (controller != null) controller.close();
        http.close();
    }

    private RoutingController controller(final EndpointProbe probe, final Map<String, Object> overrides) {
        final Map<String, Object> m = new HashMap<>(overrides);
        m.put("staticGroups", GROUPS);
        final ServiceConfig cfg = TestConfigs.router(m);
        final StaticGroupingStrategy strategy = new StaticGroupingStrategy(cfg.getStaticGroups());
        controller = new RoutingController(new GroupingResolver(strategy, cfg.groupCacheTtl()),
                new GroupRegistry(cfg.provisionTimeout().plus(cfg.probeTimeout())),
                strategy, platform, probe, cfg);
        return controller;
    }

    private RoutingController controller() {
        return controller(HttpEndpointProbe.readiness(http, Duration.ofSeconds(1)), Map.of());
    }

    @Test
    void routesEntityToAReadyDispatcherOfItsGroup() throws Exception {
        final RouteDecision d = controller().route("ASSET-42");

        assertEquals("Weld", d.group());
        assertTrue(d.endpoint().startsWith("http://127.0.0.1:"), d.endpoint());
        assertTrue(platform.isRunning(DeploymentPlatforms.serviceId("Weld")));
        assertEquals(200, LineStream.get(d.endpoint() + "/ready").statusCode());
        assertEquals(GroupState.ACTIVE, controller.getRegistry().get("Weld").orElseThrow().state());
    }

    @Test
    void entitiesOfOneGroupShareOneDispatcher() {
        final RoutingController c = controller();

        final RouteDecision a = c.route("ASSET-42");
        final RouteDecision b = c.route("ASSET-43");
        final RouteDecision p = c.route("B17");

        assertEquals(a.endpoint(), b.endpoint());
        assertNotEquals(a.endpoint(), p.endpoint());
        assertEquals(1, platform.startsOf("Weld"));
        assertEquals(1, platform.startsOf("Paint"));
    }

    @Test
    void concurrentFirstRequestsProvisionOnce() throws Exception {
        final RoutingController c = controller();
        final int callers = 12;
        final CountDownLatch go = new CountDownLatch(1);
        final ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            final List<Future<RouteDecision>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                final String entity = i % 2 == 0 ? "ASSET-42" : "ASSET-43";
                results.add(pool.submit(() -> {
                    go.await();
                    return c.route(entity);
                }));
            }
            go.countDown();

            final Set<String> endpoints = ConcurrentHashMap.newKeySet();
            for (final Future<RouteDecision> f : results) endpoints.add(f.get(20, TimeUnit.SECONDS).endpoint());

            assertEquals(1, endpoints.size());
            assertEquals(1, platform.startsOf("Weld"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void unknownEntityIsNotFound() {
        final RoutingController c = controller();

        assertThrows(GroupNotFoundException.class, () -> c.route("nobody"));
        assertTrue(c.getRegistry().snapshot().isEmpty());
    }

    @Test
    void groupRoutesOnlyServeGroupsTheStrategyKnows() {
        final RoutingController c = controller();

        assertThrows(GroupNotFoundException.class, () -> c.routeKnownGroup("Nowhere"));
        assertThrows(GroupNotFoundException.class, () -> c.routeKnownGroup("x; DROP STREAM foo"));
        assertTrue(c.getRegistry().snapshot().isEmpty());
        assertTrue(platform.starts.isEmpty());

        assertTrue(c.routeKnownGroup("Paint").startsWith("http://127.0.0.1:"));
    }

    @Test
    void logOutageKeepsTheDispatcherAndItsSessions() throws Exception {
        final RoutingController c = controller(HttpEndpointProbe.readiness(http, Duration.ofSeconds(1)),
                Map.of("provisionTimeoutMillis", 300));
        final GroupHealthMonitor monitor = new GroupHealthMonitor(c.getRegistry(),
                HttpEndpointProbe.liveness(http, Duration.ofSeconds(1)), Duration.ofHours(1));
        final String endpoint = c.route("ASSET-42").endpoint();

        try (LineStream stream = LineStream.open(endpoint + "/group/Weld/asset_stream?asset_uuid=ASSET-42")) {
            assertEquals(200, stream.status());

            eventLog.failNextAttaches(Integer.MAX_VALUE);
            eventLog.failNextPolls(1);
            Await.until(() -> readyStatus(endpoint) == 503, Duration.ofSeconds(5), "dispatcher detached from log");

            monitor.checkAll();
            assertEquals(GroupState.ACTIVE, c.getRegistry().get("Weld").orElseThrow().state());
            assertEquals(endpoint, c.route("ASSET-43").endpoint());

            // a degraded group whose dispatcher still runs is not torn down by a slow re-provision
            c.getRegistry().markDegraded("Weld", "forced");
            assertThrows(ServiceUnavailableException.class, () -> c.route("ASSET-42"));
            assertFalse(platform.stopped.contains(DeploymentPlatforms.serviceId("Weld")));
            assertEquals(GroupState.DEGRADED, c.getRegistry().get("Weld").orElseThrow().state());

            eventLog.failNextAttaches(0);
            Await.until(() -> readyStatus(endpoint) == 200, Duration.ofSeconds(5), "dispatcher reattached");
            monitor.checkAll();
            assertEquals(GroupState.ACTIVE, c.getRegistry().get("Weld").orElseThrow().state());
            assertEquals(endpoint, c.route("ASSET-42").endpoint());

            eventLog.append("ASSET-42", "temp", "{\"v\":1}");
            final JsonNode line = stream.next(Duration.ofSeconds(10));
            assertNotNull(line, "session survived the outage");
            assertEquals("ASSET-42", line.get("asset_uuid").asText());
        } finally {
            monitor.close();
        }
    }

    private static int readyStatus(final String endpoint) {
        try {
            return LineStream.get(endpoint + "/ready").statusCode();
        } catch (final Exception e) {
            return -1;
        }
    }

    @Test
    void initializePreProvisionsEveryKnownGroup() throws Exception {
        final RoutingController c = controller();

        assertEquals(2, c.initialize());

        assertEquals(Set.of("Paint", "Weld"), c.getRegistry().snapshot().keySet());
        assertTrue(c.readiness().ready());
        c.route("ASSET-42");
        assertEquals(1, platform.startsOf("Weld"));
    }

    @Test
    void readinessReportsGroupsThatAreNotActive() throws Exception {
        final RoutingController c = controller();
        c.initialize();

        c.getRegistry().markDegraded("Weld", "probe failed");

        final Readiness r = c.readiness();
        assertFalse(r.ready());
        assertEquals(Map.of("group:Weld", "DEGRADED"), r.issues());
    }

    @Test
    void dispatcherThatNeverBecomesReadyFailsProvisioning() {
        final RoutingController c = controller((group, ep) -> false, Map.of("provisionTimeoutMillis", 300));

        assertThrows(ProvisionFailedException.class, () -> c.route("B17"));

        assertTrue(platform.stopped.contains(DeploymentPlatforms.serviceId("Paint")));
        assertTrue(c.getRegistry().get("Paint").isEmpty(), "failed provisioning is rolled back");
    }

    @Test
    void teardownStopsAndForgetsEveryGroup() throws Exception {
        final RoutingController c = controller();
        c.initialize();

        c.teardown();

        assertTrue(c.getRegistry().snapshot().isEmpty());
        assertFalse(platform.isRunning(DeploymentPlatforms.serviceId("Weld")));
        assertFalse(platform.isRunning(DeploymentPlatforms.serviceId("Paint")));
    }
}
