package io.groupstream.transport.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.groupstream.config.impl.ApplicationInfo;
import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.deploy.impl.InProcessDeploymentPlatform;
import io.groupstream.grouping.GroupingResolver;
import io.groupstream.grouping.impl.StaticGroupingStrategy;
import io.groupstream.registry.GroupRegistry;
import io.groupstream.routing.RouteDecision;
import io.groupstream.routing.RouterServer;
import io.groupstream.routing.RoutingController;
import io.groupstream.state.StateQuery;
import io.groupstream.support.InMemoryEventLog;
import io.groupstream.support.LineStream;
import io.groupstream.support.TestConfigs;
import io.groupstream.transport.client.HttpEndpointProbe;
import io.groupstream.transport.client.HttpJsonClient;
import io.groupstream.transport.codec.EventCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class RouterHttpTest {
    private static final Duration WAIT = Duration.ofSeconds(10);

    private final InMemoryEventLog eventLog = new InMemoryEventLog();
    private final HttpJsonClient http = new HttpJsonClient();
    private RoutingController controller;
    private RouterServer server;
    private String base;

    /* Knows one record: ASSET-42 / temp. */
    private static final StateQuery STATE = (entity, item) -> {
        if (!entity.equals("ASSET-42")) return Optional.empty();
        final JsonNode record = EventCodec.MAPPER.createObjectNode()
                .put("asset_uuid", entity)
                .put("id", "temp")
                .put("value", "21.5");
        if (item == null) {
            final ObjectNode all = EventCodec.MAPPER.createObjectNode().put("asset_uuid", entity);
            all.putArray("dataItems").add(record);
            return Optional.of(all);
        }
        return item.equals("temp") ? Optional.of(record) : Optional.empty();
    };

    private void start(final String routingMode) throws Exception {
        start(routingMode, STATE, Map.of());
    }

    private void start(final String routingMode,
                       final StateQuery state,
                       final Map<String, Object> overrides) throws Exception {
        final Map<String, Object> m = new HashMap<>(overrides);
        m.put("routingMode", routingMode);
        m.put("staticGroups", Map.of("ASSET-42", "Weld", "B17", "Paint"));
        final ServiceConfig cfg = TestConfigs.router(m);
        final StaticGroupingStrategy strategy = new StaticGroupingStrategy(cfg.getStaticGroups());
        final ApplicationInfo info = new ApplicationInfo("1.2.3", "acme");
        controller = new RoutingController(new GroupingResolver(strategy, cfg.groupCacheTtl()),
                new GroupRegistry(cfg.provisionTimeout().plus(cfg.probeTimeout())), strategy,
                new InProcessDeploymentPlatform(eventLog, info),
                HttpEndpointProbe.readiness(http, cfg.probeTimeout()), cfg);
        server = new RouterServer(cfg, controller, state, info);
        server.start();
        base = "http://127.0.0.1:" + server.port();
    }

    @AfterEach
    void tearDown() {
        if (server != null) server.close();
        if (controller != null) controller.close();
        http.close();
    }

    @Test
    void proxiesTheGroupStream() throws Exception {
        start("proxy");

        try (LineStream stream = LineStream.open(base + "/asset_stream?asset_uuid=ASSET-42")) {
            assertEquals(200, stream.status());
            assertEquals(HttpResponses.NDJSON, stream.header("content-type"));

            eventLog.append("B17", null, "{\"v\":\"paint\"}");
            eventLog.append("ASSET-42", "temp", "{\"v\":\"weld\"}");

            final JsonNode line = stream.next(WAIT);
            assertNotNull(line);
            assertEquals("ASSET-42", line.get("asset_uuid").asText());
            assertEquals("weld", line.get("payload").get("v").asText());
        }
    }

    @Test
    void redirectsToTheGroupDispatcher() throws Exception {
        start("redirect");

        final HttpResponse<String> res = LineStream.get(base + "/asset_stream?asset_uuid=ASSET-42&id=temp&x=1");

        assertEquals(307, res.statusCode());
        final String location = res.headers().firstValue("location").orElseThrow();
        assertTrue(location.startsWith("http://127.0.0.1:"), location);
        assertTrue(location.contains("/group/Weld/asset_stream?asset_uuid=ASSET-42&id=temp"), location);
        assertFalse(location.contains("x=1"), location);

        try (LineStream stream = LineStream.open(location)) {
            assertEquals(200, stream.status());
            eventLog.append("ASSET-42", "temp", "{}");
            assertNotNull(stream.next(WAIT));
        }
    }

    @Test
    void unknownEntityIsNotFound() throws Exception {
        start("proxy");

        final HttpResponse<String> res = LineStream.get(base + "/asset_stream?asset_uuid=nobody");

        assertEquals(404, res.statusCode());
        final JsonNode body = EventCodec.MAPPER.readTree(res.body());
        assertTrue(body.get("detail").asText().contains("nobody"));
        assertFalse(body.get("retryable").asBoolean());
    }

    @Test
    void groupPathOnlyServesKnownGroups() throws Exception {
        start("redirect");

        final HttpResponse<String> injected =
                LineStream.get(base + "/group/x%3B%20DROP%20STREAM%20foo/asset_stream?asset_uuid=ASSET-42");
        assertEquals(404, injected.statusCode());
        assertFalse(EventCodec.MAPPER.readTree(injected.body()).get("retryable").asBoolean());
        assertEquals(404, LineStream.get(base + "/group/Nowhere/asset_stream?asset_uuid=ASSET-42").statusCode());
        assertTrue(controller.getRegistry().snapshot().isEmpty(), "unknown groups are never provisioned");

        final HttpResponse<String> known = LineStream.get(base + "/group/Paint/asset_stream?asset_uuid=B17");
        assertEquals(307, known.statusCode());
        assertTrue(known.headers().firstValue("location").orElseThrow().contains("/group/Paint/asset_stream"));
        assertEquals(List.of("Paint"), List.copyOf(controller.getRegistry().snapshot().keySet()));
    }

    @Test
    void saturatedRouterAnswersServiceUnavailable() throws Exception {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final StateQuery slow = (entity, item) -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.empty();
        };
        start("proxy", slow, Map.of("routingThreads", 1, "routingQueueCapacity", 0));

        final CompletableFuture<HttpResponse<String>> first = CompletableFuture.supplyAsync(() -> {
            try {
                return LineStream.get(base + "/asset_state?asset_uuid=ASSET-42");
            } catch (final Exception e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        final HttpResponse<String> busy = LineStream.get(base + "/asset_state?asset_uuid=ASSET-42");
        assertEquals(503, busy.statusCode());
        assertTrue(EventCodec.MAPPER.readTree(busy.body()).get("retryable").asBoolean());

        release.countDown();
        assertEquals(404, first.get(5, TimeUnit.SECONDS).statusCode());
        assertEquals(200, LineStream.get(base + "/health").statusCode());
    }

    @Test
    void missingEntityIsBadRequest() throws Exception {
        start("proxy");

        assertEquals(400, LineStream.get(base + "/asset_stream").statusCode());
        assertEquals(400, LineStream.get(base + "/asset_state").statusCode());
    }

    @Test
    void assetStateComesFromTheStateQuery() throws Exception {
        start("proxy");

        final HttpResponse<String> one = LineStream.get(base + "/asset_state?asset_uuid=ASSET-42&id=temp");
        assertEquals(200, one.statusCode());
        assertEquals("21.5", EventCodec.MAPPER.readTree(one.body()).get("value").asText());

        final HttpResponse<String> all = LineStream.get(base + "/asset_state?asset_uuid=ASSET-42");
        assertEquals(1, EventCodec.MAPPER.readTree(all.body()).get("dataItems").size());

        final HttpResponse<String> none = LineStream.get(base + "/asset_state?asset_uuid=ASSET-42&id=rpm");
        assertEquals(404, none.statusCode());
        assertEquals("No data found for the given asset_uuid and id.",
                EventCodec.MAPPER.readTree(none.body()).get("detail").asText());
    }

    @Test
    void readinessListsNonActiveGroups() throws Exception {
        start("proxy");

        assertEquals(200, LineStream.get(base + "/ready").statusCode());

        controller.routeGroup("Paint");
        controller.getRegistry().markDegraded("Paint", "test");

        final HttpResponse<String> res = LineStream.get(base + "/ready");
        assertEquals(503, res.statusCode());
        assertEquals("DEGRADED", EventCodec.MAPPER.readTree(res.body()).get("issues").get("group:Paint").asText());
    }

    @Test
    void healthAndInfo() throws Exception {
        start("proxy");

        assertEquals(200, LineStream.get(base + "/health").statusCode());
        final JsonNode info = EventCodec.MAPPER.readTree(LineStream.get(base + "/info").body());
        assertEquals("router", info.get("role").asText());
        assertEquals("1.2.3", info.get("version").asText());
    }

    @Test
    void targetUrlForwardsOnlyKnownParameters() {
        final String url = RouterRequestHandler.targetUrl(new RouteDecision("Weld Line", "http://h:1"), Map.of(
                "asset_uuid", List.of("A42"),
                "after", List.of("17"),
                "secret", List.of("x")));

        assertEquals("http://h:1/group/Weld%20Line/asset_stream?asset_uuid=A42&after=17", url);
    }
}
