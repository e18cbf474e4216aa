package io.groupstream.transport.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.groupstream.config.impl.ApplicationInfo;
import io.groupstream.config.type.RoutingMode;
import io.groupstream.routing.Readiness;
import io.groupstream.routing.RouteDecision;
import io.groupstream.routing.RoutingController;
import io.groupstream.state.StateQuery;
import io.groupstream.transport.client.StreamProxy;
import io.groupstream.transport.codec.EventCodec;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Public HTTP surface of the router. Routing may provision a dispatcher and
 * therefore blocks; it runs on {@code routingPool}, never on the event loop.
 * One instance per connection.
 */
@Slf4j
public final class RouterRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    /** Query parameters forwarded to dispatchers; everything else is dropped. */
    static final List<String> FORWARDED_PARAMS = List.of("asset_uuid", "id", "start_time", "end_time", "after");

    private static final String GROUP_PREFIX = "/group/";
    private static final String STREAM_SUFFIX = "/asset_stream";

    private final RoutingController controller;
    private final StateQuery stateQuery;
    private final RoutingMode mode;
    private final ExecutorService routingPool;
    private final ApplicationInfo info;
    private final int connectTimeoutMillis;

    private StreamProxy proxy;

    public RouterRequestHandler(final RoutingController controller,
                                final StateQuery stateQuery,
                                final RoutingMode mode,
                                final ExecutorService routingPool,
                                final ApplicationInfo info,
                                final int connectTimeoutMillis) {
        this.controller = controller;
        this.stateQuery = stateQuery;
        this.mode = mode;
        this.routingPool = routingPool;
        this.info = info;
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final FullHttpRequest full) {
        if (proxy != null) return;
        // the aggregated body is released after this call; keep the head only
        final HttpRequest req = new DefaultHttpRequest(full.protocolVersion(), full.method(), full.uri(),
                full.headers().copy());
        if (!HttpMethod.GET.equals(req.method())) {
            HttpResponses.error(ctx, req, HttpResponseStatus.METHOD_NOT_ALLOWED, "Only GET is supported", false);
            return;
        }

        final QueryStringDecoder qs = new QueryStringDecoder(req.uri());
        final String path = qs.path();
        final Map<String, List<String>> params = qs.parameters();

        if (path.equals(STREAM_SUFFIX)) {
            final String entity = HttpResponses.param(params, "asset_uuid");
            if (entity == null) {
                HttpResponses.error(ctx, req, HttpResponseStatus.BAD_REQUEST, "asset_uuid is required", false);
                return;
            }
            offload(ctx, req, () -> controller.route(entity), d -> forward(ctx, req, d, params));
        } else if (path.startsWith(GROUP_PREFIX) && path.endsWith(STREAM_SUFFIX)) {
            final String group = QueryStringDecoder.decodeComponent(
                    path.substring(GROUP_PREFIX.length(), path.length() - STREAM_SUFFIX.length()));
            offload(ctx, req, () -> new RouteDecision(group, controller.routeKnownGroup(group)),
                    d -> forward(ctx, req, d, params));
        } else {
            switch (path) {
                case "/asset_state" -> assetState(ctx, req, params);
                case "/ready" -> ready(ctx, req);
                case "/health" -> HttpResponses.json(ctx, req, HttpResponseStatus.OK,
                        EventCodec.MAPPER.createObjectNode().put("status", "ok"));
                case "/info" -> HttpResponses.json(ctx, req, HttpResponseStatus.OK,
                        EventCodec.MAPPER.createObjectNode()
                                .put("version", info.version())
                                .put("manufacturer", info.manufacturer())
                                .put("role", "router"));
                default -> HttpResponses.error(ctx, req, HttpResponseStatus.NOT_FOUND, "Not found: " + path, false);
            }
        }
    }

    private void forward(final ChannelHandlerContext ctx,
                         final HttpRequest req,
                         final RouteDecision decision,
                         final Map<String, List<String>> params) {
        final String target = targetUrl(decision, params);
        if (mode == RoutingMode.REDIRECT) {
            log.debug("Redirecting {} to {}", req.uri(), target);
            HttpResponses.redirect(ctx, req, target);
            return;
        }
        if (!ctx.channel().isActive()) return;
        proxy = StreamProxy.open(ctx, req, target, connectTimeoutMillis);
    }

    static String targetUrl(final RouteDecision decision, final Map<String, List<String>> params) {
        final QueryStringEncoder enc = new QueryStringEncoder(decision.endpoint() + GROUP_PREFIX
                + URLEncoder.encode(decision.group(), StandardCharsets.UTF_8).replace("+", "%20") + STREAM_SUFFIX);
        for (final String name : FORWARDED_PARAMS) {
            final List<String> values = params.get(name);
            if (values == null) continue;
            for (final String v : values) enc.addParam(name, v);
        }
        return enc.toString();
    }

    private void assetState(final ChannelHandlerContext ctx, final HttpRequest req, final Map<String, List<String>> params) {
        final String entity = HttpResponses.param(params, "asset_uuid");
        if (entity == null) {
            HttpResponses.error(ctx, req, HttpResponseStatus.BAD_REQUEST, "asset_uuid is required", false);
            return;
        }
        final String item = HttpResponses.param(params, "id");
        offload(ctx, req, () -> stateQuery.stateOf(entity, item), (Optional<JsonNode> state) -> {
            if (state.isPresent()) {
                HttpResponses.json(ctx, req, HttpResponseStatus.OK, state.get());
            } else {
                HttpResponses.error(ctx, req, HttpResponseStatus.NOT_FOUND,
                        item == null ? "No data found for the given asset_uuid."
                                : "No data found for the given asset_uuid and id.", false);
            }
        });
    }

    private void ready(final ChannelHandlerContext ctx, final HttpRequest req) {
        offload(ctx, req, controller::readiness, (Readiness r) -> {
            final ObjectNode body = EventCodec.MAPPER.createObjectNode();
            body.put("status", r.ready() ? "ready" : "not ready");
            final ObjectNode issues = body.putObject("issues");
            r.issues().forEach(issues::put);
            HttpResponses.json(ctx, req, r.ready() ? HttpResponseStatus.OK : HttpResponseStatus.SERVICE_UNAVAILABLE, body);
        });
    }

    /* Runs blocking work off the event loop, continues on it. A saturated pool answers 503. */
    private <T> void offload(final ChannelHandlerContext ctx,
                             final HttpRequest req,
                             final Supplier<T> work,
                             final Consumer<T> then) {
        final CompletableFuture<T> pending;
        try {
            pending = CompletableFuture.supplyAsync(work, routingPool);
        } catch (final RejectedExecutionException e) {
            log.warn("Routing pool saturated, rejecting {}", req.uri());
            HttpResponses.error(ctx, req, HttpResponseStatus.SERVICE_UNAVAILABLE, "Router busy, retry later", true);
            return;
        }
        pending.whenCompleteAsync((value, ex) -> {
                    if (ex != null) {
                        HttpResponses.failure(ctx, req, ex instanceof CompletionException && ex.getCause() != null
                                ? ex.getCause() : ex);
                    } else {
                        then.accept(value);
                    }
                }, ctx.executor());
    }

    @Override
    public void channelWritabilityChanged(final ChannelHandlerContext ctx) throws Exception {
        if (proxy != null) proxy.resume();
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (proxy != null) proxy.close();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.debug("Router connection error: {}", cause.toString());
        ctx.close();
    }
}
