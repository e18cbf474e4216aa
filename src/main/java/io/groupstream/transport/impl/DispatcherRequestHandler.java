package io.groupstream.transport.impl;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.groupstream.config.impl.ApplicationInfo;
import io.groupstream.core.error.GroupNotFoundException;
import io.groupstream.dispatcher.GroupDispatcher;
import io.groupstream.session.SessionFilter;
import io.groupstream.session.SubscriptionSession;
import io.groupstream.transport.codec.EventCodec;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * HTTP surface of a dispatcher: event streams, readiness, health and info.
 * One instance per connection.
 */
@Slf4j
public final class DispatcherRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final String GROUP_PREFIX = "/group/";
    private static final String STREAM_SUFFIX = "/asset_stream";

    private final GroupDispatcher dispatcher;
    private final ApplicationInfo info;

    private SubscriptionSession session;
    private SessionStreamer streamer;

    public DispatcherRequestHandler(final GroupDispatcher dispatcher, final ApplicationInfo info) {
        this.dispatcher = dispatcher;
        this.info = info;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final FullHttpRequest req) {
        if (session != null) {
            // a streaming connection accepts no further requests
            return;
        }
        if (!HttpMethod.GET.equals(req.method())) {
            HttpResponses.error(ctx, req, HttpResponseStatus.METHOD_NOT_ALLOWED, "Only GET is supported", false);
            return;
        }

        final QueryStringDecoder qs = new QueryStringDecoder(req.uri());
        final String path = qs.path();
        try {
            if (path.equals(STREAM_SUFFIX)) {
                openStream(ctx, req, qs.parameters());
            } else if (path.startsWith(GROUP_PREFIX) && path.endsWith(STREAM_SUFFIX)) {
                final String group = QueryStringDecoder.decodeComponent(
                        path.substring(GROUP_PREFIX.length(), path.length() - STREAM_SUFFIX.length()));
                if (!group.equals(dispatcher.getGroup())) {
                    throw new GroupNotFoundException("This dispatcher serves group " + dispatcher.getGroup()
                            + ", not " + group);
                }
                openStream(ctx, req, qs.parameters());
            } else {
                switch (path) {
                    case "/ready" -> {
                        if (servesRequestedGroup(ctx, req, qs.parameters())) ready(ctx, req);
                    }
                    case "/health" -> {
                        if (servesRequestedGroup(ctx, req, qs.parameters())) {
                            HttpResponses.json(ctx, req, HttpResponseStatus.OK,
                                    EventCodec.MAPPER.createObjectNode().put("status", "ok"));
                        }
                    }
                    case "/info" -> info(ctx, req);
                    default -> HttpResponses.error(ctx, req, HttpResponseStatus.NOT_FOUND, "Not found: " + path, false);
                }
            }
        } catch (final RuntimeException e) {
            HttpResponses.failure(ctx, req, e);
        }
    }

    private void openStream(final ChannelHandlerContext ctx,
                            final FullHttpRequest req,
                            final Map<String, List<String>> params) {
        final String entity = HttpResponses.param(params, "asset_uuid");
        if (entity == null) {
            HttpResponses.error(ctx, req, HttpResponseStatus.BAD_REQUEST, "asset_uuid is required", false);
            return;
        }
        final String after = HttpResponses.param(params, "after");
        final SessionFilter filter = new SessionFilter(entity, HttpResponses.param(params, "id"));
        try {
            session = dispatcher.open(filter, after);
        } catch (final IllegalArgumentException badToken) {
            HttpResponses.error(ctx, req, HttpResponseStatus.BAD_REQUEST, badToken.getMessage(), false);
            return;
        }
        streamer = new SessionStreamer(ctx.channel(), session);
        streamer.start();
    }

    /** An optional {@code group} parameter must name this dispatcher's group; 409 otherwise. */
    private boolean servesRequestedGroup(final ChannelHandlerContext ctx,
                                         final FullHttpRequest req,
                                         final Map<String, List<String>> params) {
        final String expected = HttpResponses.param(params, "group");
        if (expected == null || expected.equals(dispatcher.getGroup())) {
            return true;
        }
        HttpResponses.error(ctx, req, HttpResponseStatus.CONFLICT,
                "This dispatcher serves group " + dispatcher.getGroup() + ", not " + expected, false);
        return false;
    }

    private void ready(final ChannelHandlerContext ctx, final FullHttpRequest req) {
        final boolean ready = dispatcher.isReady();
        final ObjectNode body = EventCodec.MAPPER.createObjectNode();
        body.put("status", ready ? "ready" : "not ready");
        body.put("state", dispatcher.getState().name());
        HttpResponses.json(ctx, req, ready ? HttpResponseStatus.OK : HttpResponseStatus.SERVICE_UNAVAILABLE, body);
    }

    private void info(final ChannelHandlerContext ctx, final FullHttpRequest req) {
        final ObjectNode body = EventCodec.MAPPER.createObjectNode();
        body.put("version", info.version());
        body.put("manufacturer", info.manufacturer());
        body.put("group", dispatcher.getGroup());
        body.put("log", dispatcher.getLogId());
        body.put("state", dispatcher.getState().name());
        body.put("sessions", dispatcher.sessionCount());
        body.put("consumed", dispatcher.consumedCount());
        HttpResponses.json(ctx, req, HttpResponseStatus.OK, body);
    }

    @Override
    public void channelWritabilityChanged(final ChannelHandlerContext ctx) throws Exception {
        if (streamer != null && ctx.channel().isWritable()) {
            streamer.resume();
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            session.close("client disconnected");
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.debug("Dispatcher connection error: {}", cause.toString());
        if (session != null) session.close("connection error: " + cause.getMessage());
        ctx.close();
    }
}
