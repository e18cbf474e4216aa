package io.groupstream.transport.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.groupstream.core.error.RoutingException;
import io.groupstream.transport.codec.EventCodec;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.*;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Shared response helpers for both HTTP surfaces.
 */
@Slf4j
public final class HttpResponses {
    public static final String NDJSON = "application/x-ndjson";

    private HttpResponses() {
    }

    public static void json(final ChannelHandlerContext ctx,
                            final HttpRequest req,
                            final HttpResponseStatus status,
                            final JsonNode body) {
        final ByteBuf buf = Unpooled.copiedBuffer(body.toString(), StandardCharsets.UTF_8);
        final FullHttpResponse res = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, buf);
        res.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .setInt(HttpHeaderNames.CONTENT_LENGTH, buf.readableBytes());
        write(ctx, req, res);
    }

    /** {@code {"detail": ..., "retryable": ...}} */
    public static void error(final ChannelHandlerContext ctx,
                             final HttpRequest req,
                             final HttpResponseStatus status,
                             final String detail,
                             final boolean retryable) {
        final ObjectNode body = EventCodec.MAPPER.createObjectNode();
        body.put("detail", detail);
        body.put("retryable", retryable);
        json(ctx, req, status, body);
    }

    /** Maps routing failures to their status; anything else is a logged 500. */
    public static void failure(final ChannelHandlerContext ctx, final HttpRequest req, final Throwable t) {
        if (t instanceof RoutingException re) {
            log.debug("{} {} -> {}: {}", req.method(), req.uri(), re.httpStatus(), re.getMessage());
            error(ctx, req, HttpResponseStatus.valueOf(re.httpStatus()), re.getMessage(), re.retryable());
        } else {
            log.error("{} {} failed", req.method(), req.uri(), t);
            error(ctx, req, HttpResponseStatus.INTERNAL_SERVER_ERROR, "Internal error: " + t.getMessage(), false);
        }
    }

    public static void redirect(final ChannelHandlerContext ctx, final HttpRequest req, final String location) {
        final FullHttpResponse res = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1,
                HttpResponseStatus.TEMPORARY_REDIRECT, Unpooled.EMPTY_BUFFER);
        res.headers()
                .set(HttpHeaderNames.LOCATION, location)
                .setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
        write(ctx, req, res);
    }

    /** Headers of an endless newline-delimited JSON stream. */
    public static HttpResponse streamHead() {
        final HttpResponse res = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        res.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, NDJSON)
                .set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_CACHE);
        HttpUtil.setTransferEncodingChunked(res, true);
        return res;
    }

    /** First value of a query parameter, or {@code null} when absent or blank. */
    public static String param(final Map<String, List<String>> params, final String name) {
        final List<String> v = params.get(name);
        if (v == null || v.isEmpty() || v.get(0).isBlank()) return null;
        return v.get(0);
    }

    private static void write(final ChannelHandlerContext ctx, final HttpRequest req, final FullHttpResponse res) {
        final boolean keepAlive = HttpUtil.isKeepAlive(req);
        HttpUtil.setKeepAlive(res, keepAlive);
        if (ctx.channel().eventLoop().inEventLoop()) {
            writeNow(ctx, res, keepAlive);
        } else {
            ctx.channel().eventLoop().execute(() -> writeNow(ctx, res, keepAlive));
        }
    }

    private static void writeNow(final ChannelHandlerContext ctx, final FullHttpResponse res, final boolean keepAlive) {
        final var f = ctx.writeAndFlush(res);
        if (!keepAlive) f.addListener(ChannelFutureListener.CLOSE);
    }
}
