package io.groupstream.transport.client;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.*;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Small request/response HTTP client: one connection per request, whole body
 * aggregated, JSON in and out. Used for the metadata service and readiness probes.
 */
@Slf4j
public final class HttpJsonClient implements AutoCloseable {
    private static final int MAX_BODY = 16 * 1024 * 1024;

    private final EventLoopGroup group;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HttpJsonClient() {
        this.group = new MultiThreadIoEventLoopGroup(1, new DefaultThreadFactory("http-client", true),
                NioIoHandler.newFactory());
    }

    public CompletableFuture<HttpResult> get(final String url, final Duration timeout) {
        return request(HttpMethod.GET, url, null, timeout);
    }

    public CompletableFuture<HttpResult> post(final String url, final String json, final Duration timeout) {
        return request(HttpMethod.POST, url, json, timeout);
    }

    /**
     * Sends one request. The future fails with the connect or I/O error, or with a
     * {@link ReadTimeoutException} when no response arrives within {@code timeout}.
     */
    public CompletableFuture<HttpResult> request(final HttpMethod method,
                                                 final String url,
                                                 final String json,
                                                 final Duration timeout) {
        final CompletableFuture<HttpResult> result = new CompletableFuture<>();
        if (closed.get()) {
            result.completeExceptionally(new IllegalStateException("HttpJsonClient is closed"));
            return result;
        }

        final URI uri = URI.create(url);
        final String host = uri.getHost();
        final int port = uri.getPort() == -1 ? 80 : uri.getPort();
        final String path = (uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath())
                + (uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery());

        final Bootstrap b = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
                                .addLast(new HttpClientCodec())
                                .addLast(new HttpObjectAggregator(MAX_BODY))
                                .addLast(new ResponseHandler(result));
                    }
                });

        b.connect(host, port).addListener((ChannelFutureListener) cf -> {
            if (!cf.isSuccess()) {
                result.completeExceptionally(cf.cause());
                return;
            }
            final ByteBuf content = json == null
                    ? Unpooled.EMPTY_BUFFER
                    : Unpooled.copiedBuffer(json, StandardCharsets.UTF_8);
            final FullHttpRequest req = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, path, content);
            req.headers()
                    .set(HttpHeaderNames.HOST, host + ":" + port)
                    .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE)
                    .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON)
                    .set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
            if (json != null) {
                req.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
            }
            cf.channel().writeAndFlush(req).addListener((ChannelFutureListener) wf -> {
                if (!wf.isSuccess()) {
                    result.completeExceptionally(wf.cause());
                    wf.channel().close();
                }
            });
        });
        return result;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<HttpResult> result;

        ResponseHandler(final CompletableFuture<HttpResult> result) {
            this.result = result;
        }

        @Override
        protected void channelRead0(final ChannelHandlerContext ctx, final FullHttpResponse msg) {
            result.complete(new HttpResult(msg.status().code(), msg.content().toString(StandardCharsets.UTF_8)));
            ctx.close();
        }

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            log.debug("HTTP client error: {}", cause.toString());
            result.completeExceptionally(cause);
            ctx.close();
        }

        @Override
        public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
            if (!result.isDone()) {
                result.completeExceptionally(new ClosedChannelException());
            }
            super.channelInactive(ctx);
        }
    }
}
