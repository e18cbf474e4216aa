package io.groupstream.transport.client;

import io.groupstream.transport.impl.HttpResponses;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.*;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;

/**
 * Relays one streaming response from a dispatcher to a client connection.
 * <p>
 * The upstream connection shares the client channel's event loop. Upstream reads
 * pause while the client is not writable and resume on {@link #resume()}, so a
 * slow client never buffers more than one socket's worth in the router.
 */
@Slf4j
public final class StreamProxy {
    private final ChannelHandlerContext downstream;
    private final HttpRequest request;
    private volatile Channel upstream;

    private StreamProxy(final ChannelHandlerContext downstream, final HttpRequest request) {
        this.downstream = downstream;
        this.request = request;
    }

    /**
     * Connects to {@code targetUrl} and starts relaying. Answers 502 on the client
     * connection when the upstream fails before its response head arrives.
     */
    public static StreamProxy open(final ChannelHandlerContext downstream,
                                   final HttpRequest request,
                                   final String targetUrl,
                                   final int connectTimeoutMillis) {
        final StreamProxy proxy = new StreamProxy(downstream, request);
        proxy.connect(URI.create(targetUrl), connectTimeoutMillis);
        return proxy;
    }

    private void connect(final URI target, final int connectTimeoutMillis) {
        final String host = target.getHost();
        final int port = target.getPort() == -1 ? 80 : target.getPort();
        final String path = target.getRawPath() + (target.getRawQuery() == null ? "" : "?" + target.getRawQuery());

        final Bootstrap b = new Bootstrap()
                .group(downstream.channel().eventLoop())
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpClientCodec())
                                .addLast(new Relay());
                    }
                });

        b.connect(host, port).addListener((ChannelFutureListener) cf -> {
            if (!cf.isSuccess()) {
                log.error("Proxy connect to {} failed: {}", target, cf.cause().toString());
                HttpResponses.error(downstream, request, HttpResponseStatus.BAD_GATEWAY,
                        "Upstream dispatcher unreachable", true);
                return;
            }
            upstream = cf.channel();
            downstream.channel().closeFuture().addListener(f -> upstream.close());

            final FullHttpRequest req = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, path);
            req.headers()
                    .set(HttpHeaderNames.HOST, host + ":" + port)
                    .set(HttpHeaderNames.ACCEPT, HttpResponses.NDJSON)
                    .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            upstream.writeAndFlush(req);
            log.debug("Proxying {} to {}", request.uri(), target);
        });
    }

    /** Client became writable again. */
    public void resume() {
        final Channel up = upstream;
        if (up != null && downstream.channel().isWritable()) {
            up.config().setAutoRead(true);
        }
    }

    public void close() {
        final Channel up = upstream;
        if (up != null) up.close();
    }

    private final class Relay extends ChannelInboundHandlerAdapter {
        private boolean started;
        private boolean finished;

        @Override
        public void channelRead(final ChannelHandlerContext ctx, final Object msg) {
            if (msg instanceof HttpResponse head) {
                started = true;
                final HttpResponse copy = new DefaultHttpResponse(HttpVersion.HTTP_1_1, head.status(),
                        head.headers().copy());
                copy.headers().remove(HttpHeaderNames.CONNECTION);
                downstream.write(copy);
            }
            if (msg instanceof HttpContent content) {
                if (content instanceof LastHttpContent) {
                    finished = true;
                    downstream.writeAndFlush(content).addListener(ChannelFutureListener.CLOSE);
                    ctx.close();
                    return;
                }
                downstream.write(content);
            }
            if (!downstream.channel().isWritable()) {
                ctx.channel().config().setAutoRead(false);
            }
        }

        @Override
        public void channelReadComplete(final ChannelHandlerContext ctx) {
            downstream.flush();
        }

        @Override
        public void channelInactive(final ChannelHandlerContext ctx) {
            if (!started) {
                HttpResponses.error(downstream, request, HttpResponseStatus.BAD_GATEWAY,
                        "Upstream dispatcher closed the connection", true);
            } else if (!finished) {
                downstream.close();
            }
        }

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            log.error("Proxy stream for {} failed: {}", request.uri(), cause.toString());
            ctx.close();
        }
    }
}
