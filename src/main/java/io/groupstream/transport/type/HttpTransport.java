package io.groupstream.transport.type;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpServerKeepAliveHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.function.Supplier;

/**
 * Netty HTTP/1.1 server. Requests are aggregated (they carry no bodies of note);
 * responses may be streamed by the handler. A fresh handler is created per connection.
 */
@Slf4j
public class HttpTransport {
    private static final int MAX_REQUEST_BYTES = 64 * 1024;

    private final String host;
    @Getter private int port;
    private final Supplier<? extends ChannelHandler> handlerFactory;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public HttpTransport(final String host, final int port, final Supplier<? extends ChannelHandler> handlerFactory) {
        this.host = host;
        this.port = port;
        this.handlerFactory = handlerFactory;
    }

    public void start() throws InterruptedException {
        final IoHandlerFactory factory = NioIoHandler.newFactory();

        /*
         * 1 boss thread accepting connections, default worker count for I/O.
         * Streaming sessions are drained on their channel's worker thread.
         */
        bossGroup = new MultiThreadIoEventLoopGroup(1, factory);
        workerGroup = new MultiThreadIoEventLoopGroup(0, factory);

        final ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpServerKeepAliveHandler());
                        p.addLast(new HttpObjectAggregator(MAX_REQUEST_BYTES));
                        p.addLast(handlerFactory.get());
                    }
                })
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        final ChannelFuture f = b.bind(host, port).sync();
        serverChannel = f.channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("HTTP transport listening on {}:{}", host, port);
    }

    public void stop() {
        if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
        log.info("HTTP transport on port {} stopped", port);
    }
}
