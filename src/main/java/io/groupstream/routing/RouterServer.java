package io.groupstream.routing;

import io.groupstream.config.impl.ApplicationInfo;
import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.state.StateQuery;
import io.groupstream.transport.impl.RouterRequestHandler;
import io.groupstream.transport.type.HttpTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The router's HTTP surface in front of a {@link RoutingController}.
 * Blocking routing work runs on a bounded pool of {@code routingThreads} threads
 * with {@code routingQueueCapacity} waiting slots; requests beyond that get 503.
 */
@Slf4j
public final class RouterServer implements AutoCloseable {
    private final HttpTransport transport;
    private final ExecutorService routingPool;

    public RouterServer(final ServiceConfig cfg,
                        final RoutingController controller,
                        final StateQuery stateQuery,
                        final ApplicationInfo info) {
        final AtomicInteger seq = new AtomicInteger();
        final BlockingQueue<Runnable> queue = cfg.getRoutingQueueCapacity() == 0
                ? new SynchronousQueue<>()
                : new ArrayBlockingQueue<>(cfg.getRoutingQueueCapacity());
        final ThreadPoolExecutor pool = new ThreadPoolExecutor(
                cfg.getRoutingThreads(), cfg.getRoutingThreads(), 60, TimeUnit.SECONDS, queue, r -> {
                    final Thread t = new Thread(r, "routing-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }, new ThreadPoolExecutor.AbortPolicy());
        pool.allowCoreThreadTimeOut(true);
        this.routingPool = pool;
        final int connectTimeout = (int) Math.min(Integer.MAX_VALUE, cfg.getProbeTimeoutMillis());
        this.transport = new HttpTransport(cfg.getHttpHost(), cfg.getHttpPort(),
                () -> new RouterRequestHandler(controller, stateQuery, cfg.getRoutingMode(), routingPool, info,
                        connectTimeout));
    }

    public void start() throws InterruptedException {
        transport.start();
    }

    public int port() {
        return transport.getPort();
    }

    @Override
    public void close() {
        transport.stop();
        routingPool.shutdownNow();
    }
}
