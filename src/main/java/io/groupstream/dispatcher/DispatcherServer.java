package io.groupstream.dispatcher;

import io.groupstream.config.impl.ApplicationInfo;
import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.log.type.LogConsumerFactory;
import io.groupstream.transport.impl.DispatcherRequestHandler;
import io.groupstream.transport.type.HttpTransport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * A dispatcher together with its HTTP surface: one group, one process or one
 * in-process instance.
 */
@Slf4j
public final class DispatcherServer implements AutoCloseable {
    @Getter
    private final GroupDispatcher dispatcher;
    private final HttpTransport transport;
    private final String advertisedHost;

    public DispatcherServer(final ServiceConfig cfg,
                            final LogConsumerFactory consumerFactory,
                            final ApplicationInfo info) {
        this.dispatcher = GroupDispatcher.fromConfig(cfg, consumerFactory);
        this.transport = new HttpTransport(cfg.getHttpHost(), cfg.getHttpPort(),
                () -> new DispatcherRequestHandler(dispatcher, info));
        this.advertisedHost = cfg.getAdvertisedHost();
    }

    /**
     * Starts consuming and binds the HTTP port.
     *
     * @return the endpoint URL clients and the router use
     */
    public String start() throws InterruptedException {
        dispatcher.start();
        transport.start();
        final String endpoint = endpoint();
        log.info("Dispatcher for group [{}] serving at {}", dispatcher.getGroup(), endpoint);
        return endpoint;
    }

    public String endpoint() {
        return "http://" + advertisedHost + ":" + transport.getPort();
    }

    /** Drains the dispatcher, then closes the listener. */
    @Override
    public void close() {
        dispatcher.close();
        transport.stop();
    }
}
