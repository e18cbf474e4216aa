package io.groupstream.deploy.impl;

import io.groupstream.config.impl.ApplicationInfo;
import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.core.error.ServiceUnavailableException;
import io.groupstream.deploy.type.DeploymentPlatform;
import io.groupstream.dispatcher.DispatcherServer;
import io.groupstream.dispatcher.DispatcherState;
import io.groupstream.log.type.LogConsumerFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Runs dispatchers inside the router's JVM, each on its own ephemeral port.
 */
@Slf4j
public final class InProcessDeploymentPlatform implements DeploymentPlatform {
    private final LogConsumerFactory consumerFactory;
    private final ApplicationInfo info;
    private final ConcurrentMap<String, DispatcherServer> servers = new ConcurrentHashMap<>();

    public InProcessDeploymentPlatform(final LogConsumerFactory consumerFactory, final ApplicationInfo info) {
        this.consumerFactory = consumerFactory;
        this.info = info;
    }

    @Override
    public void initialize() {
        log.info("In-process deployment platform ready");
    }

    @Override
    public String ensureRunning(final String serviceId, final ServiceConfig dispatcherConfig) {
        final DispatcherServer existing = servers.get(serviceId);
        if (existing != null && isLive(existing)) {
            return existing.endpoint();
        }
        if (existing != null) {
            servers.remove(serviceId, existing);
            existing.close();
        }

        final DispatcherServer server = new DispatcherServer(
                dispatcherConfig.forDispatcher(dispatcherConfig.getGroupLabel(), 0), consumerFactory, info);
        final String endpoint;
        try {
            endpoint = server.start();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            server.close();
            throw new ServiceUnavailableException("Interrupted while starting " + serviceId, e);
        } catch (final Exception e) {
            server.close();
            throw new ServiceUnavailableException("Could not start " + serviceId + ": " + e.getMessage(), e);
        }

        final DispatcherServer raced = servers.putIfAbsent(serviceId, server);
        if (raced != null) {
            server.close();
            return raced.endpoint();
        }
        log.info("Started in-process dispatcher {} at {}", serviceId, endpoint);
        return endpoint;
    }

    @Override
    public boolean isRunning(final String serviceId) {
        final DispatcherServer s = servers.get(serviceId);
        return s != null && isLive(s);
    }

    @Override
    public void stop(final String serviceId) {
        final DispatcherServer s = servers.remove(serviceId);
        if (s != null) {
            log.info("Stopping in-process dispatcher {}", serviceId);
            s.close();
        }
    }

    @Override
    public void close() {
        new ArrayList<>(servers.keySet()).forEach(this::stop);
    }

    private static boolean isLive(final DispatcherServer s) {
        final DispatcherState st = s.getDispatcher().getState();
        return st == DispatcherState.STARTING || st == DispatcherState.CONSUMING;
    }
}
