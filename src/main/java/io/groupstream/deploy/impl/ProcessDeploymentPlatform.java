package io.groupstream.deploy.impl;

import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.core.error.ServiceUnavailableException;
import io.groupstream.deploy.DeploymentPlatforms;
import io.groupstream.deploy.type.DeploymentPlatform;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs each dispatcher as a child JVM of the router, configured entirely through
 * its environment. A dispatcher listens on {@code groupPortBase + md5(group) % 1000}
 * unless that port belongs to another group or is bound by someone else, in which
 * case the next free port in the range is taken. A service keeps its port until stopped.
 * Child output goes to {@code <java.io.tmpdir>/<serviceId>.log}.
 */
@Slf4j
public final class ProcessDeploymentPlatform implements DeploymentPlatform {
    private static final String MAIN_CLASS = "io.groupstream.Application";

    private final ServiceConfig routerConfig;
    private final ConcurrentMap<String, Process> processes = new ConcurrentHashMap<>();
    private final Map<String, Integer> portsByService = new HashMap<>();
    private final Map<Integer, String> servicesByPort = new HashMap<>();

    public ProcessDeploymentPlatform(final ServiceConfig routerConfig) {
        this.routerConfig = routerConfig;
    }

    @Override
    public void initialize() {
        final Path java = javaBinary();
        if (!Files.isExecutable(java)) {
            throw new IllegalStateException("Cannot spawn dispatchers: " + java + " is not executable");
        }
        log.info("Process deployment platform using {}", java);
    }

    @Override
    public String ensureRunning(final String serviceId, final ServiceConfig dispatcherConfig) {
        final String group = dispatcherConfig.getGroupLabel();
        final int port = allocatePort(serviceId, group);
        final String endpoint = "http://" + routerConfig.getAdvertisedHost() + ":" + port;

        final Process existing = processes.get(serviceId);
        if (existing != null && existing.isAlive()) {
            return endpoint;
        }

        final List<String> cmd = List.of(javaBinary().toString(),
                "-cp", System.getProperty("java.class.path"), MAIN_CLASS);
        final ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.environment().putAll(dispatcherConfig.forDispatcher(group, port).toEnvironment());
        final File logFile = Path.of(System.getProperty("java.io.tmpdir"), serviceId + ".log").toFile();
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile));

        final Process started;
        try {
            started = pb.start();
        } catch (final IOException e) {
            releasePort(serviceId);
            throw new ServiceUnavailableException("Could not spawn " + serviceId + ": " + e.getMessage(), e);
        }

        final Process raced = processes.put(serviceId, started);
        if (raced != null && raced != existing && raced.isAlive()) {
            log.warn("Replacing concurrently started process for {}", serviceId);
            terminate(serviceId, raced);
        }
        log.info("Spawned dispatcher {} (pid {}) for group [{}] on port {}, output in {}",
                serviceId, started.pid(), group, port, logFile);
        return endpoint;
    }

    @Override
    public boolean isRunning(final String serviceId) {
        final Process p = processes.get(serviceId);
        return p != null && p.isAlive();
    }

    @Override
    public void stop(final String serviceId) {
        final Process p = processes.remove(serviceId);
        if (p != null) terminate(serviceId, p);
        releasePort(serviceId);
    }

    /**
     * The port owned by {@code serviceId}, assigning one on first use by linear probing
     * from the group's preferred port.
     *
     * @throws ServiceUnavailableException when every port in the range is taken
     */
    synchronized int allocatePort(final String serviceId, final String group) {
        final Integer owned = portsByService.get(serviceId);
        if (owned != null) {
            return owned;
        }
        final int base = routerConfig.getGroupPortBase();
        final int preferred = DeploymentPlatforms.groupPort(base, group);
        for (int i = 0; i < DeploymentPlatforms.GROUP_PORT_RANGE; i++) {
            final int port = base + (preferred - base + i) % DeploymentPlatforms.GROUP_PORT_RANGE;
            if (servicesByPort.containsKey(port) || !bindable(port)) continue;
            if (port != preferred) {
                log.warn("Port {} preferred by group [{}] is taken, using {}", preferred, group, port);
            }
            portsByService.put(serviceId, port);
            servicesByPort.put(port, serviceId);
            return port;
        }
        throw new ServiceUnavailableException("No free dispatcher port in [" + base + ", "
                + (base + DeploymentPlatforms.GROUP_PORT_RANGE) + ") for group " + group);
    }

    private synchronized void releasePort(final String serviceId) {
        final Integer port = portsByService.remove(serviceId);
        if (port != null) servicesByPort.remove(port);
    }

    private static boolean bindable(final int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(port));
            return true;
        } catch (final IOException e) {
            return false;
        }
    }

    @Override
    public void close() {
        new ArrayList<>(processes.keySet()).forEach(this::stop);
    }

    private static void terminate(final String serviceId, final Process p) {
        log.info("Stopping dispatcher {} (pid {})", serviceId, p.pid());
        p.destroy();
        try {
            if (!p.waitFor(10, TimeUnit.SECONDS)) {
                log.warn("Dispatcher {} ignored SIGTERM, killing it", serviceId);
                p.destroyForcibly();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
        }
    }

    private static Path javaBinary() {
        return Path.of(System.getProperty("java.home"), "bin", "java");
    }
}
