package io.groupstream.deploy.type;

import io.groupstream.config.impl.ServiceConfig;

/**
 * Starts and stops dispatchers on some compute platform.
 * <p>
 * Implementations are idempotent per service id and need not wait for the
 * dispatcher to become ready; callers poll its readiness endpoint.
 */
public interface DeploymentPlatform extends AutoCloseable {

    /** Checks the platform is usable; fails fast at startup otherwise. */
    void initialize();

    /**
     * Makes sure a dispatcher configured by {@code dispatcherConfig} runs under {@code serviceId}.
     *
     * @return the dispatcher's endpoint URL
     * @throws io.groupstream.core.error.ServiceUnavailableException when the platform cannot start it
     */
    String ensureRunning(String serviceId, ServiceConfig dispatcherConfig);

    boolean isRunning(String serviceId);

    /** Stops the service; a no-op when it is not running. */
    void stop(String serviceId);

    /** Stops everything this platform started. */
    @Override
    void close();
}
