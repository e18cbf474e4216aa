package io.groupstream.config.type;

import io.groupstream.config.impl.ServiceConfig;

import java.io.IOException;
import java.util.Map;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads service configuration from a YAML file by delegating to {@link ServiceConfig#load(String)}.
     *
     * @param path the path to the service YAML configuration file
     * @return a populated {@link ServiceConfig} instance
     * @throws IOException if the file cannot be read or parsed
     */
    public static ServiceConfig load(final String path) throws IOException {
        return ServiceConfig.load(path);
    }

    /**
     * Builds configuration purely from environment variables, used by dispatchers
     * spawned without a config file.
     */
    public static ServiceConfig fromEnvironment() {
        return ServiceConfig.fromMap(Map.of(), System.getenv());
    }
}
