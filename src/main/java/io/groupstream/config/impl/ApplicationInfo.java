package io.groupstream.config.impl;

import java.util.Map;

/**
 * Build metadata reported on {@code /info}.
 */
public record ApplicationInfo(String version, String manufacturer) {

    public static ApplicationInfo fromEnvironment(final Map<String, String> env) {
        return new ApplicationInfo(
                env.getOrDefault("APPLICATION_VERSION", "latest"),
                env.getOrDefault("APPLICATION_MANUFACTURER", "groupstream"));
    }
}
