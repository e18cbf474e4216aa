package io.groupstream.support;

import io.groupstream.config.impl.ServiceConfig;

import java.util.HashMap;
import java.util.Map;

/** Configs with short timeouts for in-JVM tests. */
public final class TestConfigs {
    private TestConfigs() {
    }

    public static ServiceConfig router(final Map<String, Object> overrides) {
        final Map<String, Object> m = new HashMap<>();
        m.put("role", "ROUTER");
        m.put("httpHost", "127.0.0.1");
        m.put("httpPort", 0);
        m.put("advertisedHost", "127.0.0.1");
        m.put("queueCapacity", 64);
        m.put("fanoutBufferSize", 64);
        m.put("healthCheckIntervalMillis", 200);
        m.put("probeTimeoutMillis", 1000);
        m.put("provisionTimeoutMillis", 5000);
        m.put("drainGraceMillis", 200);
        m.put("attachTimeoutMillis", 1000);
        m.put("reconnectInitialMillis", 10);
        m.put("reconnectMaxMillis", 50);
        m.put("groupingStrategy", "static");
        m.put("deploymentPlatform", "local");
        m.putAll(overrides);
        return ServiceConfig.fromMap(m, Map.of());
    }

    public static ServiceConfig dispatcher(final String group) {
        return router(Map.of()).forDispatcher(group, 0);
    }
}
