package io.groupstream.config.impl;

import io.groupstream.config.type.RoutingMode;
import io.groupstream.config.type.ServiceRole;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable config holder loaded from a service YAML file. Every key can be
 * overridden by an environment variable so spawned dispatchers need no file
 * of their own.
 */
@Getter
public final class ServiceConfig {

    private ServiceRole role;
    private String httpHost;
    private int httpPort;
    private String advertisedHost;

    private String kafkaBroker;
    private String derivedLogPrefix;
    private String groupLabel;

    private int queueCapacity;
    private int fanoutBufferSize;
    private long healthCheckIntervalMillis;
    private long probeTimeoutMillis;
    private long provisionTimeoutMillis;
    private long groupCacheTtlMillis;
    private long drainGraceMillis;
    private long sessionStallTimeoutMillis;
    private long attachTimeoutMillis;
    private long reconnectInitialMillis;
    private long reconnectMaxMillis;
    private int routingThreads;
    private int routingQueueCapacity;

    private String groupingStrategy;
    private String deploymentPlatform;
    private RoutingMode routingMode;

    private String ksqldbUrl;
    private String ksqldbAssetsStream;
    private String ksqldbAssetsTable;
    private String ksqldbUnsMap;
    private String unsGroupingLevel;
    private int groupPortBase;

    private Map<String, String> staticGroups;

    /** Path of the file this config came from, {@code null} when built from a map. */
    private String sourcePath;

    private ServiceConfig() {
    }

    public static ServiceConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(Path.of(path))) {
            final Map<String, Object> m = yaml.load(in);
            final ServiceConfig cfg = fromMap(m == null ? Map.of() : m, System.getenv());
            cfg.sourcePath = Path.of(path).toAbsolutePath().toString();
            return cfg;
        }
    }

    /**
     * Builds a config from a parsed YAML map, letting {@code env} override each key.
     *
     * @throws IllegalArgumentException on unknown enum values or out-of-range numbers
     */
    @SuppressWarnings("unchecked")
    public static ServiceConfig fromMap(final Map<String, Object> m, final Map<String, String> env) {
        final Source s = new Source(m, env);
        final ServiceConfig cfg = new ServiceConfig();

        cfg.role               = ServiceRole.valueOf(s.str("role", "ROLE", "ROUTER").toUpperCase(Locale.ROOT));
        cfg.httpHost           = s.str("httpHost", "HTTP_HOST", "0.0.0.0");
        cfg.httpPort           = s.integer("httpPort", "HTTP_PORT", 5555);
        cfg.advertisedHost     = s.str("advertisedHost", "ADVERTISED_HOST", "localhost");

        cfg.kafkaBroker        = s.str("kafkaBroker", "KAFKA_BROKER", "localhost:9092");
        cfg.derivedLogPrefix   = s.str("derivedLogPrefix", "DERIVED_LOG_PREFIX", "asset_stream");
        cfg.groupLabel         = s.str("groupLabel", "GROUP_LABEL", null);

        cfg.queueCapacity             = s.integer("queueCapacity", "QUEUE_MAXSIZE", 1000);
        cfg.fanoutBufferSize          = s.integer("fanoutBufferSize", "FANOUT_BUFFER_SIZE", 1024);
        cfg.healthCheckIntervalMillis = s.lng("healthCheckIntervalMillis", "HEALTH_CHECK_INTERVAL_MS", 10_000L);
        cfg.probeTimeoutMillis        = s.lng("probeTimeoutMillis", "PROBE_TIMEOUT_MS", 2_000L);
        cfg.provisionTimeoutMillis    = s.lng("provisionTimeoutMillis", "PROVISION_TIMEOUT_MS", 30_000L);
        cfg.groupCacheTtlMillis       = s.lng("groupCacheTtlMillis", "GROUP_CACHE_TTL_MS", 30_000L);
        cfg.drainGraceMillis          = s.lng("drainGraceMillis", "DRAIN_GRACE_MS", 5_000L);
        cfg.sessionStallTimeoutMillis = s.lng("sessionStallTimeoutMillis", "SESSION_STALL_TIMEOUT_MS", 60_000L);
        cfg.attachTimeoutMillis       = s.lng("attachTimeoutMillis", "ATTACH_TIMEOUT_MS", 100_000L);
        cfg.reconnectInitialMillis    = s.lng("reconnectInitialMillis", "RECONNECT_INITIAL_MS", 200L);
        cfg.reconnectMaxMillis        = s.lng("reconnectMaxMillis", "RECONNECT_MAX_MS", 10_000L);
        cfg.routingThreads            = s.integer("routingThreads", "ROUTING_THREADS", 64);
        cfg.routingQueueCapacity      = s.integer("routingQueueCapacity", "ROUTING_QUEUE_CAPACITY", 256);

        cfg.groupingStrategy   = s.str("groupingStrategy", "GROUPING_STRATEGY", "uns").toLowerCase(Locale.ROOT);
        cfg.deploymentPlatform = s.str("deploymentPlatform", "DEPLOYMENT_PLATFORM", "local").toLowerCase(Locale.ROOT);
        cfg.routingMode        = RoutingMode.valueOf(s.str("routingMode", "ROUTING_MODE", "proxy").toUpperCase(Locale.ROOT));

        cfg.ksqldbUrl          = s.str("ksqldbUrl", "KSQLDB_URL", "http://localhost:8088");
        cfg.ksqldbAssetsStream = s.str("ksqldbAssetsStream", "KSQLDB_ASSETS_STREAM", "enriched_assets_stream");
        cfg.ksqldbAssetsTable  = s.str("ksqldbAssetsTable", "KSQLDB_ASSETS_TABLE", "assets");
        cfg.ksqldbUnsMap       = s.str("ksqldbUnsMap", "KSQLDB_UNS_MAP", "asset_to_uns_map");
        cfg.unsGroupingLevel   = s.str("unsGroupingLevel", "UNS_GROUPING_LEVEL", "workcenter");
        cfg.groupPortBase      = s.integer("groupPortBase", "GROUP_PORT_BASE", 6000);

        final Map<String, Object> groups = (Map<String, Object>) m.getOrDefault("staticGroups", Map.of());
        final Map<String, String> staticGroups = new HashMap<>();
        groups.forEach((entity, group) -> staticGroups.put(entity, String.valueOf(group)));
        cfg.staticGroups = Map.copyOf(staticGroups);

        cfg.validate();
        return cfg;
    }

    private void validate() {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        if (Integer.bitCount(fanoutBufferSize) != 1) {
            throw new IllegalArgumentException("fanoutBufferSize must be a power of two");
        }
        if (provisionTimeoutMillis <= 0 || healthCheckIntervalMillis <= 0 || probeTimeoutMillis <= 0) {
            throw new IllegalArgumentException("timeouts and intervals must be > 0");
        }
        if (reconnectInitialMillis <= 0 || reconnectMaxMillis < reconnectInitialMillis) {
            throw new IllegalArgumentException("reconnect backoff must satisfy 0 < initial <= max");
        }
        if (routingThreads <= 0 || routingQueueCapacity < 0) {
            throw new IllegalArgumentException("routingThreads must be > 0 and routingQueueCapacity >= 0");
        }
        if (role == ServiceRole.DISPATCHER && (groupLabel == null || groupLabel.isBlank())) {
            throw new IllegalArgumentException("groupLabel is required for the DISPATCHER role");
        }
    }

    public Duration provisionTimeout() {
        return Duration.ofMillis(provisionTimeoutMillis);
    }

    public Duration healthCheckInterval() {
        return Duration.ofMillis(healthCheckIntervalMillis);
    }

    public Duration probeTimeout() {
        return Duration.ofMillis(probeTimeoutMillis);
    }

    public Duration groupCacheTtl() {
        return Duration.ofMillis(groupCacheTtlMillis);
    }

    /** Stream name of a group's derived log: {@code <prefix>_<group>}. */
    public String derivedLogName(final String group) {
        return derivedLogPrefix + "_" + group;
    }

    /** Topic backing a group's derived log. */
    public String derivedLogTopic(final String group) {
        return derivedLogName(group) + "_topic";
    }

    public String consumerGroupId(final String group) {
        return derivedLogName(group) + "_consumer_group";
    }

    /** Copy of this config as a dispatcher for {@code group} listening on {@code port}. */
    public ServiceConfig forDispatcher(final String group, final int port) {
        final ServiceConfig copy = copy();
        copy.role = ServiceRole.DISPATCHER;
        copy.groupLabel = group;
        copy.httpPort = port;
        return copy;
    }

    /**
     * Environment variables that reproduce this config in a child process,
     * keyed by the override names {@link #fromMap} reads.
     */
    public Map<String, String> toEnvironment() {
        final Map<String, String> env = new LinkedHashMap<>();
        env.put("ROLE", role.name());
        env.put("HTTP_HOST", httpHost);
        env.put("HTTP_PORT", String.valueOf(httpPort));
        env.put("ADVERTISED_HOST", advertisedHost);
        env.put("KAFKA_BROKER", kafkaBroker);
        env.put("DERIVED_LOG_PREFIX", derivedLogPrefix);
        if (groupLabel != null) env.put("GROUP_LABEL", groupLabel);
        env.put("QUEUE_MAXSIZE", String.valueOf(queueCapacity));
        env.put("FANOUT_BUFFER_SIZE", String.valueOf(fanoutBufferSize));
        env.put("HEALTH_CHECK_INTERVAL_MS", String.valueOf(healthCheckIntervalMillis));
        env.put("PROBE_TIMEOUT_MS", String.valueOf(probeTimeoutMillis));
        env.put("PROVISION_TIMEOUT_MS", String.valueOf(provisionTimeoutMillis));
        env.put("DRAIN_GRACE_MS", String.valueOf(drainGraceMillis));
        env.put("SESSION_STALL_TIMEOUT_MS", String.valueOf(sessionStallTimeoutMillis));
        env.put("ATTACH_TIMEOUT_MS", String.valueOf(attachTimeoutMillis));
        env.put("RECONNECT_INITIAL_MS", String.valueOf(reconnectInitialMillis));
        env.put("RECONNECT_MAX_MS", String.valueOf(reconnectMaxMillis));
        env.put("ROUTING_THREADS", String.valueOf(routingThreads));
        env.put("ROUTING_QUEUE_CAPACITY", String.valueOf(routingQueueCapacity));
        env.put("KSQLDB_URL", ksqldbUrl);
        return env;
    }

    private ServiceConfig copy() {
        final ServiceConfig c = new ServiceConfig();
        c.role = role;
        c.httpHost = httpHost;
        c.httpPort = httpPort;
        c.advertisedHost = advertisedHost;
        c.kafkaBroker = kafkaBroker;
        c.derivedLogPrefix = derivedLogPrefix;
        c.groupLabel = groupLabel;
        c.queueCapacity = queueCapacity;
        c.fanoutBufferSize = fanoutBufferSize;
        c.healthCheckIntervalMillis = healthCheckIntervalMillis;
        c.probeTimeoutMillis = probeTimeoutMillis;
        c.provisionTimeoutMillis = provisionTimeoutMillis;
        c.groupCacheTtlMillis = groupCacheTtlMillis;
        c.drainGraceMillis = drainGraceMillis;
        c.sessionStallTimeoutMillis = sessionStallTimeoutMillis;
        c.attachTimeoutMillis = attachTimeoutMillis;
        c.reconnectInitialMillis = reconnectInitialMillis;
        c.reconnectMaxMillis = reconnectMaxMillis;
        c.routingThreads = routingThreads;
        c.routingQueueCapacity = routingQueueCapacity;
        c.groupingStrategy = groupingStrategy;
        c.deploymentPlatform = deploymentPlatform;
        c.routingMode = routingMode;
        c.ksqldbUrl = ksqldbUrl;
        c.ksqldbAssetsStream = ksqldbAssetsStream;
        c.ksqldbAssetsTable = ksqldbAssetsTable;
        c.ksqldbUnsMap = ksqldbUnsMap;
        c.unsGroupingLevel = unsGroupingLevel;
        c.groupPortBase = groupPortBase;
        c.staticGroups = staticGroups;
        c.sourcePath = sourcePath;
        return c;
    }

    /* YAML value with an environment override; env wins. */
    private record Source(Map<String, Object> yaml, Map<String, String> env) {

        String str(final String key, final String envKey, final String def) {
            final String fromEnv = env.get(envKey);
            if (fromEnv != null && !fromEnv.isBlank()) return fromEnv;
            final Object v = yaml.get(key);
            return v == null ? def : String.valueOf(v);
        }

        int integer(final String key, final String envKey, final int def) {
            final String v = str(key, envKey, null);
            return v == null ? def : Integer.parseInt(v.trim());
        }

        long lng(final String key, final String envKey, final long def) {
            final String v = str(key, envKey, null);
            return v == null ? def : Long.parseLong(v.trim());
        }
    }
}
