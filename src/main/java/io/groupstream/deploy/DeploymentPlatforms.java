package io.groupstream.deploy;

import io.groupstream.config.impl.ApplicationInfo;
import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.deploy.impl.InProcessDeploymentPlatform;
import io.groupstream.deploy.impl.ProcessDeploymentPlatform;
import io.groupstream.deploy.type.DeploymentPlatform;
import io.groupstream.log.impl.KafkaLogConsumerFactory;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Fixed table of deployment platforms, selected by {@code deploymentPlatform},
 * plus the naming rules every platform shares.
 */
public final class DeploymentPlatforms {
    /** Width of the per-group port range above {@code groupPortBase}. */
    public static final int GROUP_PORT_RANGE = 1000;

    private static final Map<String, Function<ServiceConfig, DeploymentPlatform>> REGISTERED = new TreeMap<>(Map.of(
            "local", cfg -> new InProcessDeploymentPlatform(
                    new KafkaLogConsumerFactory(cfg.getKafkaBroker()), ApplicationInfo.fromEnvironment(System.getenv())),
            "process", ProcessDeploymentPlatform::new
    ));

    private DeploymentPlatforms() {
    }

    public static DeploymentPlatform create(final ServiceConfig cfg) {
        final var factory = REGISTERED.get(cfg.getDeploymentPlatform());
        if (factory == null) {
            throw new IllegalArgumentException("Unknown deployment platform '" + cfg.getDeploymentPlatform()
                    + "', expected one of " + REGISTERED.keySet());
        }
        return factory.apply(cfg);
    }

    /** {@code stream-api-group-<group lower-cased, non-alphanumeric runs as '-'>} */
    public static String serviceId(final String group) {
        final String sanitized = group.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return "stream-api-group-" + sanitized;
    }

    /**
     * Preferred per-group port in {@code [base, base + GROUP_PORT_RANGE)}. Distinct groups
     * may hash to the same port; platforms that bind ports resolve the clash.
     */
    public static int groupPort(final int base, final String group) {
        try {
            final byte[] digest = MessageDigest.getInstance("MD5").digest(group.getBytes(StandardCharsets.UTF_8));
            return base + new BigInteger(1, digest).mod(BigInteger.valueOf(GROUP_PORT_RANGE)).intValue();
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
