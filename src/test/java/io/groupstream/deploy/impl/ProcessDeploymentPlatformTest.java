package io.groupstream.deploy.impl;

import io.groupstream.deploy.DeploymentPlatforms;
import io.groupstream.support.TestConfigs;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ProcessDeploymentPlatformTest {

    private static ProcessDeploymentPlatform platform(final int base) {
        return new ProcessDeploymentPlatform(TestConfigs.router(Map.of(
                "deploymentPlatform", "process", "groupPortBase", base)));
    }

    /* Another "Line<n>" label hashing to the same preferred port as {@code group}. */
    private static String clashingWith(final String group, final int base) {
        final int preferred = DeploymentPlatforms.groupPort(base, group);
        for (int i = 0; i < 100_000; i++) {
            final String candidate = "Line" + i;
            if (!candidate.equals(group) && DeploymentPlatforms.groupPort(base, candidate) == preferred) {
                return candidate;
            }
        }
        throw new AssertionError("no clashing label found");
    }

    private static int allocate(final ProcessDeploymentPlatform p, final String group) {
        return p.allocatePort(DeploymentPlatforms.serviceId(group), group);
    }

    @Test
    void clashingGroupsGetDistinctPorts() {
        final int base = 46000;
        final String other = clashingWith("Line9", base);
        final ProcessDeploymentPlatform p = platform(base);

        final int first = allocate(p, "Line9");
        final int second = allocate(p, other);

        assertEquals(DeploymentPlatforms.groupPort(base, "Line9"), first);
        assertNotEquals(first, second);
        assertTrue(second >= base && second < base + DeploymentPlatforms.GROUP_PORT_RANGE, "port " + second);
        assertEquals(first, allocate(p, "Line9"), "a service keeps its port");
        assertEquals(second, allocate(p, other));
    }

    @Test
    void stoppingAServiceReleasesItsPort() {
        final int base = 46000;
        final String other = clashingWith("Line9", base);
        final ProcessDeploymentPlatform p = platform(base);
        final int first = allocate(p, "Line9");

        p.stop(DeploymentPlatforms.serviceId("Line9"));

        assertEquals(first, allocate(p, other));
    }

    @Test
    void portsBoundElsewhereAreSkipped() throws Exception {
        final int base = 47000;
        final int preferred = DeploymentPlatforms.groupPort(base, "Weld");
        try (ServerSocket taken = new ServerSocket()) {
            taken.bind(new InetSocketAddress(preferred));

            final int port = allocate(platform(base), "Weld");

            assertNotEquals(preferred, port);
            assertTrue(port >= base && port < base + DeploymentPlatforms.GROUP_PORT_RANGE, "port " + port);
        }
    }
}
