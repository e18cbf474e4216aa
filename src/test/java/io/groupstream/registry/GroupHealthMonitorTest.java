package io.groupstream.registry;

import io.groupstream.support.Await;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

final class GroupHealthMonitorTest {

    @Test
    void failingProbeDegradesAndPassingProbeRestores() {
        final GroupRegistry registry = new GroupRegistry(Duration.ofSeconds(1));
        registry.ensure("Weld", () -> "http://weld");
        registry.ensure("Paint", () -> "http://paint");
        final Set<String> down = ConcurrentHashMap.newKeySet();
        final GroupHealthMonitor monitor = new GroupHealthMonitor(registry, (group, ep) -> !down.contains(ep),
                Duration.ofHours(1));

        down.add("http://weld");
        monitor.checkAll();
        assertEquals(GroupState.DEGRADED, registry.get("Weld").orElseThrow().state());
        assertEquals(GroupState.ACTIVE, registry.get("Paint").orElseThrow().state());

        down.clear();
        monitor.checkAll();
        assertEquals(GroupState.ACTIVE, registry.get("Weld").orElseThrow().state());
        monitor.close();
    }

    @Test
    void checksNameTheGroupTheyExpect() {
        final GroupRegistry registry = new GroupRegistry(Duration.ofSeconds(1));
        registry.ensure("Weld", () -> "http://shared");
        registry.ensure("Paint", () -> "http://paint");
        // http://shared now answers for Paint only
        final GroupHealthMonitor monitor = new GroupHealthMonitor(registry,
                (group, ep) -> !ep.equals("http://shared") || group.equals("Paint"), Duration.ofHours(1));

        monitor.checkAll();

        assertEquals(GroupState.DEGRADED, registry.get("Weld").orElseThrow().state());
        assertEquals(GroupState.ACTIVE, registry.get("Paint").orElseThrow().state());
        monitor.close();
    }

    @Test
    void probeExceptionsDegrade() {
        final GroupRegistry registry = new GroupRegistry(Duration.ofSeconds(1));
        registry.ensure("Weld", () -> "http://weld");
        final GroupHealthMonitor monitor = new GroupHealthMonitor(registry, (group, ep) -> {
            throw new IllegalStateException("connection refused");
        }, Duration.ofHours(1));

        monitor.checkAll();

        assertEquals(GroupState.DEGRADED, registry.get("Weld").orElseThrow().state());
        monitor.close();
    }

    @Test
    void scheduledChecksRun() throws Exception {
        final GroupRegistry registry = new GroupRegistry(Duration.ofSeconds(1));
        registry.ensure("Weld", () -> "http://weld");
        final GroupHealthMonitor monitor = new GroupHealthMonitor(registry, (group, ep) -> false, Duration.ofMillis(20));
        monitor.start();
        try {
            Await.until(() -> registry.get("Weld").orElseThrow().state() == GroupState.DEGRADED,
                    Duration.ofSeconds(5), "group degraded by monitor");
        } finally {
            monitor.close();
        }
    }
}
