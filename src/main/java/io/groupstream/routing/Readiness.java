package io.groupstream.routing;

import java.util.Map;

/**
 * Aggregated readiness of the router.
 *
 * @param issues component -> reason, empty when ready
 */
public record Readiness(boolean ready, Map<String, String> issues) {

    public Readiness {
        issues = Map.copyOf(issues);
    }
}
