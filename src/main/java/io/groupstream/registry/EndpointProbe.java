package io.groupstream.registry;

/**
 * Checks a dispatcher endpoint on behalf of one group. An endpoint that answers
 * for a different group counts as failing. Must return within its own bounded
 * timeout; failures are reported as {@code false}.
 */
@FunctionalInterface
public interface EndpointProbe {
    boolean check(String group, String endpoint);
}
