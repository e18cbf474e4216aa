package io.groupstream.routing;

/**
 * Where a request for an entity goes.
 */
public record RouteDecision(String group, String endpoint) {
}
