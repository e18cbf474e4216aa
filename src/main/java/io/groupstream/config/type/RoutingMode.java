package io.groupstream.config.type;

/** How the router hands a stream request to the group's dispatcher. */
public enum RoutingMode {
    /** Stream through the router. */
    PROXY,
    /** Answer 307 with the dispatcher URL. */
    REDIRECT
}
