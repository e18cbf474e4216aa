package io.groupstream.dispatcher;

/** Lifecycle of a {@link GroupDispatcher}. Transitions only move forward. */
public enum DispatcherState {
    /** Attaching the consumer to the derived log. */
    STARTING,
    /** Reading the log and fanning out. */
    CONSUMING,
    /** Shutdown requested: no new sessions, existing ones get a grace window. */
    DRAINING,
    /** Consumer torn down. */
    STOPPED
}
