package io.groupstream.dispatcher.backplane;

import io.groupstream.core.model.Event;

import java.util.function.Consumer;

/**
 * Seam between the consumer task and local delivery. A replicated deployment
 * plugs an external pub/sub layer in here so several dispatcher replicas share
 * one log read; a single instance uses {@link DirectBackplane}.
 * <p>
 * Implementations must hand events to every sink in publish order.
 */
public interface FanoutBackplane extends AutoCloseable {

    void publish(Event event);

    void subscribe(Consumer<Event> sink);

    @Override
    default void close() {
        // no-op
    }
}
