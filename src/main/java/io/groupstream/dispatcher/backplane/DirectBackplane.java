package io.groupstream.dispatcher.backplane;

import io.groupstream.core.model.Event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/** In-process backplane: sinks run on the publishing thread. */
public final class DirectBackplane implements FanoutBackplane {
    private final List<Consumer<Event>> sinks = new CopyOnWriteArrayList<>();

    @Override
    public void publish(final Event event) {
        for (final Consumer<Event> sink : sinks) {
            sink.accept(event);
        }
    }

    @Override
    public void subscribe(final Consumer<Event> sink) {
        sinks.add(sink);
    }
}
