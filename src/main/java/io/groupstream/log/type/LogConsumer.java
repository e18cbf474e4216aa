package io.groupstream.log.type;

import io.groupstream.core.model.Event;

import java.time.Duration;
import java.util.List;

/**
 * A single ordered reader of one derived log. Not thread-safe: it is owned by the
 * dispatcher's consumer task.
 */
public interface LogConsumer extends AutoCloseable {

    /**
     * Joins the log at its last committed position (earliest on first run) and
     * waits until partitions are assigned.
     *
     * @throws io.groupstream.core.error.ServiceUnavailableException if the log cannot
     *         be reached or no assignment arrives within {@code timeout}
     */
    void attach(Duration timeout);

    boolean isAttached();

    /**
     * Next batch in log order, possibly empty.
     *
     * @throws io.groupstream.core.error.ServiceUnavailableException on broker failures
     */
    List<Event> poll(Duration timeout);

    /**
     * Commits the position after every event returned by {@link #poll(Duration)} so far.
     */
    void commit();

    @Override
    void close();
}
