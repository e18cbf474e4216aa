package io.groupstream.session;

import io.groupstream.core.model.Event;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One client's live stream on a dispatcher.
 * <p>
 * The dispatcher's consumer task calls {@link #deliver(Event)}; the network side
 * drains with {@link #poll()}. The queue is bounded: when full, the oldest unsent
 * event is dropped so the consumer task never waits on a slow client.
 * <p>
 * A session is owned by exactly one dispatcher and holds no reference to other
 * sessions.
 */
@Slf4j
public final class SubscriptionSession {

    @Getter
    private final String sessionId;
    @Getter
    private final SessionFilter filter;
    @Getter
    private final int capacity;

    private final ArrayBlockingQueue<Event> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final Consumer<SubscriptionSession> onRelease;

    private volatile SessionListener listener = SessionListener.NOOP;
    /* Token of the last event handed to the network side. */
    private volatile long cursor = -1L;
    /* Millis of the last successful drain, or of creation. */
    private volatile long lastProgressMillis;

    public SubscriptionSession(final String sessionId,
                               final SessionFilter filter,
                               final int capacity,
                               final Consumer<SubscriptionSession> onRelease) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onRelease = Objects.requireNonNull(onRelease, "onRelease");
        this.lastProgressMillis = System.currentTimeMillis();
    }

    public void attach(final SessionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
        if (closed.get()) {
            listener.onClosed(this, "closed before attach");
        } else if (!queue.isEmpty()) {
            listener.onAvailable(this);
        }
    }

    /**
     * Offers an event to this session.
     *
     * @return {@code true} if the event matched the filter and was queued
     */
    public boolean deliver(final Event event) {
        if (closed.get() || !filter.matches(event)) {
            return false;
        }
        if (queue.isEmpty()) {
            // stall clock starts when the first event starts waiting
            lastProgressMillis = System.currentTimeMillis();
        }
        while (!queue.offer(event)) {
            // full: drop oldest for this session only
            if (queue.poll() != null) {
                final long d = dropped.incrementAndGet();
                if (log.isDebugEnabled() && (d & (d - 1)) == 0) {
                    log.debug("Session {} is slow, dropped {} events so far", sessionId, d);
                }
            }
        }
        listener.onAvailable(this);
        return true;
    }

    /** Next queued event, or {@code null} when the queue is empty. */
    public Event poll() {
        final Event e = queue.poll();
        if (e != null) {
            delivered.incrementAndGet();
            cursor = e.sequenceToken();
            lastProgressMillis = System.currentTimeMillis();
        }
        return e;
    }

    public boolean hasPending() {
        return !queue.isEmpty();
    }

    public int pending() {
        return queue.size();
    }

    public long delivered() {
        return delivered.get();
    }

    public long dropped() {
        return dropped.get();
    }

    public long cursor() {
        return cursor;
    }

    /**
     * True when events have been waiting without any drain for longer than
     * {@code timeoutMillis}.
     */
    public boolean isStalled(final long nowMillis, final long timeoutMillis) {
        return timeoutMillis > 0 && !queue.isEmpty() && nowMillis - lastProgressMillis > timeoutMillis;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the session and releases its queue. Idempotent.
     */
    public void close(final String reason) {
        if (!closed.compareAndSet(false, true)) return;
        queue.clear();
        onRelease.accept(this);
        log.info("Session {} for {} closed ({}), delivered={}, dropped={}",
                sessionId, filter.entityId(), reason, delivered.get(), dropped.get());
        listener.onClosed(this, reason);
    }
}
