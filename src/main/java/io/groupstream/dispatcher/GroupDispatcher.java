package io.groupstream.dispatcher;

import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.core.backoff.Backoff;
import io.groupstream.core.error.ServiceUnavailableException;
import io.groupstream.core.model.Event;
import io.groupstream.core.model.SequenceToken;
import io.groupstream.dispatcher.backplane.DirectBackplane;
import io.groupstream.dispatcher.backplane.FanoutBackplane;
import io.groupstream.log.type.LogConsumer;
import io.groupstream.log.type.LogConsumerFactory;
import io.groupstream.session.SessionFilter;
import io.groupstream.session.SubscriptionSession;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serves one group: a single ordered consumer of the group's derived log feeding a
 * {@link FanoutBuffer} and every live {@link SubscriptionSession}.
 * <p>
 * Threading: one dedicated consumer thread is the only writer into the buffer.
 * Delivery to a session never blocks it; slow sessions lose their oldest events
 * instead. Consumer failures pause consumption and reconnect with bounded
 * exponential backoff from the last committed position; sessions stay open.
 */
@Slf4j
public final class GroupDispatcher implements AutoCloseable {
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    @Getter
    private final String group;
    @Getter
    private final String logId;
    private final String consumerGroupId;
    private final LogConsumerFactory consumerFactory;
    private final FanoutBackplane backplane;
    private final FanoutBuffer buffer;
    private final int queueCapacity;
    private final Duration attachTimeout;
    private final Duration drainGrace;
    private final long stallTimeoutMillis;
    private final Backoff backoff;

    private final ConcurrentMap<String, SubscriptionSession> sessions = new ConcurrentHashMap<>();
    /* Guards buffer append + fan-out against session registration and drain. */
    private final ReentrantLock fanoutLock = new ReentrantLock();
    private final AtomicReference<DispatcherState> state = new AtomicReference<>(DispatcherState.STARTING);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong consumed = new AtomicLong();

    private final ScheduledExecutorService housekeeping;
    private final Thread consumerThread;

    private volatile boolean running = true;
    private volatile boolean attached;
    /* Owned by the consumer thread until it exits; then by close(). */
    private LogConsumer consumer;

    public GroupDispatcher(final String group,
                           final String logId,
                           final String consumerGroupId,
                           final LogConsumerFactory consumerFactory,
                           final FanoutBackplane backplane,
                           final int fanoutBufferSize,
                           final int queueCapacity,
                           final Duration attachTimeout,
                           final Duration drainGrace,
                           final long stallTimeoutMillis,
                           final Backoff reconnectBackoff) {
        this.group = group;
        this.logId = logId;
        this.consumerGroupId = consumerGroupId;
        this.consumerFactory = consumerFactory;
        this.backplane = backplane;
        this.buffer = new FanoutBuffer(fanoutBufferSize);
        this.queueCapacity = queueCapacity;
        this.attachTimeout = attachTimeout;
        this.drainGrace = drainGrace;
        this.stallTimeoutMillis = stallTimeoutMillis;
        this.backoff = reconnectBackoff;

        this.backplane.subscribe(this::fanOut);

        this.consumerThread = new Thread(this::consumeLoop, "dispatcher-" + group);
        this.consumerThread.setDaemon(true);
        this.housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "dispatcher-" + group + "-housekeeping");
            t.setDaemon(true);
            return t;
        });
    }

    public static GroupDispatcher fromConfig(final ServiceConfig cfg, final LogConsumerFactory consumerFactory) {
        final String group = cfg.getGroupLabel();
        return new GroupDispatcher(
                group,
                cfg.derivedLogTopic(group),
                cfg.consumerGroupId(group),
                consumerFactory,
                new DirectBackplane(),
                cfg.getFanoutBufferSize(),
                cfg.getQueueCapacity(),
                Duration.ofMillis(cfg.getAttachTimeoutMillis()),
                Duration.ofMillis(cfg.getDrainGraceMillis()),
                cfg.getSessionStallTimeoutMillis(),
                new Backoff(Duration.ofMillis(cfg.getReconnectInitialMillis()),
                        Duration.ofMillis(cfg.getReconnectMaxMillis())));
    }

    public void start() {
        if (!started.compareAndSet(false, true)) return;
        log.info("Starting dispatcher for group [{}] on log {} with a replay buffer of {} events", group, logId,
                buffer.capacity());
        consumerThread.start();
        if (stallTimeoutMillis > 0) {
            final long period = Math.max(250L, stallTimeoutMillis / 4);
            housekeeping.scheduleAtFixedRate(this::evictStalled, period, period, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Opens a session for this group.
     *
     * @param filter      delivery filter
     * @param resumeAfter optional sequence token; matching buffered events after it
     *                    are queued first (best effort, never a full backfill)
     * @throws ServiceUnavailableException when the dispatcher is draining or stopped
     */
    public SubscriptionSession open(final SessionFilter filter, final String resumeAfter) {
        final SubscriptionSession session = new SubscriptionSession(
                UUID.randomUUID().toString(), filter, queueCapacity, this::release);

        fanoutLock.lock();
        try {
            final DispatcherState st = state.get();
            if (st == DispatcherState.DRAINING || st == DispatcherState.STOPPED) {
                throw new ServiceUnavailableException("Dispatcher for group " + group + " is " + st);
            }
            if (resumeAfter != null && !resumeAfter.isBlank()) {
                final List<Event> replay = buffer.after(SequenceToken.parse(resumeAfter), filter::matches);
                replay.forEach(session::deliver);
                log.debug("Session {} resumed after {} with {} buffered events",
                        session.getSessionId(), resumeAfter, replay.size());
            }
            sessions.put(session.getSessionId(), session);
        } finally {
            fanoutLock.unlock();
        }

        log.info("Session {} opened on group [{}] for {} (item={})",
                session.getSessionId(), group, filter.entityId(), filter.itemId());
        return session;
    }

    private void release(final SubscriptionSession session) {
        sessions.remove(session.getSessionId(), session);
    }

    private void fanOut(final Event event) {
        fanoutLock.lock();
        try {
            buffer.append(event);
            consumed.incrementAndGet();
            for (final SubscriptionSession s : sessions.values()) {
                s.deliver(event);
            }
        } finally {
            fanoutLock.unlock();
        }
    }

    private void consumeLoop() {
        try {
            while (running) {
                if (consumer == null && !connect()) {
                    backoff.pause();
                    continue;
                }
                try {
                    final List<Event> batch = consumer.poll(POLL_TIMEOUT);
                    if (batch.isEmpty()) continue;
                    for (final Event e : batch) {
                        backplane.publish(e);
                    }
                    consumer.commit();
                } catch (final RuntimeException e) {
                    if (!running) break;
                    log.warn("Log consumer for group [{}] failed: {}. Pausing and reconnecting.", group, e.getMessage());
                    dropConsumer();
                    backoff.pause();
                }
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        log.info("Consumer task for group [{}] exited", group);
    }

    private boolean connect() {
        LogConsumer c = null;
        try {
            c = consumerFactory.open(logId, consumerGroupId);
            c.attach(attachTimeout);
            consumer = c;
            attached = true;
            backoff.reset();
            if (state.compareAndSet(DispatcherState.STARTING, DispatcherState.CONSUMING)) {
                log.info("Dispatcher for group [{}] is CONSUMING {}", group, logId);
            } else {
                log.info("Dispatcher for group [{}] reattached to {}", group, logId);
            }
            return true;
        } catch (final RuntimeException e) {
            log.warn("Attaching to {} failed (attempt {}): {}", logId, backoff.getAttempts() + 1, e.getMessage());
            if (c != null) c.close();
            return false;
        }
    }

    private void dropConsumer() {
        attached = false;
        final LogConsumer c = consumer;
        consumer = null;
        if (c != null) c.close();
    }

    private void evictStalled() {
        final long now = System.currentTimeMillis();
        for (final SubscriptionSession s : sessions.values()) {
            if (s.isStalled(now, stallTimeoutMillis)) {
                s.close("stalled for more than " + stallTimeoutMillis + " ms");
            }
        }
    }

    /** Ready once the consumer is attached to the log. */
    public boolean isReady() {
        return state.get() == DispatcherState.CONSUMING && attached;
    }

    public DispatcherState getState() {
        return state.get();
    }

    public int sessionCount() {
        return sessions.size();
    }

    public long consumedCount() {
        return consumed.get();
    }

    /**
     * Drains: refuses new sessions, stops reading the log, gives open sessions
     * {@code drainGrace} to flush their queues, closes them and tears down the consumer.
     */
    @Override
    public void close() {
        final DispatcherState prev = state.getAndUpdate(s ->
                s == DispatcherState.STARTING || s == DispatcherState.CONSUMING ? DispatcherState.DRAINING : s);
        if (prev == DispatcherState.DRAINING || prev == DispatcherState.STOPPED) return;
        log.info("Dispatcher for group [{}] DRAINING {} sessions", group, sessions.size());

        running = false;
        housekeeping.shutdownNow();
        if (started.get()) {
            try {
                consumerThread.join(POLL_TIMEOUT.toMillis() * 2);
                if (consumerThread.isAlive()) {
                    consumerThread.interrupt();
                    consumerThread.join(POLL_TIMEOUT.toMillis());
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        final long deadline = System.nanoTime() + drainGrace.toNanos();
        try {
            while (System.nanoTime() < deadline && sessions.values().stream().anyMatch(SubscriptionSession::hasPending)) {
                Thread.sleep(20L);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        final List<SubscriptionSession> open;
        fanoutLock.lock();
        try {
            open = new ArrayList<>(sessions.values());
        } finally {
            fanoutLock.unlock();
        }
        open.forEach(s -> s.close("dispatcher shutdown"));

        dropConsumer();
        backplane.close();
        state.set(DispatcherState.STOPPED);
        log.info("Dispatcher for group [{}] STOPPED after consuming {} events", group, consumed.get());
    }
}
