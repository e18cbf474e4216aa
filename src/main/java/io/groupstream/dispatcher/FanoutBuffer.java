package io.groupstream.dispatcher;

import io.groupstream.core.model.Event;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Single-writer ring of the most recently consumed events of one group.
 * <p>
 * The consumer task appends in log order; once the ring is full each append
 * overwrites the oldest slot. Not durable: the upstream log owns durability.
 */
public final class FanoutBuffer {
    private static final VarHandle ARRAY_HANDLE = MethodHandles.arrayElementVarHandle(Object[].class);

    private final Object[] entries;
    private final int mask;
    private volatile long cursor = -1L;

    /**
     * @param size power-of-two number of slots
     */
    public FanoutBuffer(final int size) {
        if (Integer.bitCount(size) != 1) {
            throw new IllegalArgumentException("FanoutBuffer size must be a power of two.");
        }
        this.entries = new Object[size];
        this.mask = size - 1;
    }

    /**
     * Appends an event. Only the consumer task may call this.
     *
     * @return the buffer sequence assigned to the event
     */
    public long append(final Event event) {
        final long seq = cursor + 1;
        ARRAY_HANDLE.setRelease(entries, (int) (seq & mask), event);
        cursor = seq;
        return seq;
    }

    /**
     * @return the event at {@code seq}, or {@code null} if not yet written or already overwritten
     */
    public Event get(final long seq) {
        if (seq < oldest() || seq > cursor) return null;
        final Event e = (Event) ARRAY_HANDLE.getAcquire(entries, (int) (seq & mask));
        // the writer may have lapped us while reading
        return seq >= oldest() ? e : null;
    }

    /** Highest written sequence, -1 when empty. */
    public long cursor() {
        return cursor;
    }

    /** Lowest sequence still held. */
    public long oldest() {
        return Math.max(0L, cursor - entries.length + 1);
    }

    public int capacity() {
        return entries.length;
    }

    /**
     * Events held after the one carrying {@code sequenceToken} that satisfy {@code filter},
     * oldest first. Empty when the token is no longer (or never was) held.
     */
    public List<Event> after(final long sequenceToken, final Predicate<Event> filter) {
        final long end = cursor;
        long start = -1L;
        for (long seq = oldest(); seq <= end; seq++) {
            final Event e = get(seq);
            if (e != null && e.sequenceToken() == sequenceToken) {
                start = seq + 1;
                break;
            }
        }
        if (start < 0) return List.of();

        final List<Event> out = new ArrayList<>();
        for (long seq = start; seq <= end; seq++) {
            final Event e = get(seq);
            if (e != null && filter.test(e)) out.add(e);
        }
        return out;
    }
}
