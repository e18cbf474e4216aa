package io.groupstream.transport.impl;

import io.groupstream.core.model.Event;
import io.groupstream.session.SessionListener;
import io.groupstream.session.SubscriptionSession;
import io.groupstream.transport.codec.EventCodec;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.LastHttpContent;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Moves events from a session's queue onto its channel.
 * <p>
 * All writes happen on the channel's event loop. Draining stops while the
 * channel is not writable and resumes on {@link #resume()}; the session queue
 * absorbs the difference (dropping its oldest entries when full).
 */
@Slf4j
final class SessionStreamer implements SessionListener {
    private static final int MAX_WRITES_PER_DRAIN = 256;

    private final Channel channel;
    private final SubscriptionSession session;
    private final AtomicBoolean scheduled = new AtomicBoolean(false);

    SessionStreamer(final Channel channel, final SubscriptionSession session) {
        this.channel = channel;
        this.session = session;
    }

    /** Writes the stream head and starts delivering. */
    void start() {
        channel.writeAndFlush(HttpResponses.streamHead());
        session.attach(this);
    }

    @Override
    public void onAvailable(final SubscriptionSession s) {
        if (scheduled.compareAndSet(false, true)) {
            channel.eventLoop().execute(this::drain);
        }
    }

    @Override
    public void onClosed(final SubscriptionSession s, final String reason) {
        channel.eventLoop().execute(() -> {
            if (channel.isActive()) {
                channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT).addListener(ChannelFutureListener.CLOSE);
            }
        });
    }

    /** Called on the event loop when the channel becomes writable again. */
    void resume() {
        onAvailable(session);
    }

    private void drain() {
        scheduled.set(false);
        if (!channel.isActive()) {
            session.close("client disconnected");
            return;
        }
        int written = 0;
        while (channel.isWritable() && written < MAX_WRITES_PER_DRAIN) {
            final Event e = session.poll();
            if (e == null) break;
            final String line = EventCodec.toJsonLine(e);
            channel.write(new DefaultHttpContent(Unpooled.copiedBuffer(line, StandardCharsets.UTF_8)))
                    .addListener(f -> {
                        if (!f.isSuccess()) {
                            session.close("write failed: " + f.cause());
                        }
                    });
            written++;
        }
        if (written > 0) channel.flush();
        if (written == MAX_WRITES_PER_DRAIN && session.hasPending()) {
            // yield the loop to other channels, then continue
            onAvailable(session);
        }
    }
}
