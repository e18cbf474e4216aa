package io.groupstream.core.backoff;

import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff. Each {@link #next()} doubles the delay up to
 * {@code max}, with up to 20% jitter so peers that failed together do not
 * retry together. Not thread-safe; one instance per retrying task.
 */
public final class Backoff {
    private final long initialMillis;
    private final long maxMillis;

    private long currentMillis;
    @Getter
    private int attempts;

    public Backoff(final Duration initial, final Duration max) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial backoff must be > 0");
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max backoff must be >= initial");
        }
        this.initialMillis = initial.toMillis();
        this.maxMillis = max.toMillis();
        this.currentMillis = initialMillis;
    }

    /** Delay to wait before the next attempt. */
    public Duration next() {
        attempts++;
        final long base = currentMillis;
        currentMillis = Math.min(maxMillis, currentMillis * 2);
        final long jitter = base / 5 == 0 ? 0 : ThreadLocalRandom.current().nextLong(base / 5 + 1);
        return Duration.ofMillis(Math.min(maxMillis, base + jitter));
    }

    /** Sleeps for {@link #next()}. */
    public void pause() throws InterruptedException {
        Thread.sleep(next().toMillis());
    }

    public void reset() {
        attempts = 0;
        currentMillis = initialMillis;
    }
}
