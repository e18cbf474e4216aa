package io.groupstream.core.backoff;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class BackoffTest {

    @Test
    void growsExponentiallyUpToMax() {
        final Backoff b = new Backoff(Duration.ofMillis(100), Duration.ofMillis(1000));

        final long first = b.next().toMillis();
        final long second = b.next().toMillis();
        assertTrue(first >= 100 && first <= 120, "first=" + first);
        assertTrue(second >= 200 && second <= 240, "second=" + second);

        for (int i = 0; i < 10; i++) {
            assertTrue(b.next().toMillis() <= 1000);
        }
        assertEquals(12, b.getAttempts());
    }

    @Test
    void resetStartsOver() {
        final Backoff b = new Backoff(Duration.ofMillis(50), Duration.ofMillis(400));
        b.next();
        b.next();
        b.next();
        b.reset();

        assertEquals(0, b.getAttempts());
        assertTrue(b.next().toMillis() <= 60);
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new Backoff(Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new Backoff(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }
}
