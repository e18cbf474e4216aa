package io.groupstream.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

public final class Await {
    private Await() {
    }

    public static void until(final BooleanSupplier condition, final Duration timeout, final String what)
            throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) return;
            Thread.sleep(10L);
        }
        if (!condition.getAsBoolean()) fail("Timed out waiting for " + what);
    }
}
