package com.tickpipe.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/** Polls a condition for work that completes on another thread. */
public final class Eventually {

    private Eventually() {}

    public static void await(BooleanSupplier condition) {
        await(condition, Duration.ofSeconds(5));
    }

    public static void await(BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + timeout);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
        }
    }
}
