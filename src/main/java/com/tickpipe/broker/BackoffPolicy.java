package com.tickpipe.broker;

import java.time.Duration;

/**
 * Exponential reconnect delay: initial, doubling per attempt, capped.
 */
public class BackoffPolicy {

    private final long initialDelayMs;
    private final long maxDelayMs;

    public BackoffPolicy(Duration initialDelay, Duration maxDelay) {
        this.initialDelayMs = Math.max(1, initialDelay.toMillis());
        this.maxDelayMs = Math.max(this.initialDelayMs, maxDelay.toMillis());
    }

    /**
     * Delay before reconnect attempt {@code attempt} (1-based): 1s, 2s, 4s, ... capped at max.
     */
    public long delayFor(int attempt) {
        int exponent = Math.min(Math.max(0, attempt - 1), 30);
        return Math.min(initialDelayMs * (1L << exponent), maxDelayMs);
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
