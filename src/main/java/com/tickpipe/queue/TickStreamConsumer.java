package com.tickpipe.queue;

import com.tickpipe.config.StreamConfig;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.exception.DecodeException;
import com.tickpipe.exception.TransportException;
import com.tickpipe.observability.PipelineMetrics;
import com.tickpipe.store.TickStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Reads ticks from the queue as a consumer-group member and records them in the {@link TickStore}.
 *
 * <p>Delivery is at-least-once: an entry is acknowledged only after the store accepted it, so an
 * entry whose store call fails stays pending and is claimed again once idle for
 * {@code claim-min-idle}. Undecodable entries are acknowledged and dropped; retrying them
 * cannot succeed.
 *
 * <p>Runs on one thread ({@code tick-consumer}). {@link #stop(Duration)} clears the running flag;
 * the loop notices it within one block timeout.
 */
@Service
@ConditionalOnProperty(prefix = "tickpipe.store", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TickStreamConsumer {

    private static final Logger log = LoggerFactory.getLogger(TickStreamConsumer.class);

    private final TickQueue tickQueue;
    private final TickCodec tickCodec;
    private final TickStore tickStore;
    private final StreamConfig streamConfig;
    private final PipelineMetrics pipelineMetrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong decodeFailures = new AtomicLong();
    private final AtomicLong claimed = new AtomicLong();

    private volatile Thread worker;
    private long lastClaimAt;
    private boolean groupReady;

    public TickStreamConsumer(
            TickQueue tickQueue,
            TickCodec tickCodec,
            TickStore tickStore,
            StreamConfig streamConfig,
            PipelineMetrics pipelineMetrics) {
        this.tickQueue = tickQueue;
        this.tickCodec = tickCodec;
        this.tickStore = tickStore;
        this.streamConfig = streamConfig;
        this.pipelineMetrics = pipelineMetrics;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Consumer already running, ignoring start request");
            return;
        }
        worker = new Thread(this::runLoop, "tick-consumer");
        worker.setDaemon(true);
        worker.start();
        log.info(
                "Consumer {} started on stream '{}' group '{}'",
                streamConfig.getConsumerName(),
                streamConfig.getKey(),
                streamConfig.getConsumerGroup());
    }

    /** Stops the loop and waits up to {@code timeout} for the current batch to finish. */
    public void stop(Duration timeout) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread current = worker;
        if (current != null) {
            try {
                current.join(timeout.toMillis());
                if (current.isAlive()) {
                    log.warn("Consumer did not stop within {}, interrupting", timeout);
                    current.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Consumer stopped. processed={}, decodeFailures={}, claimed={}", processed.get(), decodeFailures.get(), claimed.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    /** False when the consumer should be running but its thread has exited. */
    public boolean isWorkerAlive() {
        Thread current = worker;
        return !running.get() || (current != null && current.isAlive());
    }

    private void runLoop() {
        while (running.get()) {
            try {
                pollOnce();
            } catch (TransportException e) {
                groupReady = false;
                log.warn("Queue unavailable ({}), retrying in {}", e.getMessage(), streamConfig.getReconnectDelay());
                pause(streamConfig.getReconnectDelay());
            } catch (RuntimeException e) {
                groupReady = false;
                log.error("Consumer iteration failed, retrying in {}", streamConfig.getReconnectDelay(), e);
                pause(streamConfig.getReconnectDelay());
            }
        }
    }

    /**
     * One iteration: ensure the group, claim stale pending entries when due, then read and
     * process one batch.
     *
     * @return number of entries handled (stored or dropped)
     */
    public int pollOnce() {
        if (!groupReady) {
            tickQueue.ensureGroup(streamConfig.getConsumerGroup());
            groupReady = true;
        }

        int handled = 0;
        long now = System.currentTimeMillis();
        if (now - lastClaimAt >= streamConfig.getClaimInterval().toMillis()) {
            lastClaimAt = now;
            List<QueueEntry> stale = tickQueue.claimPending(
                    streamConfig.getConsumerGroup(),
                    streamConfig.getConsumerName(),
                    streamConfig.getClaimMinIdle(),
                    streamConfig.getReadCount());
            if (!stale.isEmpty()) {
                claimed.addAndGet(stale.size());
                pipelineMetrics.consumerClaimed(stale.size());
                handled += process(stale);
            }
        }

        List<QueueEntry> entries = tickQueue.readGroup(
                streamConfig.getConsumerGroup(),
                streamConfig.getConsumerName(),
                streamConfig.getReadCount(),
                streamConfig.getBlockTimeout());
        handled += process(entries);
        return handled;
    }

    private int process(List<QueueEntry> entries) {
        if (entries.isEmpty()) {
            return 0;
        }
        List<String> toAck = new ArrayList<>(entries.size());
        for (QueueEntry entry : entries) {
            Tick tick;
            try {
                tick = tickCodec.decode(entry.payload());
            } catch (DecodeException e) {
                decodeFailures.incrementAndGet();
                pipelineMetrics.consumerDecodeFailure();
                log.warn("Dropping undecodable entry {}: {}", entry.id(), e.getMessage());
                toAck.add(entry.id());
                continue;
            }

            try {
                tickStore.record(tick, entry.id());
            } catch (RuntimeException e) {
                // left unacknowledged: redelivered through claimPending once idle
                log.error("Store rejected entry {} ({}): {}", entry.id(), tick.getTradingSymbol(), e.getMessage(), e);
                continue;
            }
            toAck.add(entry.id());
            processed.incrementAndGet();
            pipelineMetrics.consumerProcessed();
        }
        tickQueue.ack(streamConfig.getConsumerGroup(), toAck);
        return entries.size();
    }

    private void pause(Duration delay) {
        long deadline = System.currentTimeMillis() + delay.toMillis();
        try {
            while (running.get() && System.currentTimeMillis() < deadline) {
                Thread.sleep(Math.min(100, Math.max(1, deadline - System.currentTimeMillis())));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
        }
    }

    public long getProcessed() {
        return processed.get();
    }

    public long getDecodeFailures() {
        return decodeFailures.get();
    }

    public long getClaimed() {
        return claimed.get();
    }
}
