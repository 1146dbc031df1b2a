package com.tickpipe.store;

import com.tickpipe.config.StoreConfig;
import com.tickpipe.domain.model.FlushResult;
import com.tickpipe.exception.CommitFailureException;
import com.tickpipe.notification.PipelineNotifier;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Owns the single thread that writes to durable storage.
 *
 * <p>Flushes the {@link TickStore} every {@code flush-interval}, and sooner when the pending count
 * reaches {@code flush-batch-size}. A failed flush leaves the ticks pending and is retried on
 * the next trigger. {@link #stop(Duration)} lets an in-flight flush finish, then runs one final
 * flush.
 */
@Service
@ConditionalOnProperty(prefix = "tickpipe.store", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TickFlushService {

    private static final Logger log = LoggerFactory.getLogger(TickFlushService.class);

    private final TickStore tickStore;
    private final StoreConfig storeConfig;
    private final PipelineNotifier pipelineNotifier;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService executor;

    public TickFlushService(TickStore tickStore, StoreConfig storeConfig, PipelineNotifier pipelineNotifier) {
        this.tickStore = tickStore;
        this.storeConfig = storeConfig;
        this.pipelineNotifier = pipelineNotifier;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Flush service already running, ignoring start request");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "tick-flush");
            thread.setDaemon(true);
            return thread;
        });

        long intervalMs = storeConfig.getFlushInterval().toMillis();
        long checkMs = storeConfig.getFlushCheckInterval().toMillis();
        executor.scheduleWithFixedDelay(this::flushSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        executor.scheduleWithFixedDelay(this::flushIfBatchFull, checkMs, checkMs, TimeUnit.MILLISECONDS);
        log.info(
                "Flush service started (interval={}, batch size={})",
                storeConfig.getFlushInterval(),
                storeConfig.getFlushBatchSize());
    }

    /**
     * Stops the schedule, waits for an in-flight flush, then flushes what is left.
     */
    public void stop(Duration timeout) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight flush did not finish within {}", timeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        log.info("Final flush of {} pending ticks", tickStore.pendingCount());
        FlushResult result = flushSafely();
        if (tickStore.pendingCount() > 0) {
            log.error("{} ticks could not be persisted at shutdown", tickStore.pendingCount());
        } else {
            log.info("Final flush complete: {} tick rows, {} depth rows", result.getTickRows(), result.getDepthRows());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Flushes now; a commit failure is logged and reported as an empty result. */
    public FlushResult flushSafely() {
        try {
            return tickStore.flush();
        } catch (CommitFailureException e) {
            String cause = e.getCause() != null ? e.getCause().getMessage() : "";
            log.error("{}: {}", e.getMessage(), cause);
            if (tickStore.getConsecutiveFlushFailures() == storeConfig.getFlushFailureThreshold()) {
                pipelineNotifier.flushFailing(tickStore.getConsecutiveFlushFailures(), cause);
            }
            return FlushResult.EMPTY;
        }
    }

    private void flushIfBatchFull() {
        if (tickStore.pendingCount() >= storeConfig.getFlushBatchSize()) {
            log.info("Pending ticks reached {}, flushing early", storeConfig.getFlushBatchSize());
            flushSafely();
        }
    }
}
