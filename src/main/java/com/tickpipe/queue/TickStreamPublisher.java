package com.tickpipe.queue;

import com.tickpipe.config.StreamConfig;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.exception.DecodeException;
import com.tickpipe.observability.PipelineMetrics;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Appends ticks to the {@link TickQueue} without ever holding the caller longer than the
 * publish timeout.
 *
 * <p>Queue writes run on one dedicated thread fed by a bounded hand-off queue; the caller waits
 * at most {@code publishTimeout} for the write. A timeout, a full hand-off or a queue error
 * counts as {@link PublishResult#DROPPED} and is never thrown. A write that times out may
 * still land later; it is reported as dropped either way.
 *
 * <p>Single-threaded writes keep queue order equal to publish order.
 */
@Component
@ConditionalOnProperty(prefix = "tickpipe.connector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TickStreamPublisher {

    private static final Logger log = LoggerFactory.getLogger(TickStreamPublisher.class);

    private final TickQueue tickQueue;
    private final TickCodec tickCodec;
    private final PipelineMetrics pipelineMetrics;
    private final Duration publishTimeout;
    private final ThreadPoolExecutor writer;

    private final AtomicLong acknowledged = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    @Autowired
    public TickStreamPublisher(
            TickQueue tickQueue, TickCodec tickCodec, PipelineMetrics pipelineMetrics, StreamConfig streamConfig) {
        this(tickQueue, tickCodec, pipelineMetrics, streamConfig.getPublishTimeout(), streamConfig.getPublishQueueCapacity());
    }

    public TickStreamPublisher(
            TickQueue tickQueue,
            TickCodec tickCodec,
            PipelineMetrics pipelineMetrics,
            Duration publishTimeout,
            int handOffCapacity) {
        this.tickQueue = tickQueue;
        this.tickCodec = tickCodec;
        this.pipelineMetrics = pipelineMetrics;
        this.publishTimeout = publishTimeout;
        this.writer = new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(handOffCapacity), r -> {
                    Thread thread = new Thread(r, "tick-publisher");
                    thread.setDaemon(true);
                    return thread;
                });
    }

    /**
     * Publishes one tick. Returns within roughly {@code publishTimeout} whatever the queue does.
     */
    public PublishResult publish(Tick tick) {
        String payload;
        try {
            payload = tickCodec.encode(tick);
        } catch (DecodeException e) {
            log.warn("Dropping unserializable tick {}: {}", tick.getInstrumentToken(), e.getMessage());
            return drop();
        }

        Future<String> write;
        try {
            write = writer.submit(() -> tickQueue.append(payload));
        } catch (RejectedExecutionException e) {
            return drop();
        }

        try {
            write.get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
            acknowledged.incrementAndGet();
            pipelineMetrics.publishAcknowledged();
            return PublishResult.ACKNOWLEDGED;
        } catch (TimeoutException e) {
            write.cancel(false);
            return drop();
        } catch (ExecutionException e) {
            log.debug("Queue append failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return drop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return drop();
        }
    }

    /** Stops the writer thread after pending writes finish, waiting up to {@code timeout}. */
    public void close(Duration timeout) {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Publisher writer did not finish in {}, {} writes abandoned", timeout, writer.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
        log.info("Publisher closed. acknowledged={}, dropped={}", acknowledged.get(), dropped.get());
    }

    public long getAcknowledged() {
        return acknowledged.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    private PublishResult drop() {
        long count = dropped.incrementAndGet();
        pipelineMetrics.publishDropped();
        if (count == 1 || count % 1000 == 0) {
            log.warn("Publisher dropped {} ticks so far (queue slow or unavailable)", count);
        }
        return PublishResult.DROPPED;
    }
}
