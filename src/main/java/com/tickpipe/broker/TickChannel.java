package com.tickpipe.broker;

import com.tickpipe.domain.model.Tick;
import com.tickpipe.observability.PipelineMetrics;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded FIFO between the socket read threads and the publisher's forwarder thread.
 *
 * <p>{@link #offer(Tick)} never blocks: when full the tick is dropped and counted, so a slow
 * queue can never back up into a socket read loop.
 */
public class TickChannel implements TickSink {

    private static final Logger log = LoggerFactory.getLogger(TickChannel.class);

    private final BlockingQueue<Tick> queue;
    private final PipelineMetrics pipelineMetrics;
    private final AtomicLong dropped = new AtomicLong();

    public TickChannel(int capacity, PipelineMetrics pipelineMetrics) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.pipelineMetrics = pipelineMetrics;
    }

    @Override
    public boolean offer(Tick tick) {
        if (queue.offer(tick)) {
            return true;
        }
        long count = dropped.incrementAndGet();
        pipelineMetrics.channelDropped();
        if (count == 1 || count % 1000 == 0) {
            log.warn("Tick channel full, {} ticks dropped so far", count);
        }
        return false;
    }

    /** Waits up to {@code timeout} for the next tick; null when none arrived. */
    public Tick poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public long getDropped() {
        return dropped.get();
    }
}
