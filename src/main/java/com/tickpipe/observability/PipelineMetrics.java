package com.tickpipe.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for the tick pipeline.
 *
 * <p>Counters are incremented on the hot path by the component that observes the event.
 * Gauges (pending ticks, subscribed sessions) are registered by their owners through
 * {@link #gauge(String, String, Supplier)} and polled lazily at scrape time.
 *
 * <ul>
 *   <li><b>tickpipe.ticks.received</b>: ticks decoded by socket sessions</li>
 *   <li><b>tickpipe.ticks.decode.errors</b>: socket ticks dropped as undecodable</li>
 *   <li><b>tickpipe.channel.dropped</b>: ticks dropped because the session-to-publisher channel was full</li>
 *   <li><b>tickpipe.publish.acknowledged</b> / <b>tickpipe.publish.dropped</b>: publisher outcomes</li>
 *   <li><b>tickpipe.consumer.processed</b> / <b>tickpipe.consumer.decode.failures</b> / <b>tickpipe.consumer.claimed</b></li>
 *   <li><b>tickpipe.store.recorded</b> / <b>tickpipe.store.fast.failures</b></li>
 *   <li><b>tickpipe.flush.tick.rows</b> / <b>tickpipe.flush.depth.rows</b> / <b>tickpipe.flush.failures</b></li>
 * </ul>
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter ticksReceived;
    private final Counter tickDecodeErrors;
    private final Counter channelDropped;
    private final Counter publishAcknowledged;
    private final Counter publishDropped;
    private final Counter consumerProcessed;
    private final Counter consumerDecodeFailures;
    private final Counter consumerClaimed;
    private final Counter storeRecorded;
    private final Counter fastStoreFailures;
    private final Counter flushTickRows;
    private final Counter flushDepthRows;
    private final Counter flushFailures;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.ticksReceived = counter("tickpipe.ticks.received", "Ticks decoded by socket sessions");
        this.tickDecodeErrors = counter("tickpipe.ticks.decode.errors", "Socket ticks dropped as undecodable");
        this.channelDropped = counter("tickpipe.channel.dropped", "Ticks dropped on a full session channel");
        this.publishAcknowledged = counter("tickpipe.publish.acknowledged", "Ticks appended to the queue");
        this.publishDropped = counter("tickpipe.publish.dropped", "Ticks the publisher gave up on");
        this.consumerProcessed = counter("tickpipe.consumer.processed", "Queue entries stored and acknowledged");
        this.consumerDecodeFailures = counter("tickpipe.consumer.decode.failures", "Queue entries dropped as undecodable");
        this.consumerClaimed = counter("tickpipe.consumer.claimed", "Stale pending entries claimed for reprocessing");
        this.storeRecorded = counter("tickpipe.store.recorded", "Ticks recorded into symbol ledgers");
        this.fastStoreFailures = counter("tickpipe.store.fast.failures", "Failed fast-storage writes");
        this.flushTickRows = counter("tickpipe.flush.tick.rows", "Tick rows committed to durable storage");
        this.flushDepthRows = counter("tickpipe.flush.depth.rows", "Depth rows committed to durable storage");
        this.flushFailures = counter("tickpipe.flush.failures", "Flush batches that failed to commit");
    }

    public void gauge(String name, String description, Supplier<Number> supplier) {
        Gauge.builder(name, supplier)
                .description(description)
                .register(meterRegistry);
    }

    public void tickReceived() {
        ticksReceived.increment();
    }

    public void tickDecodeError() {
        tickDecodeErrors.increment();
    }

    public void channelDropped() {
        channelDropped.increment();
    }

    public void publishAcknowledged() {
        publishAcknowledged.increment();
    }

    public void publishDropped() {
        publishDropped.increment();
    }

    public void consumerProcessed() {
        consumerProcessed.increment();
    }

    public void consumerDecodeFailure() {
        consumerDecodeFailures.increment();
    }

    public void consumerClaimed(int count) {
        consumerClaimed.increment(count);
    }

    public void storeRecorded() {
        storeRecorded.increment();
    }

    public void fastStoreFailure() {
        fastStoreFailures.increment();
    }

    public void flushed(int tickRows, int depthRows) {
        flushTickRows.increment(tickRows);
        flushDepthRows.increment(depthRows);
    }

    public void flushFailure() {
        flushFailures.increment();
    }

    public double publishDroppedCount() {
        return publishDropped.count();
    }

    public double publishAcknowledgedCount() {
        return publishAcknowledged.count();
    }

    public double tickDecodeErrorCount() {
        return tickDecodeErrors.count();
    }

    public double consumerDecodeFailureCount() {
        return consumerDecodeFailures.count();
    }

    public double channelDroppedCount() {
        return channelDropped.count();
    }

    public double ticksReceivedCount() {
        return ticksReceived.count();
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(meterRegistry);
    }
}
