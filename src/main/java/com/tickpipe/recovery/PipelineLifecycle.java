package com.tickpipe.recovery;

import com.tickpipe.broker.TickerSessionManager;
import com.tickpipe.config.ConnectorConfig;
import com.tickpipe.notification.PipelineNotifier;
import com.tickpipe.observability.PipelineStatsReporter;
import com.tickpipe.queue.TickStreamConsumer;
import com.tickpipe.queue.TickStreamPublisher;
import com.tickpipe.store.TickFlushService;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Starts the receiver side with the context and shuts the whole pipeline down in data-flow
 * order, so nothing already accepted is lost:
 * <ol>
 *   <li>socket sessions stop; the forwarder drains the channel into the publisher</li>
 *   <li>the publisher finishes queued writes</li>
 *   <li>the consumer stops reading</li>
 *   <li>the flush service runs its final flush</li>
 * </ol>
 *
 * <p>The connector side is started later by {@code PipelineStartupRunner}, after login.
 */
@Service
public class PipelineLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PipelineLifecycle.class);

    private final ObjectProvider<TickerSessionManager> sessionManager;
    private final ObjectProvider<TickStreamPublisher> publisher;
    private final ObjectProvider<TickStreamConsumer> consumer;
    private final ObjectProvider<TickFlushService> flushService;
    private final PipelineStatsReporter statsReporter;
    private final PipelineNotifier pipelineNotifier;
    private final ConnectorConfig connectorConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public PipelineLifecycle(
            ObjectProvider<TickerSessionManager> sessionManager,
            ObjectProvider<TickStreamPublisher> publisher,
            ObjectProvider<TickStreamConsumer> consumer,
            ObjectProvider<TickFlushService> flushService,
            PipelineStatsReporter statsReporter,
            PipelineNotifier pipelineNotifier,
            ConnectorConfig connectorConfig) {
        this.sessionManager = sessionManager;
        this.publisher = publisher;
        this.consumer = consumer;
        this.flushService = flushService;
        this.statsReporter = statsReporter;
        this.pipelineNotifier = pipelineNotifier;
        this.connectorConfig = connectorConfig;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        flushService.ifAvailable(TickFlushService::start);
        consumer.ifAvailable(TickStreamConsumer::start);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Pipeline shutdown initiated");
        Duration timeout = connectorConfig.getShutdownTimeout();

        sessionManager.ifAvailable(TickerSessionManager::stop);
        publisher.ifAvailable(p -> p.close(timeout));
        consumer.ifAvailable(c -> c.stop(timeout));
        flushService.ifAvailable(f -> f.stop(timeout));

        String summary = statsReporter.summary();
        log.info("Pipeline stopped: {}", summary);
        pipelineNotifier.pipelineStopped(summary);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /** Stop early, before the Redis connection factory and the datasource go away. */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 100;
    }
}
