package com.tickpipe.observability;

import com.tickpipe.broker.PipelineLiveness;
import com.tickpipe.broker.TickerSessionManager;
import com.tickpipe.config.StoreConfig;
import com.tickpipe.queue.TickStreamConsumer;
import com.tickpipe.store.TickStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * {@code /actuator/health} contribution for the pipeline. Each side reports only when it runs in
 * this process.
 *
 * <p>DOWN when the connector is halted, a session exhausted its auth budget, the consumer thread
 * died while the consumer is meant to run, or the durable flush failed
 * {@code flush-failure-threshold} times in a row.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final ObjectProvider<TickerSessionManager> sessionManager;
    private final ObjectProvider<TickStore> tickStore;
    private final ObjectProvider<TickStreamConsumer> tickConsumer;
    private final StoreConfig storeConfig;

    public PipelineHealthIndicator(
            ObjectProvider<TickerSessionManager> sessionManager,
            ObjectProvider<TickStore> tickStore,
            ObjectProvider<TickStreamConsumer> tickConsumer,
            StoreConfig storeConfig) {
        this.sessionManager = sessionManager;
        this.tickStore = tickStore;
        this.tickConsumer = tickConsumer;
        this.storeConfig = storeConfig;
    }

    @Override
    public Health health() {
        Health.Builder builder = Health.up();
        boolean down = false;

        TickerSessionManager manager = sessionManager.getIfAvailable();
        if (manager != null) {
            PipelineLiveness liveness = manager.liveness();
            builder.withDetail("sessions", liveness.sessions())
                    .withDetail("haltedSessions", liveness.haltedSessions())
                    .withDetail("ticksReceived", manager.totalTicks())
                    .withDetail("channelDropped", manager.channelDropped());
            if (liveness.halted()) {
                builder.withDetail("haltReason", liveness.haltReason());
            }
            down = liveness.halted() || liveness.haltedSessions() > 0;
        }

        TickStore store = tickStore.getIfAvailable();
        if (store != null) {
            int failures = store.getConsecutiveFlushFailures();
            builder.withDetail("pendingTicks", store.pendingCount())
                    .withDetail("consecutiveFlushFailures", failures);
            if (store.getLastFlushAt() != null) {
                builder.withDetail("lastFlushAt", store.getLastFlushAt().toString());
            }
            down = down || failures >= storeConfig.getFlushFailureThreshold();
        }

        TickStreamConsumer consumer = tickConsumer.getIfAvailable();
        if (consumer != null) {
            boolean alive = consumer.isWorkerAlive();
            builder.withDetail("consumerRunning", consumer.isRunning())
                    .withDetail("consumerWorkerAlive", alive)
                    .withDetail("ticksConsumed", consumer.getProcessed());
            down = down || !alive;
        }

        return down ? builder.down().build() : builder.build();
    }
}
