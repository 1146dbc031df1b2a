package com.tickpipe.integration;

import static com.tickpipe.support.Eventually.await;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tickpipe.config.StreamConfig;
import com.tickpipe.domain.model.LatestSnapshot;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.exception.CommitFailureException;
import com.tickpipe.observability.PipelineMetrics;
import com.tickpipe.queue.PublishResult;
import com.tickpipe.queue.TickCodec;
import com.tickpipe.queue.TickStreamConsumer;
import com.tickpipe.queue.TickStreamPublisher;
import com.tickpipe.store.TickStore;
import com.tickpipe.support.InMemoryTickCache;
import com.tickpipe.support.InMemoryTickQueue;
import com.tickpipe.support.InMemoryTickRowWriter;
import com.tickpipe.support.TestTicks;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Publisher, queue, consumer, store and durable writer wired together with in-memory
 * queue and storage backends.
 */
@DisplayName("Tick pipeline flow")
class TickPipelineFlowTest {

    private final TickCodec codec = new TickCodec();
    private final PipelineMetrics metrics = new PipelineMetrics(new SimpleMeterRegistry());
    private final InMemoryTickCache cache = new InMemoryTickCache();
    private final InMemoryTickRowWriter writer = new InMemoryTickRowWriter();

    private InMemoryTickQueue queue;
    private TickStreamPublisher publisher;

    @AfterEach
    void tearDown() {
        if (publisher != null) {
            publisher.close(Duration.ofSeconds(1));
        }
    }

    private StreamConfig streamConfig() {
        StreamConfig config = new StreamConfig();
        config.setBlockTimeout(Duration.ofMillis(10));
        config.setClaimMinIdle(Duration.ZERO);
        config.setClaimInterval(Duration.ZERO);
        return config;
    }

    private void wire(int maxLength) {
        queue = new InMemoryTickQueue(maxLength);
        publisher = new TickStreamPublisher(queue, codec, metrics, Duration.ofSeconds(1), 100);
    }

    private void publishAll(Tick... ticks) {
        for (Tick tick : ticks) {
            assertThat(publisher.publish(tick)).isEqualTo(PublishResult.ACKNOWLEDGED);
        }
    }

    @Test
    @DisplayName("ticks reach durable storage in order and the latest snapshot holds the newest")
    void endToEnd() {
        wire(1000);
        TickStore store = new TickStore(cache, writer, metrics);
        TickStreamConsumer consumer = new TickStreamConsumer(queue, codec, store, streamConfig(), metrics);

        publishAll(
                TestTicks.tick("NIFTY 50", "100", 1),
                TestTicks.tick("NIFTY 50", "101", 2),
                TestTicks.tick("NIFTY 50", "99", 3));
        await(() -> queue.length() == 3);

        assertThat(consumer.pollOnce()).isEqualTo(3);
        store.flush();

        assertThat(writer.rows())
                .extracting(t -> t.getLastPrice().toPlainString())
                .containsExactly("100", "101", "99");
        LatestSnapshot latest = store.latest("NIFTY 50").orElseThrow();
        assertThat(latest.getLastPrice()).isEqualByComparingTo("99");
        assertThat(latest.getExchangeTimestamp()).isEqualTo(TestTicks.T0.plusSeconds(3));
        assertThat(cache.series("NIFTY 50", TestTicks.T0.toLocalDate())).hasSize(3);
        assertThat(queue.pendingCount(streamConfig().getConsumerGroup())).isZero();
    }

    @Test
    @DisplayName("a bounded queue keeps only the newest entries for the consumer")
    void boundedQueue() {
        wire(5);
        TickStore store = new TickStore(cache, writer, metrics);
        TickStreamConsumer consumer = new TickStreamConsumer(queue, codec, store, streamConfig(), metrics);

        for (int i = 0; i < 10; i++) {
            publishAll(TestTicks.tick("NIFTY 50", String.valueOf(100 + i), i));
        }
        await(() -> publisher.getAcknowledged() == 10);

        assertThat(queue.length()).isEqualTo(5);
        consumer.pollOnce();
        store.flush();

        assertThat(writer.rows())
                .extracting(t -> t.getLastPrice().toPlainString())
                .containsExactly("105", "106", "107", "108", "109");
    }

    @Test
    @DisplayName("ticks consumed while durable storage is failing are written by a later flush")
    void commitFailureRetained() {
        wire(1000);
        TickStore store = new TickStore(cache, writer, metrics);
        TickStreamConsumer consumer = new TickStreamConsumer(queue, codec, store, streamConfig(), metrics);

        publishAll(TestTicks.tick("NIFTY 50", "100", 1), TestTicks.tick("NIFTY BANK", "48000", 1));
        await(() -> queue.length() == 2);
        consumer.pollOnce();

        writer.failNext(1);
        assertThatThrownBy(store::flush).isInstanceOf(CommitFailureException.class);
        assertThat(store.pendingCount()).isEqualTo(2);

        publishAll(TestTicks.tick("NIFTY 50", "101", 2));
        await(() -> queue.length() == 3);
        consumer.pollOnce();
        store.flush();

        assertThat(writer.rows()).hasSize(3);
        assertThat(store.pendingCount()).isZero();
        assertThat(store.getConsecutiveFlushFailures()).isZero();
    }
}
