package com.tickpipe.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tickpipe.broker.TickerSessionManager;
import com.tickpipe.config.ConnectorConfig;
import com.tickpipe.notification.PipelineNotifier;
import com.tickpipe.observability.PipelineStatsReporter;
import com.tickpipe.queue.TickStreamConsumer;
import com.tickpipe.queue.TickStreamPublisher;
import com.tickpipe.recovery.PipelineLifecycle;
import com.tickpipe.store.TickFlushService;
import java.time.Duration;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.ObjectProvider;

@DisplayName("PipelineLifecycle")
class PipelineLifecycleTest {

    private TickerSessionManager manager;
    private TickStreamPublisher publisher;
    private TickStreamConsumer consumer;
    private TickFlushService flushService;
    private PipelineStatsReporter statsReporter;
    private PipelineNotifier notifier;
    private ConnectorConfig connectorConfig;

    @BeforeEach
    void setUp() {
        manager = mock(TickerSessionManager.class);
        publisher = mock(TickStreamPublisher.class);
        consumer = mock(TickStreamConsumer.class);
        flushService = mock(TickFlushService.class);
        statsReporter = mock(PipelineStatsReporter.class);
        notifier = mock(PipelineNotifier.class);
        connectorConfig = new ConnectorConfig();
        connectorConfig.setShutdownTimeout(Duration.ofSeconds(3));
        when(statsReporter.summary()).thenReturn("received=10");
    }

    /** Provider that behaves like Spring's for a present or missing bean. */
    @SuppressWarnings("unchecked")
    private static <T> ObjectProvider<T> provider(T bean) {
        ObjectProvider<T> provider = mock(ObjectProvider.class);
        doAnswer(invocation -> {
            if (bean != null) {
                ((Consumer<T>) invocation.getArgument(0)).accept(bean);
            }
            return null;
        }).when(provider).ifAvailable(any());
        return provider;
    }

    private PipelineLifecycle lifecycle(TickerSessionManager m, TickStreamPublisher p) {
        return new PipelineLifecycle(
                provider(m), provider(p), provider(consumer), provider(flushService), statsReporter, notifier, connectorConfig);
    }

    @Test
    @DisplayName("starts the flush service before the consumer")
    void startsReceiver() {
        PipelineLifecycle lifecycle = lifecycle(manager, publisher);

        lifecycle.start();

        InOrder order = inOrder(flushService, consumer);
        order.verify(flushService).start();
        order.verify(consumer).start();
        assertThat(lifecycle.isRunning()).isTrue();
    }

    @Test
    @DisplayName("stops in data-flow order and reports the summary")
    void stopsInOrder() {
        PipelineLifecycle lifecycle = lifecycle(manager, publisher);
        lifecycle.start();

        lifecycle.stop();

        InOrder order = inOrder(manager, publisher, consumer, flushService, notifier);
        order.verify(manager).stop();
        order.verify(publisher).close(Duration.ofSeconds(3));
        order.verify(consumer).stop(Duration.ofSeconds(3));
        order.verify(flushService).stop(Duration.ofSeconds(3));
        order.verify(notifier).pipelineStopped("received=10");
        assertThat(lifecycle.isRunning()).isFalse();
    }

    @Test
    @DisplayName("receiver-only processes stop without connector beans")
    void receiverOnly() {
        PipelineLifecycle lifecycle = lifecycle(null, null);
        lifecycle.start();

        lifecycle.stop();

        verify(flushService).stop(Duration.ofSeconds(3));
        verify(notifier).pipelineStopped(anyString());
    }
}
