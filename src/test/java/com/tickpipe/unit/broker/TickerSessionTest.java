package com.tickpipe.unit.broker;

import static com.tickpipe.support.Eventually.await;
import static org.assertj.core.api.Assertions.assertThat;

import com.tickpipe.broker.AccessTokenProvider;
import com.tickpipe.broker.BackoffPolicy;
import com.tickpipe.broker.KiteTickMapper;
import com.tickpipe.broker.TickerSession;
import com.tickpipe.broker.TickerState;
import com.tickpipe.domain.enums.TickMode;
import com.tickpipe.domain.model.SubscriptionSet;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.observability.PipelineMetrics;
import com.tickpipe.support.FakeTickerTransport;
import com.tickpipe.support.FakeTickerTransportFactory;
import com.tickpipe.support.TestTicks;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TickerSession")
class TickerSessionTest {

    private final SubscriptionSet set =
            new SubscriptionSet(0, List.of(TestTicks.instrument(101), TestTicks.instrument(102), TestTicks.instrument(103)));

    private FakeTickerTransportFactory factory;
    private StubTokens tokens;
    private List<Tick> sink;
    private List<String> rejectedTokens;
    private TickerSession session;

    @BeforeEach
    void setUp() {
        factory = new FakeTickerTransportFactory();
        tokens = new StubTokens("token-1");
        sink = new CopyOnWriteArrayList<>();
        rejectedTokens = new CopyOnWriteArrayList<>();
        session = new TickerSession(
                set,
                factory,
                tokens,
                new KiteTickMapper(),
                sink::add,
                (s, rejected) -> rejectedTokens.add(String.valueOf(rejected)),
                new BackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(50)),
                TickMode.QUOTE,
                new PipelineMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        session.forceStop();
    }

    private void startAndAwaitSubscribed() {
        session.start();
        await(() -> session.getState() == TickerState.SUBSCRIBED);
    }

    @Nested
    @DisplayName("Subscription")
    class Subscription {

        @Test
        @DisplayName("subscribes the whole set once after connecting")
        void subscribesOnce() {
            startAndAwaitSubscribed();

            assertThat(factory.getCreated()).hasSize(1);
            assertThat(factory.latest().getSubscriptions()).containsExactly(List.of(101L, 102L, 103L));
            assertThat(factory.latest().getAccessToken()).isEqualTo("token-1");
        }

        @Test
        @DisplayName("ignores a repeated connected callback on the same connection")
        void duplicateConnected() {
            startAndAwaitSubscribed();

            factory.latest().fireConnected();
            factory.latest().fireConnected();

            await(() -> session.getSubscribeCount() == 1);
            assertThat(factory.subscribeCalls()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Reconnect")
    class Reconnect {

        @Test
        @DisplayName("reconnects after a drop and resubscribes exactly once on the new connection")
        void resubscribeExactlyOnce() {
            startAndAwaitSubscribed();
            FakeTickerTransport first = factory.latest();

            first.dropConnection("network reset");

            await(() -> session.getSubscribeCount() == 2);
            assertThat(first.isClosed()).isTrue();
            assertThat(factory.getCreated()).hasSize(2);
            assertThat(factory.latest().getSubscriptions()).containsExactly(List.of(101L, 102L, 103L));
            assertThat(session.getState()).isEqualTo(TickerState.SUBSCRIBED);
        }

        @Test
        @DisplayName("ignores late callbacks from a replaced connection")
        void staleCallbacksIgnored() {
            startAndAwaitSubscribed();
            FakeTickerTransport first = factory.latest();
            first.dropConnection("reset");
            await(() -> session.getSubscribeCount() == 2);

            first.dropConnection("late duplicate");
            first.fireConnected();

            await(() -> factory.subscribeCalls() == 2);
            assertThat(factory.getCreated()).hasSize(2);
            assertThat(session.getState()).isEqualTo(TickerState.SUBSCRIBED);
        }

        @Test
        @DisplayName("counts a burst of disconnects from one connection as a single failure")
        void burstOfDisconnects() {
            startAndAwaitSubscribed();
            FakeTickerTransport first = factory.latest();

            first.dropConnection("error");
            first.dropConnection("close");

            await(() -> session.getSubscribeCount() == 2);
            assertThat(factory.getCreated()).hasSize(2);
        }

        @Test
        @DisplayName("forced reconnect opens a fresh connection")
        void forceReconnect() {
            startAndAwaitSubscribed();

            session.forceReconnect("stalled");

            await(() -> session.getSubscribeCount() == 2);
            assertThat(factory.getCreated()).hasSize(2);
            assertThat(factory.getCreated().get(0).isClosed()).isTrue();
        }
    }

    @Nested
    @DisplayName("Auth rejection")
    class AuthRejection {

        @Test
        @DisplayName("escalates to the listener with the rejected token instead of retrying")
        void escalates() {
            startAndAwaitSubscribed();

            factory.latest().rejectAuth("403 Forbidden");

            await(() -> !rejectedTokens.isEmpty());
            assertThat(rejectedTokens).containsExactly("token-1");
            assertThat(session.isAuthHalted()).isTrue();
            assertThat(session.getState()).isEqualTo(TickerState.ERROR);
            assertThat(factory.getCreated()).hasSize(1);
        }

        @Test
        @DisplayName("restart reconnects with the refreshed token")
        void restartWithNewToken() {
            startAndAwaitSubscribed();
            factory.latest().rejectAuth("403 Forbidden");
            await(() -> !rejectedTokens.isEmpty());

            tokens.current = "token-2";
            session.restart();

            await(() -> session.getSubscribeCount() == 2);
            assertThat(factory.latest().getAccessToken()).isEqualTo("token-2");
            assertThat(session.isAuthHalted()).isFalse();
        }
    }

    @Nested
    @DisplayName("Ticks")
    class Ticks {

        @Test
        @DisplayName("maps ticks in arrival order and drops undecodable ones")
        void mapsAndDrops() {
            startAndAwaitSubscribed();

            factory.latest().emit(List.of(
                    TestTicks.kiteTick(101L, 10.0),
                    TestTicks.kiteTick(0L, 11.0),
                    TestTicks.kiteTick(102L, Double.NaN),
                    TestTicks.kiteTick(103L, 12.0)));

            assertThat(sink).extracting(Tick::getInstrumentToken).containsExactly(101L, 103L);
            assertThat(sink.get(0).getTradingSymbol()).isEqualTo("SYM101");
            assertThat(session.getTickCount()).isEqualTo(2);
            assertThat(session.getDecodeErrors()).isEqualTo(2);
            assertThat(session.getLastActivityAt()).isNotNull();
        }
    }

    @Nested
    @DisplayName("Stop")
    class Stop {

        @Test
        @DisplayName("closes the socket and stops the session thread")
        void stops() throws InterruptedException {
            startAndAwaitSubscribed();

            session.stop();

            assertThat(session.awaitStopped(Duration.ofSeconds(2))).isTrue();
            assertThat(factory.latest().isClosed()).isTrue();
            assertThat(session.getState()).isEqualTo(TickerState.DISCONNECTED);
        }
    }

    private static class StubTokens implements AccessTokenProvider {

        volatile String current;

        StubTokens(String current) {
            this.current = current;
        }

        @Override
        public String currentToken() {
            return current;
        }

        @Override
        public String refresh(String rejectedToken) {
            return current;
        }
    }
}
