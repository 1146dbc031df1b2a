package com.tickpipe.broker;

import com.tickpipe.domain.enums.TickMode;
import com.tickpipe.domain.model.SubscriptionSet;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.exception.AuthRejectedException;
import com.tickpipe.exception.DecodeException;
import com.tickpipe.exception.TransportException;
import com.tickpipe.observability.PipelineMetrics;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One streaming connection to the broker, owning a fixed {@link SubscriptionSet}.
 *
 * <p>All lifecycle work (connect, subscribe, backoff, close) runs on the session's own
 * single-thread executor, so state transitions never race. Transport callbacks only enqueue
 * work there, tagged with the connection generation they belong to; callbacks from an older
 * connection are ignored. Ticks are the exception: they are mapped and offered to the
 * {@link TickSink} directly on the transport's read thread, which never blocks.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>disconnect, transport error or rejected subscription: ERROR, exponential backoff, then a
 *       new connection with the current token; the whole set is subscribed exactly once per
 *       connection</li>
 *   <li>auth rejection: ERROR without local retry; the {@link Listener} (the session manager)
 *       refreshes the token and calls {@link #restart()}</li>
 *   <li>an undecodable tick is logged, counted and dropped</li>
 * </ul>
 */
public class TickerSession {

    private static final Logger log = LoggerFactory.getLogger(TickerSession.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    /** Receives session events that need a decision above the session. */
    public interface Listener {

        void onAuthRejected(TickerSession session, String rejectedToken);
    }

    private final SubscriptionSet subscriptionSet;
    private final List<Long> tokens;
    private final Map<Long, String> symbols;
    private final TickerTransportFactory transportFactory;
    private final AccessTokenProvider tokenProvider;
    private final KiteTickMapper tickMapper;
    private final TickSink sink;
    private final Listener listener;
    private final BackoffPolicy backoffPolicy;
    private final TickMode tickMode;
    private final PipelineMetrics pipelineMetrics;

    private final ScheduledThreadPoolExecutor executor;

    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicLong subscribeCount = new AtomicLong();
    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong decodeErrors = new AtomicLong();

    private volatile TickerState state = TickerState.DISCONNECTED;
    private volatile TickerTransport transport;
    private volatile String transportToken;
    private volatile Instant lastActivityAt;
    private volatile boolean stopping;
    private volatile boolean authHalted;

    // Confined to the executor thread
    private long subscribedGeneration = -1;
    private long failedGeneration = -1;

    public TickerSession(
            SubscriptionSet subscriptionSet,
            TickerTransportFactory transportFactory,
            AccessTokenProvider tokenProvider,
            KiteTickMapper tickMapper,
            TickSink sink,
            Listener listener,
            BackoffPolicy backoffPolicy,
            TickMode tickMode,
            PipelineMetrics pipelineMetrics) {
        this.subscriptionSet = subscriptionSet;
        this.tokens = subscriptionSet.tokens();
        this.symbols = subscriptionSet.symbolsByToken();
        this.transportFactory = transportFactory;
        this.tokenProvider = tokenProvider;
        this.tickMapper = tickMapper;
        this.sink = sink;
        this.listener = listener;
        this.backoffPolicy = backoffPolicy;
        this.tickMode = tickMode;
        this.pipelineMetrics = pipelineMetrics;

        String threadName = "ticker-session-" + subscriptionSet.getConnectionIndex();
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    public void start() {
        log.info(
                "Starting session {} with {} instruments in {} mode",
                getIndex(),
                tokens.size(),
                tickMode);
        submit(this::connect);
    }

    /** Reconnects after a token refresh. Clears the auth halt and the backoff counter. */
    public void restart() {
        submit(() -> {
            if (stopping) {
                return;
            }
            authHalted = false;
            reconnectAttempts.set(0);
            failedGeneration = generation.get();
            closeTransport();
            connect();
        });
    }

    /** Drops the current connection and reconnects immediately (stall recovery). */
    public void forceReconnect(String reason) {
        submit(() -> {
            if (stopping || authHalted) {
                return;
            }
            log.warn("Session {} forced reconnect: {}", getIndex(), reason);
            failedGeneration = generation.get();
            state = TickerState.ERROR;
            closeTransport();
            reconnectAttempts.set(0);
            connect();
        });
    }

    /** Cooperative stop: closes the socket on the session thread and stops accepting work. */
    public void stop() {
        stopping = true;
        submit(() -> {
            closeTransport();
            state = TickerState.DISCONNECTED;
            log.info("Session {} stopped", getIndex());
        });
        executor.shutdown();
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Abandons in-flight work after a stop that did not finish in time. */
    public void forceStop() {
        stopping = true;
        executor.shutdownNow();
        closeTransport();
        state = TickerState.DISCONNECTED;
    }

    // ---- Session thread ----

    private void connect() {
        if (stopping) {
            return;
        }
        state = TickerState.CONNECTING;

        String token;
        try {
            token = tokenProvider.currentToken();
        } catch (AuthRejectedException e) {
            haltForAuth(null, e.getMessage());
            return;
        }

        long connection = generation.incrementAndGet();
        try {
            TickerTransport next = transportFactory.create(token);
            transport = next;
            transportToken = token;
            next.connect(new SessionTransportListener(connection));
        } catch (TransportException e) {
            handleFailure(connection, e.getMessage());
        }
    }

    private void subscribeAll(long connection) {
        if (isStale(connection) || stopping || subscribedGeneration == connection || failedGeneration == connection) {
            return;
        }
        try {
            transport.subscribe(tokens, tickMode);
            subscribedGeneration = connection;
            subscribeCount.incrementAndGet();
            reconnectAttempts.set(0);
            lastActivityAt = Instant.now();
            state = TickerState.SUBSCRIBED;
            log.info("Session {} subscribed {} instruments", getIndex(), tokens.size());
        } catch (TransportException e) {
            handleFailure(connection, "subscription rejected: " + e.getMessage());
        }
    }

    private void handleFailure(long connection, String reason) {
        if (isStale(connection) || stopping || failedGeneration == connection) {
            return;
        }
        failedGeneration = connection;
        state = TickerState.ERROR;
        closeTransport();

        int attempt = reconnectAttempts.incrementAndGet();
        long delay = backoffPolicy.delayFor(attempt);
        log.warn("Session {} disconnected ({}). Reconnect attempt {} in {}ms", getIndex(), reason, attempt, delay);
        try {
            executor.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Session {} executor shut down, reconnect not scheduled", getIndex());
        }
    }

    private void handleAuthRejected(long connection, String reason) {
        if (isStale(connection) || stopping || failedGeneration == connection) {
            return;
        }
        failedGeneration = connection;
        haltForAuth(transportToken, reason);
    }

    private void haltForAuth(String rejectedToken, String reason) {
        state = TickerState.ERROR;
        authHalted = true;
        closeTransport();
        log.error("Session {} rejected by broker: {}. Waiting for a token refresh.", getIndex(), reason);
        listener.onAuthRejected(this, rejectedToken);
    }

    private void closeTransport() {
        TickerTransport current = transport;
        if (current != null) {
            current.close();
        }
    }

    // ---- Transport read thread ----

    private void handleTicks(List<com.zerodhatech.models.Tick> kiteTicks) {
        LocalDateTime receivedAt = LocalDateTime.now(IST);
        for (com.zerodhatech.models.Tick kiteTick : kiteTicks) {
            Tick tick;
            try {
                tick = tickMapper.map(kiteTick, symbols, tickMode, receivedAt);
            } catch (DecodeException e) {
                decodeErrors.incrementAndGet();
                pipelineMetrics.tickDecodeError();
                log.warn("Session {} dropped undecodable tick: {}", getIndex(), e.getMessage());
                continue;
            }
            tickCount.incrementAndGet();
            pipelineMetrics.tickReceived();
            sink.offer(tick);
        }
        lastActivityAt = Instant.now();
    }

    private boolean isStale(long connection) {
        return connection != generation.get();
    }

    private void submit(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Session {} is stopped, ignoring event", getIndex());
        }
    }

    private class SessionTransportListener implements TransportListener {

        private final long connection;

        SessionTransportListener(long connection) {
            this.connection = connection;
        }

        @Override
        public void onConnected() {
            submit(() -> subscribeAll(connection));
        }

        @Override
        public void onDisconnected(String reason) {
            submit(() -> handleFailure(connection, reason));
        }

        @Override
        public void onAuthRejected(String reason) {
            submit(() -> handleAuthRejected(connection, reason));
        }

        @Override
        public void onTicks(List<com.zerodhatech.models.Tick> ticks) {
            if (!isStale(connection)) {
                handleTicks(ticks);
            }
        }
    }

    // ---- Introspection ----

    public int getIndex() {
        return subscriptionSet.getConnectionIndex();
    }

    public SubscriptionSet getSubscriptionSet() {
        return subscriptionSet;
    }

    public TickerState getState() {
        return state;
    }

    public boolean isAuthHalted() {
        return authHalted;
    }

    /** Number of times the full set was subscribed (once per successful connection). */
    public long getSubscribeCount() {
        return subscribeCount.get();
    }

    public long getTickCount() {
        return tickCount.get();
    }

    public long getDecodeErrors() {
        return decodeErrors.get();
    }

    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    /** Time of the last subscribe or tick batch; null before the first subscribe. */
    public Instant getLastActivityAt() {
        return lastActivityAt;
    }
}
