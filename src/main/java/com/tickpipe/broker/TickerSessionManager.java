package com.tickpipe.broker;

import com.tickpipe.config.ConnectorConfig;
import com.tickpipe.domain.model.SubscriptionSet;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.exception.BaseException;
import com.tickpipe.notification.PipelineNotifier;
import com.tickpipe.observability.PipelineMetrics;
import com.tickpipe.queue.TickStreamPublisher;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one {@link TickerSession} per subscription set and forwards their ticks to the publisher.
 *
 * <p>Threads owned here:
 * <ul>
 *   <li>{@code tick-forwarder}: drains the shared {@link TickChannel} into
 *       {@link TickStreamPublisher#publish(Tick)}, preserving per-session order</li>
 *   <li>{@code session-control}: staggered session starts, token refreshes after an auth
 *       rejection, and the periodic health check with the stall watchdog</li>
 * </ul>
 *
 * <p>An auth rejection refreshes the token and restarts the session, at most
 * {@code auth-retry-budget} times in a row per session. Past the budget the session stays down,
 * a CRITICAL alert goes out and {@link #liveness()} reports it. Other sessions keep running.
 */
@Component
@ConditionalOnProperty(prefix = "tickpipe.connector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TickerSessionManager implements TickerSession.Listener {

    private static final Logger log = LoggerFactory.getLogger(TickerSessionManager.class);

    private static final Duration FORWARDER_POLL = Duration.ofMillis(200);
    private static final Duration HEALTH_CHECK_INTERVAL = Duration.ofSeconds(5);

    private final ConnectorConfig connectorConfig;
    private final TickerTransportFactory transportFactory;
    private final AccessTokenProvider tokenProvider;
    private final KiteTickMapper tickMapper;
    private final TickStreamPublisher publisher;
    private final PipelineMetrics pipelineMetrics;
    private final PipelineNotifier pipelineNotifier;
    private final BackoffPolicy authBackoff;

    private final List<TickerSession> sessions = new CopyOnWriteArrayList<>();
    private final Map<Integer, AtomicInteger> authAttempts = new ConcurrentHashMap<>();
    private final Map<Integer, String> haltedSessions = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean forwarding = new AtomicBoolean(false);

    private volatile TickChannel channel;
    private volatile Thread forwarder;
    private volatile ScheduledExecutorService control;
    private volatile String haltReason;
    private volatile long forwarded;

    public TickerSessionManager(
            ConnectorConfig connectorConfig,
            TickerTransportFactory transportFactory,
            AccessTokenProvider tokenProvider,
            KiteTickMapper tickMapper,
            TickStreamPublisher publisher,
            PipelineMetrics pipelineMetrics,
            PipelineNotifier pipelineNotifier) {
        this.connectorConfig = connectorConfig;
        this.transportFactory = transportFactory;
        this.tokenProvider = tokenProvider;
        this.tickMapper = tickMapper;
        this.publisher = publisher;
        this.pipelineMetrics = pipelineMetrics;
        this.pipelineNotifier = pipelineNotifier;
        this.authBackoff =
                new BackoffPolicy(connectorConfig.getInitialReconnectDelay(), connectorConfig.getMaxReconnectDelay());
        pipelineMetrics.gauge(
                "tickpipe.sessions.subscribed", "Sessions currently subscribed", this::subscribedSessionCount);
    }

    /**
     * Starts one session per non-empty set. Calling it twice is a no-op. A start after
     * {@link #stop()} discards the previous sessions, halts and auth budgets; they stay readable
     * between stop and the next start.
     */
    public synchronized void start(List<SubscriptionSet> partitions) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Session manager already running, ignoring start request");
            return;
        }
        sessions.clear();
        haltedSessions.clear();
        authAttempts.clear();
        haltReason = null;

        channel = new TickChannel(connectorConfig.getChannelCapacity(), pipelineMetrics);
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, "session-control");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        control = scheduler;

        forwarding.set(true);
        forwarder = new Thread(this::forwardLoop, "tick-forwarder");
        forwarder.setDaemon(true);
        forwarder.start();

        BackoffPolicy backoff =
                new BackoffPolicy(connectorConfig.getInitialReconnectDelay(), connectorConfig.getMaxReconnectDelay());
        long staggerMs = connectorConfig.getStartStagger().toMillis();
        int started = 0;
        for (SubscriptionSet set : partitions) {
            if (set.size() == 0) {
                continue;
            }
            TickerSession session = new TickerSession(
                    set,
                    transportFactory,
                    tokenProvider,
                    tickMapper,
                    channel,
                    this,
                    backoff,
                    connectorConfig.getTickMode(),
                    pipelineMetrics);
            sessions.add(session);
            control.schedule(session::start, staggerMs * started, TimeUnit.MILLISECONDS);
            started++;
        }

        long checkMs = HEALTH_CHECK_INTERVAL.toMillis();
        control.scheduleWithFixedDelay(this::checkSessions, checkMs, checkMs, TimeUnit.MILLISECONDS);
        log.info("Session manager started {} session(s), {} instruments total", started, instrumentCount());
    }

    /**
     * Stops every session, waits up to {@code shutdown-timeout} for them, force-terminates the
     * rest, then drains the channel into the publisher.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping {} session(s)", sessions.size());
        if (control != null) {
            control.shutdownNow();
        }

        sessions.forEach(TickerSession::stop);
        long deadline = System.currentTimeMillis() + connectorConfig.getShutdownTimeout().toMillis();
        for (TickerSession session : sessions) {
            long remaining = Math.max(0, deadline - System.currentTimeMillis());
            try {
                if (!session.awaitStopped(Duration.ofMillis(remaining))) {
                    log.warn("Session {} did not stop in time, forcing", session.getIndex());
                    session.forceStop();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                session.forceStop();
            }
        }

        forwarding.set(false);
        Thread current = forwarder;
        if (current != null) {
            try {
                current.join(Math.max(1000, connectorConfig.getShutdownTimeout().toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (current.isAlive()) {
                log.warn("Forwarder still draining after shutdown timeout, {} ticks left", channel.size());
                current.interrupt();
            }
        }
        log.info(
                "Session manager stopped. ticks={}, forwarded={}, channelDropped={}",
                totalTicks(),
                forwarded,
                channel != null ? channel.getDropped() : 0);
    }

    // ---- Forwarder ----

    private void forwardLoop() {
        try {
            while (forwarding.get() || !channel.isEmpty()) {
                Tick tick = channel.poll(FORWARDER_POLL);
                if (tick != null) {
                    publisher.publish(tick);
                    forwarded++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Forwarder interrupted with {} ticks in the channel", channel.size());
        }
    }

    // ---- Auth escalation ----

    @Override
    public void onAuthRejected(TickerSession session, String rejectedToken) {
        schedule(() -> refreshAndRestart(session, rejectedToken), 0);
    }

    private void refreshAndRestart(TickerSession session, String rejectedToken) {
        if (!running.get()) {
            return;
        }
        int index = session.getIndex();
        int attempt = authAttempts.computeIfAbsent(index, i -> new AtomicInteger()).incrementAndGet();
        if (attempt > connectorConfig.getAuthRetryBudget()) {
            haltSession(session, "auth rejected " + (attempt - 1) + " times after refresh");
            return;
        }

        try {
            tokenProvider.refresh(rejectedToken);
            log.info("Session {} restarting with refreshed token (attempt {})", index, attempt);
            session.restart();
        } catch (BaseException e) {
            long delay = authBackoff.delayFor(attempt);
            log.error("Token refresh for session {} failed: {}. Retrying in {}ms", index, e.getMessage(), delay);
            schedule(() -> refreshAndRestart(session, rejectedToken), delay);
        }
    }

    private void haltSession(TickerSession session, String reason) {
        haltedSessions.put(session.getIndex(), reason);
        session.stop();
        log.error("Session {} halted: {}", session.getIndex(), reason);
        if (haltedSessions.size() == sessions.size()) {
            markHalted("all sessions halted");
        }
        pipelineNotifier.sessionHalted(session.getIndex(), reason);
    }

    /** Marks the connector unusable; health turns DOWN until restart. */
    public void markHalted(String reason) {
        haltReason = reason;
        log.error("Connector halted: {}", reason);
    }

    // ---- Periodic checks ----

    /** Resets auth budgets of healthy sessions and runs the stall watchdog. Runs every 5 seconds. */
    public void checkSessions() {
        for (TickerSession session : sessions) {
            if (session.getState() == TickerState.SUBSCRIBED) {
                authAttempts.remove(session.getIndex());
            }
        }

        Duration stallTimeout = connectorConfig.getStallTimeout();
        if (stallTimeout.isZero() || stallTimeout.isNegative()) {
            return;
        }
        Instant lastActivity = lastActivityAt();
        boolean anySubscribed = sessions.stream().anyMatch(s -> s.getState() == TickerState.SUBSCRIBED);
        if (!anySubscribed || lastActivity == null) {
            return;
        }
        Duration silent = Duration.between(lastActivity, Instant.now());
        if (silent.compareTo(stallTimeout) >= 0) {
            log.warn("No ticks for {}s on any session, reconnecting all sessions", silent.toSeconds());
            pipelineNotifier.stalled(silent.toSeconds());
            for (TickerSession session : sessions) {
                if (!haltedSessions.containsKey(session.getIndex())) {
                    session.forceReconnect("stalled for " + silent.toSeconds() + "s");
                }
            }
        }
    }

    private void schedule(Runnable task, long delayMs) {
        ScheduledExecutorService current = control;
        if (current == null) {
            return;
        }
        try {
            current.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Session manager stopping, control task dropped");
        }
    }

    // ---- Introspection ----

    public PipelineLiveness liveness() {
        Map<Integer, TickerState> states = new LinkedHashMap<>();
        for (TickerSession session : sessions) {
            states.put(session.getIndex(), session.getState());
        }
        return new PipelineLiveness(states, haltedSessions.size(), isHalted(), haltReason);
    }

    public boolean isHalted() {
        return haltReason != null;
    }

    public boolean isRunning() {
        return running.get();
    }

    public List<TickerSession> getSessions() {
        return List.copyOf(sessions);
    }

    public long totalTicks() {
        return sessions.stream().mapToLong(TickerSession::getTickCount).sum();
    }

    public long channelDropped() {
        return channel != null ? channel.getDropped() : 0;
    }

    public long getForwarded() {
        return forwarded;
    }

    /** Latest subscribe or tick across sessions; null before any session subscribed. */
    public Instant lastActivityAt() {
        return sessions.stream()
                .map(TickerSession::getLastActivityAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);
    }

    private int instrumentCount() {
        return sessions.stream().mapToInt(s -> s.getSubscriptionSet().size()).sum();
    }

    private int subscribedSessionCount() {
        return (int) sessions.stream().filter(s -> s.getState() == TickerState.SUBSCRIBED).count();
    }
}
