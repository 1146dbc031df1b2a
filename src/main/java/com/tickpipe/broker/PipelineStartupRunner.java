package com.tickpipe.broker;

import com.tickpipe.domain.model.SubscriptionSet;
import com.tickpipe.exception.BaseException;
import com.tickpipe.exception.CapacityExceededException;
import com.tickpipe.notification.PipelineNotifier;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Connector startup once the context is ready: log in, resolve and partition the universe,
 * start the sessions.
 *
 * <p>Runs on its own thread so startup is never blocked. Login and instrument download are
 * retried with exponential backoff (30s doubling to 5 minutes, 10 attempts). A capacity error
 * is not retried: the connector is marked halted and a CRITICAL alert is sent.
 */
@Component
@ConditionalOnProperty(prefix = "tickpipe.connector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineStartupRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(PipelineStartupRunner.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final long INITIAL_RETRY_INTERVAL_MS = 30_000;
    private static final long MAX_RETRY_INTERVAL_MS = 300_000;
    private static final int MAX_RETRIES = 10;

    private final SessionContext sessionContext;
    private final InstrumentUniverseService instrumentUniverseService;
    private final TickerSessionManager tickerSessionManager;
    private final PipelineNotifier pipelineNotifier;

    public PipelineStartupRunner(
            SessionContext sessionContext,
            InstrumentUniverseService instrumentUniverseService,
            TickerSessionManager tickerSessionManager,
            PipelineNotifier pipelineNotifier) {
        this.sessionContext = sessionContext;
        this.instrumentUniverseService = instrumentUniverseService;
        this.tickerSessionManager = tickerSessionManager;
        this.pipelineNotifier = pipelineNotifier;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        Thread thread = new Thread(this::startPipeline, "pipeline-startup");
        thread.setDaemon(true);
        thread.start();
    }

    /** @return true when the sessions were started */
    public boolean startPipeline() {
        log.info("Startup: logging in to Kite and resolving instruments...");
        for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
            try {
                sessionContext.currentToken();
                List<SubscriptionSet> partitions = instrumentUniverseService.resolve(LocalDate.now(IST));
                tickerSessionManager.start(partitions);
                pipelineNotifier.loginSucceeded(
                        partitions.stream().mapToInt(SubscriptionSet::size).sum(), partitions.size());
                return true;
            } catch (CapacityExceededException e) {
                log.error("Cannot stream the configured universe: {}", e.getMessage());
                pipelineNotifier.capacityExceeded(e.getMessage());
                tickerSessionManager.markHalted(e.getMessage());
                return false;
            } catch (BaseException e) {
                long interval = Math.min(INITIAL_RETRY_INTERVAL_MS * (1L << (attempt - 1)), MAX_RETRY_INTERVAL_MS);
                log.warn(
                        "Startup attempt {}/{} failed: {}. Retrying in {}s...",
                        attempt,
                        MAX_RETRIES,
                        e.getMessage(),
                        interval / 1000);
                if (attempt < MAX_RETRIES && !sleep(interval)) {
                    return false;
                }
            }
        }

        log.error("Connector failed to start after {} attempts", MAX_RETRIES);
        tickerSessionManager.markHalted("startup failed after " + MAX_RETRIES + " attempts");
        pipelineNotifier.startupFailed(MAX_RETRIES);
        return false;
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Startup retry interrupted");
            return false;
        }
    }
}
