package com.tickpipe.observability;

import com.tickpipe.broker.TickerSessionManager;
import com.tickpipe.notification.PipelineNotifier;
import com.tickpipe.store.TickStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Hourly pipeline summary to the log and, at INFO, to Telegram. */
@Component
public class PipelineStatsReporter {

    private static final Logger log = LoggerFactory.getLogger(PipelineStatsReporter.class);

    private final PipelineMetrics pipelineMetrics;
    private final ObjectProvider<TickerSessionManager> sessionManager;
    private final ObjectProvider<TickStore> tickStore;
    private final PipelineNotifier pipelineNotifier;

    public PipelineStatsReporter(
            PipelineMetrics pipelineMetrics,
            ObjectProvider<TickerSessionManager> sessionManager,
            ObjectProvider<TickStore> tickStore,
            PipelineNotifier pipelineNotifier) {
        this.pipelineMetrics = pipelineMetrics;
        this.sessionManager = sessionManager;
        this.tickStore = tickStore;
        this.pipelineNotifier = pipelineNotifier;
    }

    @Scheduled(fixedRateString = "${tickpipe.stats-interval-ms:3600000}", initialDelayString = "${tickpipe.stats-interval-ms:3600000}")
    public void report() {
        String summary = summary();
        log.info("Pipeline stats: {}", summary);
        pipelineNotifier.stats("Pipeline stats: " + summary);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        TickerSessionManager manager = sessionManager.getIfAvailable();
        if (manager != null) {
            sb.append(String.format(
                    "received=%d published=%.0f dropped=%.0f channelDropped=%d",
                    manager.totalTicks(),
                    pipelineMetrics.publishAcknowledgedCount(),
                    pipelineMetrics.publishDroppedCount(),
                    manager.channelDropped()));
        }
        TickStore store = tickStore.getIfAvailable();
        if (store != null) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(String.format(
                    "pending=%d flushFailures=%d decodeFailures=%.0f",
                    store.pendingCount(),
                    store.getConsecutiveFlushFailures(),
                    pipelineMetrics.consumerDecodeFailureCount()));
        }
        return sb.toString();
    }
}
