package com.tickpipe.notification;

import com.tickpipe.domain.enums.AlertSeverity;
import org.springframework.stereotype.Service;

/** Operator-facing pipeline events, phrased once here and delivered through Telegram. */
@Service
public class PipelineNotifier {

    private final TelegramNotifier telegramNotifier;

    public PipelineNotifier(TelegramNotifier telegramNotifier) {
        this.telegramNotifier = telegramNotifier;
    }

    public void loginSucceeded(int instrumentCount, int sessionCount) {
        telegramNotifier.send(
                String.format(
                        "Tick pipeline logged in. Streaming %d instruments over %d connection(s).",
                        instrumentCount, sessionCount),
                AlertSeverity.INFO);
    }

    public void sessionHalted(int sessionIndex, String reason) {
        telegramNotifier.send(
                String.format("Session %d halted: %s. Manual re-login required.", sessionIndex, reason),
                AlertSeverity.CRITICAL);
    }

    public void startupFailed(int attempts) {
        telegramNotifier.send(
                String.format("Connector failed to start after %d attempts. Manual login required.", attempts),
                AlertSeverity.CRITICAL);
    }

    public void capacityExceeded(String detail) {
        telegramNotifier.send("Instrument selection exceeds streaming capacity: " + detail, AlertSeverity.CRITICAL);
    }

    public void stalled(long silentSeconds) {
        telegramNotifier.send(
                String.format("No ticks for %ds on any session, forcing reconnect.", silentSeconds),
                AlertSeverity.WARNING);
    }

    public void flushFailing(int consecutiveFailures, String reason) {
        telegramNotifier.send(
                String.format("Durable flush failed %d times in a row: %s", consecutiveFailures, reason),
                AlertSeverity.WARNING);
    }

    public void stats(String summary) {
        telegramNotifier.send(summary, AlertSeverity.INFO);
    }

    public void pipelineStopped(String summary) {
        telegramNotifier.send("Tick pipeline stopped. " + summary, AlertSeverity.INFO);
    }
}
