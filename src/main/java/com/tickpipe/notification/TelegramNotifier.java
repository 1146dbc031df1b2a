package com.tickpipe.notification;

import com.tickpipe.domain.enums.AlertSeverity;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends operator alerts through the Telegram Bot API.
 *
 * <p>Non-critical messages share a per-minute permit pool; once it is exhausted further
 * messages are logged and dropped. CRITICAL messages skip the limiter. Delivery failures are
 * logged and never reach the caller.
 */
@Component
public class TelegramNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;
    private final Semaphore rateLimiter;

    public TelegramNotifier(TelegramConfig telegramConfig) {
        this(telegramConfig, new RestTemplate());
    }

    public TelegramNotifier(TelegramConfig telegramConfig, RestTemplate restTemplate) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
        this.rateLimiter = new Semaphore(Math.max(1, telegramConfig.getMaxMessagesPerMinute()));
    }

    /** Sends a message; returns false when disabled, rate limited or the send failed. */
    public boolean send(String text, AlertSeverity severity) {
        if (!telegramConfig.isEnabled()) {
            log.debug("Telegram disabled, skipping: {}", text);
            return false;
        }

        TelegramMessage message = TelegramMessage.builder()
                .text(text)
                .severity(severity)
                .timestamp(System.currentTimeMillis())
                .build();

        if (severity == AlertSeverity.CRITICAL) {
            return sendMessage(message);
        }
        if (!rateLimiter.tryAcquire()) {
            log.warn("Telegram rate limit reached, dropping {} message: {}", severity, text);
            return false;
        }
        CompletableFuture.delayedExecutor(1, TimeUnit.MINUTES).execute(rateLimiter::release);
        return sendMessage(message);
    }

    private boolean sendMessage(TelegramMessage message) {
        String prefix =
                switch (message.getSeverity()) {
                    case CRITICAL -> "⚠️";
                    case WARNING -> "⚡";
                    case INFO -> "ℹ️";
                };

        Map<String, Object> payload = Map.of(
                "chat_id", telegramConfig.getChatId(),
                "text", prefix + " " + message.getText(),
                "disable_web_page_preview", true);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(
                    String.format(telegramConfig.getApiUrl(), telegramConfig.getBotToken()),
                    new HttpEntity<>(payload, headers),
                    String.class);
            return true;
        } catch (RestClientException e) {
            log.error("Failed to send Telegram message: {}", e.getMessage());
            return false;
        }
    }

    public int getAvailablePermits() {
        return rateLimiter.availablePermits();
    }
}
