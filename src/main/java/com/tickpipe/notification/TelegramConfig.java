package com.tickpipe.notification;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Telegram Bot API settings ({@code notifications.telegram.*}).
 *
 * <pre>
 * notifications.telegram.enabled=false
 * notifications.telegram.bot-token=${TELEGRAM_BOT_TOKEN:}
 * notifications.telegram.chat-id=${TELEGRAM_CHAT_ID:}
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "notifications.telegram")
public class TelegramConfig {

    private boolean enabled = false;
    private String botToken;
    private String chatId;
    private int maxMessagesPerMinute = 20;
    private String apiUrl = "https://api.telegram.org/bot%s/sendMessage";
}
