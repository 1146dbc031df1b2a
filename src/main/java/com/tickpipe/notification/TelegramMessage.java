package com.tickpipe.notification;

import com.tickpipe.domain.enums.AlertSeverity;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TelegramMessage {

    private String text;
    private AlertSeverity severity;
    private long timestamp;
}
