package com.tickpipe.domain.enums;

/**
 * Severity of an operator alert. CRITICAL alerts skip the Telegram rate limiter.
 */
public enum AlertSeverity {
    CRITICAL,
    WARNING,
    INFO
}
