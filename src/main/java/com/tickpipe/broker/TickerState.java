package com.tickpipe.broker;

/**
 * Lifecycle of a socket session.
 *
 * <pre>
 *   DISCONNECTED -> CONNECTING -> SUBSCRIBED -> (DISCONNECTED | ERROR)
 *   ERROR -> CONNECTING   (after backoff, or after a token refresh for auth failures)
 * </pre>
 */
public enum TickerState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBED,
    ERROR
}
