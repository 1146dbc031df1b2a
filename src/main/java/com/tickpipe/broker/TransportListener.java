package com.tickpipe.broker;

import java.util.List;

/**
 * Callbacks from a {@link TickerTransport}. Invoked on the transport's own threads.
 */
public interface TransportListener {

    void onConnected();

    /** Connection lost or failed to open for a reason other than authentication. */
    void onDisconnected(String reason);

    /** Handshake or token rejected by the broker (HTTP 403 / TokenException). */
    void onAuthRejected(String reason);

    /** A batch of raw broker ticks, in arrival order. */
    void onTicks(List<com.zerodhatech.models.Tick> ticks);
}
