package com.tickpipe.broker;

import com.tickpipe.domain.enums.TickMode;
import java.util.List;

/**
 * One streaming socket to the broker. A transport is used for a single connection attempt;
 * reconnecting creates a new one.
 */
public interface TickerTransport {

    /** Opens the socket asynchronously; outcome is reported to {@code listener}. */
    void connect(TransportListener listener);

    /**
     * Subscribes tokens and sets their mode. Subscribing an already subscribed token is a no-op.
     *
     * @throws com.tickpipe.exception.TransportException when the socket is not open or refuses the request
     */
    void subscribe(List<Long> tokens, TickMode mode);

    /** Closes the socket. Safe to call more than once. */
    void close();
}
