package com.tickpipe.broker;

import com.tickpipe.domain.enums.TickMode;
import com.tickpipe.exception.TransportException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.ticker.KiteTicker;
import com.zerodhatech.ticker.OnConnect;
import com.zerodhatech.ticker.OnDisconnect;
import com.zerodhatech.ticker.OnError;
import com.zerodhatech.ticker.OnTicks;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TickerTransport} over the Kite SDK's {@link KiteTicker}.
 *
 * <p>The SDK's own reconnection is switched off: the owning {@link TickerSession} decides when
 * and how to reconnect, always with a fresh transport and the current token. Handshake failures
 * carrying HTTP 403 are reported as auth rejections.
 */
public class KiteTickerTransport implements TickerTransport {

    private static final Logger log = LoggerFactory.getLogger(KiteTickerTransport.class);

    private final KiteTicker kiteTicker;

    public KiteTickerTransport(String accessToken, String apiKey) {
        // KiteTicker constructor order: (accessToken, apiKey)
        this.kiteTicker = new KiteTicker(accessToken, apiKey);
        this.kiteTicker.setTryReconnection(false);
    }

    @Override
    public void connect(TransportListener listener) {
        kiteTicker.setOnConnectedListener(new OnConnect() {
            @Override
            public void onConnected() {
                listener.onConnected();
            }
        });

        kiteTicker.setOnDisconnectedListener(new OnDisconnect() {
            @Override
            public void onDisconnected() {
                listener.onDisconnected("socket closed");
            }
        });

        kiteTicker.setOnTickerArrivalListener(new OnTicks() {
            @Override
            public void onTicks(ArrayList<com.zerodhatech.models.Tick> ticks) {
                listener.onTicks(ticks);
            }
        });

        kiteTicker.setOnErrorListener(new OnError() {
            @Override
            public void onError(Exception exception) {
                report(listener, String.valueOf(exception.getMessage()));
            }

            @Override
            public void onError(KiteException kiteException) {
                if (kiteException.code == 403) {
                    listener.onAuthRejected(kiteException.message);
                } else {
                    listener.onDisconnected(kiteException.message);
                }
            }

            @Override
            public void onError(String error) {
                report(listener, error);
            }
        });

        kiteTicker.connect();
    }

    @Override
    public void subscribe(List<Long> tokens, TickMode mode) {
        if (!kiteTicker.isConnectionOpen()) {
            throw new TransportException("Cannot subscribe: ticker socket is not open");
        }
        ArrayList<Long> batch = new ArrayList<>(tokens);
        try {
            kiteTicker.subscribe(batch);
            kiteTicker.setMode(batch, mode.getKiteMode());
        } catch (RuntimeException e) {
            throw new TransportException("Subscribe request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            if (kiteTicker.isConnectionOpen()) {
                kiteTicker.disconnect();
            }
        } catch (RuntimeException e) {
            log.warn("Error disconnecting ticker: {}", e.getMessage());
        }
    }

    private void report(TransportListener listener, String error) {
        if (isAuthFailure(error)) {
            listener.onAuthRejected(error);
        } else {
            listener.onDisconnected(error);
        }
    }

    static boolean isAuthFailure(String error) {
        return error != null && (error.contains("403") || error.contains("TokenException"));
    }
}
