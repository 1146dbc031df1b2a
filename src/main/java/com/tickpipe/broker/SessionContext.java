package com.tickpipe.broker;

import com.tickpipe.exception.AuthRejectedException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Holds the Kite access token for every socket session and owns its refresh.
 *
 * <p>Sessions read {@link #currentToken()} on each (re)connect, so a refreshed token is picked
 * up on the next reconnect without restarting anything. Refresh is single-flight: the lock
 * serializes callers and a caller whose rejected token has already been replaced returns the
 * replacement instead of logging in again.
 */
@Component
@ConditionalOnProperty(prefix = "tickpipe.connector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SessionContext implements AccessTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(SessionContext.class);

    private final KiteAuthService kiteAuthService;

    private final AtomicReference<String> accessToken = new AtomicReference<>();
    private final ReentrantLock refreshLock = new ReentrantLock();

    public SessionContext(KiteAuthService kiteAuthService) {
        this.kiteAuthService = kiteAuthService;
    }

    @Override
    public String currentToken() {
        String token = accessToken.get();
        if (token != null) {
            return token;
        }
        return refresh(null);
    }

    @Override
    public String refresh(String rejectedToken) {
        refreshLock.lock();
        try {
            String current = accessToken.get();
            if (current != null && !Objects.equals(current, rejectedToken)) {
                log.debug("Token already refreshed by another session, reusing it");
                return current;
            }

            String fresh = kiteAuthService.acquireSessionToken();
            if (fresh == null || fresh.isBlank()) {
                throw new AuthRejectedException("Login returned no access token");
            }
            if (fresh.equals(rejectedToken)) {
                throw new AuthRejectedException("Login returned the token the broker just rejected");
            }
            accessToken.set(fresh);
            log.info("Access token {}", rejectedToken == null ? "acquired" : "refreshed");
            return fresh;
        } finally {
            refreshLock.unlock();
        }
    }

    public boolean hasToken() {
        return accessToken.get() != null;
    }
}
