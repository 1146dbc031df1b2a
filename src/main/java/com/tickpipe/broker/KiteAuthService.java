package com.tickpipe.broker;

import com.tickpipe.config.KiteConfig;
import com.tickpipe.exception.AuthRejectedException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.User;
import java.io.IOException;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Obtains a Kite access token.
 *
 * <p>With {@code kite.access-token} configured that token is used directly. Otherwise the
 * credentials login ({@link KiteLoginClient}) yields a request_token, which is exchanged for an
 * access token through {@link KiteConnect#generateSession(String, String)}. The token is set on
 * the shared {@link KiteConnect} bean so REST calls use the same session as the sockets.
 */
@Service
@ConditionalOnProperty(prefix = "tickpipe.connector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KiteAuthService {

    private static final Logger log = LoggerFactory.getLogger(KiteAuthService.class);

    private final KiteConfig kiteConfig;
    private final KiteConnect kiteConnect;
    private final KiteLoginClient kiteLoginClient;

    public KiteAuthService(KiteConfig kiteConfig, KiteConnect kiteConnect, KiteLoginClient kiteLoginClient) {
        this.kiteConfig = kiteConfig;
        this.kiteConnect = kiteConnect;
        this.kiteLoginClient = kiteLoginClient;
    }

    /**
     * @throws AuthRejectedException when login or the token exchange fails
     */
    public String acquireSessionToken() {
        if (kiteConfig.hasStaticAccessToken()) {
            log.info("Using configured Kite access token");
            kiteConnect.setAccessToken(kiteConfig.getAccessToken());
            return kiteConfig.getAccessToken();
        }

        String requestToken = kiteLoginClient.obtainRequestToken();
        try {
            User user = kiteConnect.generateSession(requestToken, kiteConfig.getApiSecret());
            kiteConnect.setAccessToken(user.accessToken);
            kiteConnect.setPublicToken(user.publicToken);
            log.info("Kite session created for user {}", user.userId);
            return user.accessToken;
        } catch (KiteException e) {
            throw new AuthRejectedException("Kite token exchange rejected: " + e.message, e);
        } catch (JSONException | IOException e) {
            throw new AuthRejectedException("Kite token exchange failed: " + e.getMessage(), e);
        }
    }
}
