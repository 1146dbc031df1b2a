package com.tickpipe.config;

import com.zerodhatech.kiteconnect.KiteConnect;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties and bean definitions for Kite Connect.
 *
 * <p>Binds to the {@code kite.*} prefix. Provides the singleton {@link KiteConnect} REST client
 * used for the instrument dump, LTP lookups and the request-token exchange. After login the
 * access token is set on this instance by {@link com.tickpipe.broker.KiteAuthService}.
 *
 * <p>When {@code kite.access-token} is set the login flow is skipped and that token is used as-is.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    /** Kite Connect API key (from Zerodha developer console). */
    private String apiKey;

    /** Kite Connect API secret (from Zerodha developer console). */
    private String apiSecret;

    /** Pre-issued access token. Optional; disables automated login when present. */
    private String accessToken;

    private Login login = new Login();

    @Bean
    public KiteConnect kiteConnect() {
        log.info("Creating KiteConnect bean with API key: {}...", maskApiKey(apiKey));
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        kiteConnect.setSessionExpiryHook(() -> log.warn("Kite session expired (detected by SDK SessionExpiryHook)"));
        return kiteConnect;
    }

    public boolean hasStaticAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    private String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }

    /** Credentials for the HTTP login + TOTP flow. */
    @Getter
    @Setter
    public static class Login {

        private String userId;
        private String password;

        /** Base32 TOTP secret shown when enabling external 2FA on the Kite account. */
        private String totpSecret;

        private String baseUrl = "https://kite.zerodha.com";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);

        /** Redirect hops followed while looking for the request_token. */
        private int maxRedirects = 10;
    }
}
