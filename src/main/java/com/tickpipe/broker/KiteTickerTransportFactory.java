package com.tickpipe.broker;

import com.tickpipe.config.KiteConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "tickpipe.connector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KiteTickerTransportFactory implements TickerTransportFactory {

    private final KiteConfig kiteConfig;

    public KiteTickerTransportFactory(KiteConfig kiteConfig) {
        this.kiteConfig = kiteConfig;
    }

    @Override
    public TickerTransport create(String accessToken) {
        return new KiteTickerTransport(accessToken, kiteConfig.getApiKey());
    }
}
