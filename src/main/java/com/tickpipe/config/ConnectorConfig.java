package com.tickpipe.config;

import com.tickpipe.domain.enums.TickMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Socket session and session manager settings ({@code tickpipe.connector.*}).
 *
 * <p>Kite allows at most 3 streaming connections per API key and 3000 tokens per connection.
 */
@Configuration
@ConfigurationProperties(prefix = "tickpipe.connector")
@Validated
@Getter
@Setter
public class ConnectorConfig {

    /** Hard broker limit on concurrent streaming connections. */
    public static final int BROKER_MAX_CONNECTIONS = 3;

    /** Runs the partitioner, socket sessions and publisher in this process. */
    private boolean enabled = true;

    @Min(1)
    @Max(BROKER_MAX_CONNECTIONS)
    private int maxConnections = BROKER_MAX_CONNECTIONS;

    @Min(1)
    @Max(3000)
    private int maxPerConnection = 3000;

    @NotNull
    private TickMode tickMode = TickMode.FULL;

    private Duration initialReconnectDelay = Duration.ofSeconds(1);
    private Duration maxReconnectDelay = Duration.ofSeconds(60);

    /** Token refresh attempts per session before the session is halted. */
    @Min(0)
    private int authRetryBudget = 3;

    /** Delay between starting consecutive sessions. */
    private Duration startStagger = Duration.ofSeconds(1);

    /** Cooperative stop window before sessions are force-terminated. */
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    /** Bounded hand-off between socket read threads and the publisher. */
    @Min(1)
    private int channelCapacity = 50_000;

    /** No tick on any subscribed session for this long forces a reconnect of all sessions. */
    private Duration stallTimeout = Duration.ofSeconds(120);
}
