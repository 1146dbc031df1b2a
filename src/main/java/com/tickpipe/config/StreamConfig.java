package com.tickpipe.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Redis Stream queue settings shared by the publisher and the consumer ({@code tickpipe.stream.*}). */
@Configuration
@ConfigurationProperties(prefix = "tickpipe.stream")
@Validated
@Getter
@Setter
public class StreamConfig {

    @NotBlank
    private String key = "ticks:raw";

    /** Oldest entries are trimmed beyond this length. */
    @Min(1)
    private long maxLength = 100_000;

    /** {@code MAXLEN ~}: cheaper trimming that may keep slightly more than maxLength. */
    private boolean approximateTrimming = true;

    /** Upper bound on how long a publish may hold the caller. */
    private Duration publishTimeout = Duration.ofMillis(50);

    @Min(1)
    private int publishQueueCapacity = 10_000;

    @NotBlank
    private String consumerGroup = "tick_processors";

    @NotBlank
    private String consumerName = "receiver_1";

    @Min(1)
    private int readCount = 100;

    private Duration blockTimeout = Duration.ofSeconds(1);

    /** Delivered-but-unacked entries idle longer than this are claimed and reprocessed. */
    private Duration claimMinIdle = Duration.ofSeconds(60);

    private Duration claimInterval = Duration.ofSeconds(30);

    /** Pause after a queue connection failure before the consumer retries. */
    private Duration reconnectDelay = Duration.ofSeconds(2);
}
