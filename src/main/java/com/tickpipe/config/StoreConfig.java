package com.tickpipe.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Tick store settings ({@code tickpipe.store.*}). */
@Configuration
@ConfigurationProperties(prefix = "tickpipe.store")
@Validated
@Getter
@Setter
public class StoreConfig {

    /** Runs the stream consumer, tick store and flush task in this process. */
    private boolean enabled = true;

    /** Prefix for every fast-storage key. */
    @NotBlank
    private String keyPrefix = "tickpipe:";

    /** Expiry applied to fast-storage keys. */
    private Duration keyTtl = Duration.ofHours(24);

    private Duration flushInterval = Duration.ofSeconds(300);

    /** Pending tick count that triggers a flush before the interval elapses. */
    @Min(1)
    private int flushBatchSize = 50_000;

    /** How often the flush thread checks the pending count against flushBatchSize. */
    private Duration flushCheckInterval = Duration.ofSeconds(1);

    /** Consecutive failed flushes after which health reports DOWN. */
    @Min(1)
    private int flushFailureThreshold = 3;
}
