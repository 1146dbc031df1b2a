package com.tickpipe.config;

import java.time.LocalDate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis template and fast-storage key schema.
 *
 * <p>Everything in Redis is a string: stream entries carry the tick JSON in field {@code data},
 * fast-storage members are tick JSON. Key schema (prefix from {@code tickpipe.store.key-prefix}):
 * <pre>
 *   {prefix}ticks:{symbol}:{date}  -> ZSET of tick JSON scored by exchange epoch millis
 *   {prefix}depth:{symbol}:{date}  -> ZSET of depth JSON scored by exchange epoch millis
 *   {prefix}latest:{symbol}        -> HASH of the latest snapshot
 *   {prefix}symbols:{date}         -> SET of symbols seen that day
 * </pre>
 */
@Configuration
public class RedisConfig {

    /** Stream entry field holding the serialized tick. */
    public static final String STREAM_FIELD_DATA = "data";

    private final StoreConfig storeConfig;

    public RedisConfig(StoreConfig storeConfig) {
        this.storeConfig = storeConfig;
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory redisConnectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate(redisConnectionFactory);
        template.setEnableTransactionSupport(false);
        return template;
    }

    @Bean
    public TickKeys tickKeys() {
        return new TickKeys(storeConfig.getKeyPrefix());
    }

    /** Builds fast-storage keys for a prefix. */
    public static class TickKeys {

        private final String prefix;

        public TickKeys(String prefix) {
            this.prefix = prefix;
        }

        public String ticks(String symbol, LocalDate date) {
            return prefix + "ticks:" + symbol + ":" + date;
        }

        public String depth(String symbol, LocalDate date) {
            return prefix + "depth:" + symbol + ":" + date;
        }

        public String latest(String symbol) {
            return prefix + "latest:" + symbol;
        }

        public String symbols(LocalDate date) {
            return prefix + "symbols:" + date;
        }
    }
}
