package com.tickpipe.repository.redis;

import com.tickpipe.config.RedisConfig;
import com.tickpipe.config.StoreConfig;
import com.tickpipe.domain.model.LatestSnapshot;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.exception.TransportException;
import com.tickpipe.queue.TickCodec;
import com.tickpipe.store.TickCache;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis fast storage for ticks. Key schema is documented on {@link RedisConfig}.
 *
 * <p>Series members are the tick JSON, so a redelivered tick lands on the same sorted-set member
 * instead of adding a second one. Every write refreshes the key's TTL.
 */
@Repository
@ConditionalOnProperty(prefix = "tickpipe.store", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TickCacheRedisRepository implements TickCache {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final StringRedisTemplate redisTemplate;
    private final RedisConfig.TickKeys tickKeys;
    private final TickCodec tickCodec;
    private final Duration keyTtl;

    public TickCacheRedisRepository(
            StringRedisTemplate redisTemplate, RedisConfig.TickKeys tickKeys, TickCodec tickCodec, StoreConfig storeConfig) {
        this.redisTemplate = redisTemplate;
        this.tickKeys = tickKeys;
        this.tickCodec = tickCodec;
        this.keyTtl = storeConfig.getKeyTtl();
    }

    @Override
    public void append(String symbol, LocalDate tradeDate, Tick tick) {
        double score = epochMillis(tick.effectiveTimestamp());
        try {
            String ticksKey = tickKeys.ticks(symbol, tradeDate);
            redisTemplate.opsForZSet().add(ticksKey, tickCodec.encode(tick), score);
            redisTemplate.expire(ticksKey, keyTtl);

            if (tick.hasDepth()) {
                Map<String, Object> depth = new LinkedHashMap<>();
                depth.put("exchangeTimestamp", tick.effectiveTimestamp());
                depth.put("buy", tick.getBuyDepth());
                depth.put("sell", tick.getSellDepth());
                String depthKey = tickKeys.depth(symbol, tradeDate);
                redisTemplate.opsForZSet().add(depthKey, tickCodec.write(depth), score);
                redisTemplate.expire(depthKey, keyTtl);
            }

            String symbolsKey = tickKeys.symbols(tradeDate);
            redisTemplate.opsForSet().add(symbolsKey, symbol);
            redisTemplate.expire(symbolsKey, keyTtl);
        } catch (DataAccessException e) {
            throw new TransportException("Redis tick write for " + symbol + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void putLatest(String symbol, LatestSnapshot snapshot) {
        Map<String, String> fields = new LinkedHashMap<>();
        putIfPresent(fields, "last_price", snapshot.getLastPrice());
        putIfPresent(fields, "volume", snapshot.getVolume());
        putIfPresent(fields, "oi", snapshot.getOi());
        putIfPresent(fields, "bid", snapshot.getBid());
        putIfPresent(fields, "ask", snapshot.getAsk());
        putIfPresent(fields, "total_buy_qty", snapshot.getTotalBuyQuantity());
        putIfPresent(fields, "total_sell_qty", snapshot.getTotalSellQuantity());
        putIfPresent(fields, "exchange_timestamp", snapshot.getExchangeTimestamp());

        String key = tickKeys.latest(symbol);
        try {
            redisTemplate.opsForHash().putAll(key, fields);
            redisTemplate.expire(key, keyTtl);
        } catch (DataAccessException e) {
            throw new TransportException("Redis latest write for " + symbol + " failed: " + e.getMessage(), e);
        }
    }

    private void putIfPresent(Map<String, String> fields, String name, Object value) {
        if (value != null) {
            fields.put(name, value.toString());
        }
    }

    private double epochMillis(LocalDateTime timestamp) {
        if (timestamp == null) {
            return System.currentTimeMillis();
        }
        return timestamp.atZone(IST).toInstant().toEpochMilli();
    }
}
