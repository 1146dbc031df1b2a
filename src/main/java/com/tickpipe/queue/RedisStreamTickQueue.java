package com.tickpipe.queue;

import com.tickpipe.config.RedisConfig;
import com.tickpipe.config.StreamConfig;
import com.tickpipe.exception.TransportException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * {@link TickQueue} on a Redis Stream.
 *
 * <p>Command mapping:
 * <ul>
 *   <li>append: {@code XADD key * data <json>} then {@code XTRIM key MAXLEN [~] n}</li>
 *   <li>ensureGroup: {@code XGROUP CREATE key group 0 MKSTREAM}, BUSYGROUP ignored</li>
 *   <li>readGroup: {@code XREADGROUP GROUP g c COUNT n BLOCK ms STREAMS key >}</li>
 *   <li>ack: {@code XACK}; claimPending: {@code XPENDING} + {@code XCLAIM}; length: {@code XLEN}</li>
 * </ul>
 * Redis failures surface as {@link TransportException}.
 */
@Component
public class RedisStreamTickQueue implements TickQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamTickQueue.class);

    private final StringRedisTemplate redisTemplate;
    private final StreamConfig streamConfig;

    public RedisStreamTickQueue(StringRedisTemplate redisTemplate, StreamConfig streamConfig) {
        this.redisTemplate = redisTemplate;
        this.streamConfig = streamConfig;
    }

    @Override
    public String append(String payload) {
        String key = streamConfig.getKey();
        try {
            StreamOperations<String, Object, Object> ops = redisTemplate.opsForStream();
            RecordId id = ops.add(StreamRecords.newRecord()
                    .in(key)
                    .ofMap(Map.<Object, Object>of(RedisConfig.STREAM_FIELD_DATA, payload)));
            ops.trim(key, streamConfig.getMaxLength(), streamConfig.isApproximateTrimming());
            return id != null ? id.getValue() : null;
        } catch (DataAccessException e) {
            throw new TransportException("XADD to " + key + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void ensureGroup(String group) {
        String key = streamConfig.getKey();
        byte[] rawKey = key.getBytes(StandardCharsets.UTF_8);
        try {
            redisTemplate.execute((RedisCallback<String>) connection ->
                    connection.streamCommands().xGroupCreate(rawKey, group, ReadOffset.from("0"), true));
            log.info("Created consumer group '{}' on stream '{}'", group, key);
        } catch (DataAccessException e) {
            if (isBusyGroup(e)) {
                log.debug("Consumer group '{}' already exists on '{}'", group, key);
                return;
            }
            throw new TransportException("XGROUP CREATE on " + key + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<QueueEntry> readGroup(String group, String consumer, int count, Duration block) {
        try {
            List<MapRecord<String, Object, Object>> records = redisTemplate.opsForStream()
                    .read(
                            Consumer.from(group, consumer),
                            StreamReadOptions.empty().count(count).block(block),
                            StreamOffset.create(streamConfig.getKey(), ReadOffset.lastConsumed()));
            return toEntries(records);
        } catch (DataAccessException e) {
            throw new TransportException("XREADGROUP failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void ack(String group, Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        try {
            redisTemplate.opsForStream().acknowledge(streamConfig.getKey(), group, ids.toArray(new String[0]));
        } catch (DataAccessException e) {
            throw new TransportException("XACK failed: " + e.getMessage(), e);
        }
    }

    /**
     * Pages through the pending list from the oldest entry, collecting up to {@code count} entries
     * idle for at least {@code minIdle}, and claims them for {@code consumer}. Entries reclaimed
     * recently sit at the front with a fresh idle time, so the scan continues past them.
     */
    @Override
    public List<QueueEntry> claimPending(String group, String consumer, Duration minIdle, int count) {
        String key = streamConfig.getKey();
        try {
            StreamOperations<String, Object, Object> ops = redisTemplate.opsForStream();
            List<RecordId> stale = new ArrayList<>();
            Range<String> range = Range.unbounded();
            while (stale.size() < count) {
                PendingMessages page = ops.pending(key, group, range, count);
                if (page == null || page.isEmpty()) {
                    break;
                }
                for (PendingMessage message : page) {
                    if (stale.size() < count && message.getElapsedTimeSinceLastDelivery().compareTo(minIdle) >= 0) {
                        stale.add(message.getId());
                    }
                }
                if (page.size() < count) {
                    break;
                }
                range = Range.rightUnbounded(Range.Bound.exclusive(page.get(page.size() - 1).getIdAsString()));
            }
            if (stale.isEmpty()) {
                return List.of();
            }

            List<MapRecord<String, Object, Object>> claimed =
                    ops.claim(key, group, consumer, minIdle, stale.toArray(new RecordId[0]));
            log.info("Claimed {} stale pending entries for {}", claimed.size(), consumer);
            return toEntries(claimed);
        } catch (DataAccessException e) {
            throw new TransportException("XPENDING/XCLAIM failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long length() {
        try {
            Long size = redisTemplate.opsForStream().size(streamConfig.getKey());
            return size != null ? size : 0;
        } catch (DataAccessException e) {
            throw new TransportException("XLEN failed: " + e.getMessage(), e);
        }
    }

    private List<QueueEntry> toEntries(List<MapRecord<String, Object, Object>> records) {
        if (records == null) {
            return List.of();
        }
        return records.stream()
                .map(record -> {
                    Object data = record.getValue().get(RedisConfig.STREAM_FIELD_DATA);
                    return new QueueEntry(record.getId().getValue(), data != null ? data.toString() : null);
                })
                .toList();
    }

    static boolean isBusyGroup(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains("BUSYGROUP")) {
                return true;
            }
        }
        return false;
    }
}
