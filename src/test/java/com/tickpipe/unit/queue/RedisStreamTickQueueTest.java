package com.tickpipe.unit.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tickpipe.config.RedisConfig;
import com.tickpipe.config.StreamConfig;
import com.tickpipe.exception.TransportException;
import com.tickpipe.queue.QueueEntry;
import com.tickpipe.queue.RedisStreamTickQueue;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisStreamTickQueue")
class RedisStreamTickQueueTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private StreamOperations<String, Object, Object> streamOperations;

    private StreamConfig streamConfig;
    private RedisStreamTickQueue queue;

    @BeforeEach
    void setUp() {
        streamConfig = new StreamConfig();
        streamConfig.setKey("ticks:raw");
        streamConfig.setMaxLength(5);
        streamConfig.setApproximateTrimming(false);
        queue = new RedisStreamTickQueue(redisTemplate, streamConfig);
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("adds the payload under the data field and trims to max length")
        @SuppressWarnings("unchecked")
        void addsAndTrims() {
            when(redisTemplate.<Object, Object>opsForStream()).thenReturn(streamOperations);
            when(streamOperations.add(any(MapRecord.class))).thenReturn(RecordId.of("1700000000000-0"));

            String id = queue.append("{\"instrumentToken\":1}");

            assertThat(id).isEqualTo("1700000000000-0");
            verify(streamOperations).trim("ticks:raw", 5, false);
        }

        @Test
        @DisplayName("wraps Redis failures in TransportException")
        @SuppressWarnings("unchecked")
        void connectionFailure() {
            when(redisTemplate.<Object, Object>opsForStream()).thenReturn(streamOperations);
            when(streamOperations.add(any(MapRecord.class))).thenThrow(new RedisConnectionFailureException("refused"));

            assertThatThrownBy(() -> queue.append("{}")).isInstanceOf(TransportException.class);
        }
    }

    @Nested
    @DisplayName("ensureGroup")
    class EnsureGroup {

        @Test
        @DisplayName("treats an existing group as success")
        @SuppressWarnings("unchecked")
        void busyGroupIgnored() {
            when(redisTemplate.execute(any(RedisCallback.class)))
                    .thenThrow(new RedisSystemException(
                            "Error in execution",
                            new IllegalStateException("BUSYGROUP Consumer Group name already exists")));

            assertThatCode(() -> queue.ensureGroup("tick_processors")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("fails on any other error")
        @SuppressWarnings("unchecked")
        void otherErrors() {
            when(redisTemplate.execute(any(RedisCallback.class))).thenThrow(new RedisConnectionFailureException("down"));

            assertThatThrownBy(() -> queue.ensureGroup("tick_processors")).isInstanceOf(TransportException.class);
        }
    }

    @Nested
    @DisplayName("claimPending")
    class ClaimPending {

        private final Duration minIdle = Duration.ofSeconds(30);

        private PendingMessage pending(String id, Duration idle) {
            return new PendingMessage(RecordId.of(id), Consumer.from("tick_processors", "other"), idle, 1);
        }

        @Test
        @DisplayName("pages past recently reclaimed entries to reach older idle ones")
        @SuppressWarnings({"unchecked", "rawtypes"})
        void pagesPastFreshEntries() {
            when(redisTemplate.<Object, Object>opsForStream()).thenReturn(streamOperations);
            PendingMessages first = new PendingMessages("tick_processors", List.of(
                    pending("1-0", Duration.ofSeconds(1)), pending("2-0", Duration.ofSeconds(2))));
            PendingMessages second = new PendingMessages("tick_processors", List.of(
                    pending("3-0", Duration.ofMinutes(1))));
            when(streamOperations.pending(eq("ticks:raw"), eq("tick_processors"), any(Range.class), eq(2L)))
                    .thenReturn(first, second);
            MapRecord<String, Object, Object> record = StreamRecords.newRecord()
                    .in("ticks:raw")
                    .withId(RecordId.of("3-0"))
                    .ofMap(Map.<Object, Object>of(RedisConfig.STREAM_FIELD_DATA, "{}"));
            when(streamOperations.claim(eq("ticks:raw"), eq("tick_processors"), eq("me"), eq(minIdle), eq(RecordId.of("3-0"))))
                    .thenReturn(List.of(record));

            List<QueueEntry> claimed = queue.claimPending("tick_processors", "me", minIdle, 2);

            assertThat(claimed).extracting(QueueEntry::id).containsExactly("3-0");
            ArgumentCaptor<Range> ranges = ArgumentCaptor.forClass(Range.class);
            verify(streamOperations, times(2)).pending(eq("ticks:raw"), eq("tick_processors"), ranges.capture(), eq(2L));
            Range.Bound<?> resumeFrom = ranges.getAllValues().get(1).getLowerBound();
            assertThat(resumeFrom.isInclusive()).isFalse();
            assertThat(resumeFrom.getValue().orElseThrow()).isEqualTo("2-0");
        }

        @Test
        @DisplayName("stops at a short page and claims nothing when no entry is idle long enough")
        @SuppressWarnings("unchecked")
        void nothingIdle() {
            when(redisTemplate.<Object, Object>opsForStream()).thenReturn(streamOperations);
            when(streamOperations.pending(eq("ticks:raw"), eq("tick_processors"), any(Range.class), eq(10L)))
                    .thenReturn(new PendingMessages("tick_processors", List.of(pending("1-0", Duration.ofSeconds(1)))));

            assertThat(queue.claimPending("tick_processors", "me", minIdle, 10)).isEmpty();

            verify(streamOperations, times(1)).pending(eq("ticks:raw"), eq("tick_processors"), any(Range.class), eq(10L));
            verify(streamOperations, never()).claim(any(), any(), any(), any(), any(RecordId[].class));
        }
    }

    @Test
    @DisplayName("ack with no ids does not touch Redis")
    void emptyAck() {
        queue.ack("tick_processors", List.of());

        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("length reads the stream size")
    void length() {
        when(redisTemplate.<Object, Object>opsForStream()).thenReturn(streamOperations);
        when(streamOperations.size("ticks:raw")).thenReturn(4L);

        assertThat(queue.length()).isEqualTo(4);
    }
}
