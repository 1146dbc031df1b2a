package com.tickpipe.queue;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Durable, bounded, append-only queue of serialized ticks with consumer groups.
 *
 * <p>Entries are delivered at least once: an entry read by a group member stays pending until
 * acknowledged, and a pending entry idle long enough can be claimed by another read.
 * Implementations raise {@link com.tickpipe.exception.TransportException} on connection failures.
 */
public interface TickQueue {

    /** Appends a payload, trimming the oldest entries beyond the configured max length. */
    String append(String payload);

    /** Creates the consumer group (and the queue) if missing. Idempotent. */
    void ensureGroup(String group);

    /** Reads up to {@code count} never-delivered entries, waiting up to {@code block} for the first. */
    List<QueueEntry> readGroup(String group, String consumer, int count, Duration block);

    void ack(String group, Collection<String> ids);

    /**
     * Takes over entries delivered to any consumer of the group but not acknowledged for at
     * least {@code minIdle}, returning them for reprocessing by {@code consumer}.
     */
    List<QueueEntry> claimPending(String group, String consumer, Duration minIdle, int count);

    long length();
}
