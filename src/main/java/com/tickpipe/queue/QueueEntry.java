package com.tickpipe.queue;

/** An entry read from the queue: its stream id and the serialized tick. */
public record QueueEntry(String id, String payload) {}
