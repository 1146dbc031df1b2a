package com.tickpipe.queue;

public enum PublishResult {
    /** The queue accepted the tick within the publish timeout. */
    ACKNOWLEDGED,
    /** Timed out, rejected by a full hand-off, or the queue failed. The tick is lost. */
    DROPPED
}
