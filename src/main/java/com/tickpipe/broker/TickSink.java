package com.tickpipe.broker;

import com.tickpipe.domain.model.Tick;

/** Non-blocking hand-off for decoded ticks. */
@FunctionalInterface
public interface TickSink {

    /** @return false when the tick was dropped */
    boolean offer(Tick tick);
}
