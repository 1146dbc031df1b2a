package com.tickpipe.store;

import com.tickpipe.domain.model.FlushResult;
import com.tickpipe.domain.model.Tick;
import java.util.List;

/**
 * Durable sink for flushed ticks. One call is one transaction: either every tick and depth
 * row of the batch is committed, or nothing is and the call throws.
 */
public interface TickRowWriter {

    FlushResult write(List<Tick> ticks);
}
