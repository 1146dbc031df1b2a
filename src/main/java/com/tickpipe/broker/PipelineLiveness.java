package com.tickpipe.broker;

import java.util.Map;

/**
 * Snapshot of the connector side for health reporting.
 *
 * @param sessions state per session index
 * @param haltedSessions sessions stopped for good (auth budget exhausted)
 * @param halted the whole connector is halted (capacity error or every session halted)
 */
public record PipelineLiveness(Map<Integer, TickerState> sessions, int haltedSessions, boolean halted, String haltReason) {

    public boolean healthy() {
        return !halted && haltedSessions == 0 && !sessions.isEmpty();
    }
}
