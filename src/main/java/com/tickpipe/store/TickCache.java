package com.tickpipe.store;

import com.tickpipe.domain.model.LatestSnapshot;
import com.tickpipe.domain.model.Tick;
import java.time.LocalDate;

/**
 * Fast storage for the live view of each symbol: the day's ordered series, depth history, the
 * latest snapshot and the set of symbols seen per day. Keys expire after a configured TTL.
 */
public interface TickCache {

    /** Adds the tick (and its depth, if any) to the symbol's series for the trade date. */
    void append(String symbol, LocalDate tradeDate, Tick tick);

    void putLatest(String symbol, LatestSnapshot snapshot);
}
