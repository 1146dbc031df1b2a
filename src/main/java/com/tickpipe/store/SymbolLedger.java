package com.tickpipe.store;

import com.tickpipe.domain.model.Tick;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Ticks of one symbol on one trade date waiting to be flushed to durable storage.
 *
 * <p>Appends go to the tail; a flush copies the buffer and, once committed, removes exactly the
 * copied prefix. Ticks appended while the flush was running stay for the next one.
 */
public class SymbolLedger {

    private final String symbol;
    private final LocalDate tradeDate;
    private final List<Tick> pending = new ArrayList<>();

    public SymbolLedger(String symbol, LocalDate tradeDate) {
        this.symbol = symbol;
        this.tradeDate = tradeDate;
    }

    public synchronized void append(Tick tick) {
        pending.add(tick);
    }

    public synchronized List<Tick> snapshot() {
        return new ArrayList<>(pending);
    }

    /** Removes the oldest {@code count} ticks after they were committed. */
    public synchronized void removeFlushed(int count) {
        pending.subList(0, Math.min(count, pending.size())).clear();
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    public String getSymbol() {
        return symbol;
    }

    public LocalDate getTradeDate() {
        return tradeDate;
    }
}
