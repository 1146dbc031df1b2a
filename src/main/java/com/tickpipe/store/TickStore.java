package com.tickpipe.store;

import com.tickpipe.domain.model.FlushResult;
import com.tickpipe.domain.model.LatestSnapshot;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.exception.CommitFailureException;
import com.tickpipe.exception.TransportException;
import com.tickpipe.observability.PipelineMetrics;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Records consumed ticks into fast storage and per-symbol ledgers, and flushes the ledgers to
 * durable storage in batches.
 *
 * <p>{@link #record(Tick)} touches fast storage and memory only; durable I/O happens solely in
 * {@link #flush()}, which {@link TickFlushService} calls from its own thread.
 *
 * <p>The latest snapshot per symbol is only replaced by a tick whose timestamp is not older
 * than the stored one. The check and the write run inside {@link ConcurrentHashMap#compute},
 * which serializes updates per symbol, so replaying an already recorded tick leaves the
 * snapshot unchanged. The series and durable rows are append-only and keep redelivered
 * duplicates.
 */
@Component
@ConditionalOnProperty(prefix = "tickpipe.store", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TickStore {

    private static final Logger log = LoggerFactory.getLogger(TickStore.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final TickCache tickCache;
    private final TickRowWriter tickRowWriter;
    private final PipelineMetrics pipelineMetrics;

    private final Map<LedgerKey, SymbolLedger> ledgers = new ConcurrentHashMap<>();
    private final Map<String, LatestSnapshot> latest = new ConcurrentHashMap<>();
    private final Object flushLock = new Object();

    private final AtomicInteger consecutiveFlushFailures = new AtomicInteger();
    private volatile FlushResult lastFlushResult = FlushResult.EMPTY;
    private volatile LocalDateTime lastFlushAt;

    public TickStore(TickCache tickCache, TickRowWriter tickRowWriter, PipelineMetrics pipelineMetrics) {
        this.tickCache = tickCache;
        this.tickRowWriter = tickRowWriter;
        this.pipelineMetrics = pipelineMetrics;
        pipelineMetrics.gauge("tickpipe.store.pending", "Ticks awaiting flush to durable storage", this::pendingCount);
    }

    public void record(Tick tick) {
        record(tick, null);
    }

    /**
     * Records a tick: fast-storage series and latest snapshot, then the pending ledger.
     * Fast-storage failures are logged and counted; the tick still reaches the ledger.
     *
     * @param entryId queue entry id, orders same-second ticks for the latest snapshot
     */
    public void record(Tick tick, String entryId) {
        String symbol = tick.getTradingSymbol();
        LocalDate tradeDate = tradeDateOf(tick);

        try {
            tickCache.append(symbol, tradeDate, tick);
        } catch (TransportException e) {
            fastStoreFailure(symbol, e);
        }

        latest.compute(symbol, (key, current) -> {
            if (current != null && !current.isSupersededBy(tick, entryId)) {
                return current;
            }
            LatestSnapshot next = LatestSnapshot.from(tick, entryId);
            try {
                tickCache.putLatest(symbol, next);
            } catch (TransportException e) {
                fastStoreFailure(symbol, e);
            }
            return next;
        });

        ledgers.compute(new LedgerKey(symbol, tradeDate), (key, ledger) -> {
            SymbolLedger target = ledger != null ? ledger : new SymbolLedger(symbol, tradeDate);
            target.append(tick);
            return target;
        });
        pipelineMetrics.storeRecorded();
    }

    /**
     * Writes every pending tick in one transaction. Drained ticks leave their ledgers only
     * after the commit; on failure everything stays pending for the next call.
     *
     * @throws CommitFailureException when the durable write fails
     */
    public FlushResult flush() {
        synchronized (flushLock) {
            Map<SymbolLedger, Integer> drained = new LinkedHashMap<>();
            List<Tick> batch = new ArrayList<>();
            for (SymbolLedger ledger : ledgers.values()) {
                List<Tick> pending = ledger.snapshot();
                if (!pending.isEmpty()) {
                    drained.put(ledger, pending.size());
                    batch.addAll(pending);
                }
            }
            if (batch.isEmpty()) {
                return FlushResult.EMPTY;
            }

            FlushResult result;
            try {
                result = tickRowWriter.write(batch);
            } catch (RuntimeException e) {
                int failures = consecutiveFlushFailures.incrementAndGet();
                pipelineMetrics.flushFailure();
                throw new CommitFailureException(
                        "Flush of " + batch.size() + " ticks failed (attempt " + failures + "), retained for retry", e);
            }

            drained.forEach(SymbolLedger::removeFlushed);
            for (LedgerKey key : List.copyOf(ledgers.keySet())) {
                ledgers.computeIfPresent(key, (k, ledger) -> ledger.isEmpty() ? null : ledger);
            }

            consecutiveFlushFailures.set(0);
            lastFlushResult = result;
            lastFlushAt = LocalDateTime.now(IST);
            pipelineMetrics.flushed(result.getTickRows(), result.getDepthRows());
            log.info(
                    "Flushed {} tick rows and {} depth rows for {} symbol-days",
                    result.getTickRows(),
                    result.getDepthRows(),
                    drained.size());
            return result;
        }
    }

    public Optional<LatestSnapshot> latest(String symbol) {
        return Optional.ofNullable(latest.get(symbol));
    }

    public int pendingCount() {
        return ledgers.values().stream().mapToInt(SymbolLedger::pendingCount).sum();
    }

    public int pendingCount(String symbol, LocalDate tradeDate) {
        SymbolLedger ledger = ledgers.get(new LedgerKey(symbol, tradeDate));
        return ledger != null ? ledger.pendingCount() : 0;
    }

    public int ledgerCount() {
        return ledgers.size();
    }

    public int getConsecutiveFlushFailures() {
        return consecutiveFlushFailures.get();
    }

    public FlushResult getLastFlushResult() {
        return lastFlushResult;
    }

    public LocalDateTime getLastFlushAt() {
        return lastFlushAt;
    }

    /** Trade date of a tick: date of its exchange (or receive) time, today when it has neither. */
    public static LocalDate tradeDateOf(Tick tick) {
        LocalDate tradeDate = tick.tradeDate();
        return tradeDate != null ? tradeDate : LocalDate.now(IST);
    }

    private void fastStoreFailure(String symbol, TransportException e) {
        pipelineMetrics.fastStoreFailure();
        log.warn("Fast-storage write for {} failed: {}", symbol, e.getMessage());
    }

    private record LedgerKey(String symbol, LocalDate tradeDate) {}
}
