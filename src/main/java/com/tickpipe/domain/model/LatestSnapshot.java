package com.tickpipe.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Most recent state of a symbol in fast storage. Replaced only by newer ticks; ticks with the
 * same exchange second are ordered by the queue entry id they arrived with.
 */
@Value
@Builder
public class LatestSnapshot {

    String tradingSymbol;
    BigDecimal lastPrice;
    Long volume;
    Long oi;
    BigDecimal bid;
    BigDecimal ask;
    Long totalBuyQuantity;
    Long totalSellQuantity;
    LocalDateTime exchangeTimestamp;

    /** Queue entry the snapshot came from; null when recorded outside the queue. */
    String entryId;

    public static LatestSnapshot from(Tick tick) {
        return from(tick, null);
    }

    public static LatestSnapshot from(Tick tick, String entryId) {
        return LatestSnapshot.builder()
                .tradingSymbol(tick.getTradingSymbol())
                .lastPrice(tick.getLastPrice())
                .volume(tick.getVolume())
                .oi(tick.getOi())
                .bid(bestPrice(tick.getBuyDepth()))
                .ask(bestPrice(tick.getSellDepth()))
                .totalBuyQuantity(tick.getTotalBuyQuantity())
                .totalSellQuantity(tick.getTotalSellQuantity())
                .exchangeTimestamp(tick.effectiveTimestamp())
                .entryId(entryId)
                .build();
    }

    public boolean isSupersededBy(Tick tick) {
        return isSupersededBy(tick, null);
    }

    /**
     * True when {@code tick} may replace this snapshot: a newer timestamp, or the same timestamp
     * with a later entry id. Without ids on both sides a same-second tick replaces.
     */
    public boolean isSupersededBy(Tick tick, String incomingEntryId) {
        LocalDateTime incoming = tick.effectiveTimestamp();
        if (exchangeTimestamp == null || incoming == null) {
            return true;
        }
        if (!incoming.isEqual(exchangeTimestamp)) {
            return incoming.isAfter(exchangeTimestamp);
        }
        if (entryId == null || incomingEntryId == null) {
            return true;
        }
        return compareEntryIds(incomingEntryId, entryId) > 0;
    }

    /** Orders stream ids of the form {@code <millis>-<sequence>}. */
    static int compareEntryIds(String left, String right) {
        long[] a = parseEntryId(left);
        long[] b = parseEntryId(right);
        if (a == null || b == null) {
            return left.compareTo(right);
        }
        int byMillis = Long.compare(a[0], b[0]);
        return byMillis != 0 ? byMillis : Long.compare(a[1], b[1]);
    }

    private static long[] parseEntryId(String id) {
        int dash = id.indexOf('-');
        try {
            if (dash < 0) {
                return new long[] {Long.parseLong(id), 0L};
            }
            return new long[] {Long.parseLong(id.substring(0, dash)), Long.parseLong(id.substring(dash + 1))};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static BigDecimal bestPrice(List<DepthLevel> levels) {
        if (levels == null || levels.isEmpty()) {
            return null;
        }
        return levels.get(0).getPrice();
    }
}
