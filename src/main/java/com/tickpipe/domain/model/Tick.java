package com.tickpipe.domain.model;

import com.tickpipe.domain.enums.TickMode;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A market-data update for one instrument, enriched with its trading symbol.
 *
 * <p>Immutable once produced by a socket session. Timestamps are exchange-local (IST).
 * Quote and depth fields are null when the subscription mode does not carry them.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Tick {

    long instrumentToken;
    String tradingSymbol;
    TickMode mode;

    /** Exchange timestamp of the tick. May be null in LTP mode. */
    LocalDateTime exchangeTimestamp;

    LocalDateTime lastTradeTime;
    BigDecimal lastPrice;
    Long lastTradedQuantity;
    BigDecimal averageTradedPrice;
    Long volume;
    Long totalBuyQuantity;
    Long totalSellQuantity;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;

    /** Previous session close. */
    BigDecimal close;

    /** Percent change against the previous close. */
    BigDecimal change;

    Long oi;
    Long oiDayHigh;
    Long oiDayLow;

    /** Local wall-clock time at which the socket session decoded the tick. */
    LocalDateTime receivedAt;

    List<DepthLevel> buyDepth;
    List<DepthLevel> sellDepth;

    /** Exchange timestamp, or receive time when the exchange did not stamp the tick. */
    public LocalDateTime effectiveTimestamp() {
        return exchangeTimestamp != null ? exchangeTimestamp : receivedAt;
    }

    /** Trading day the tick belongs to, or null when the tick carries no time at all. */
    public LocalDate tradeDate() {
        LocalDateTime timestamp = effectiveTimestamp();
        return timestamp != null ? timestamp.toLocalDate() : null;
    }

    public boolean hasDepth() {
        return (buyDepth != null && !buyDepth.isEmpty()) || (sellDepth != null && !sellDepth.isEmpty());
    }
}
