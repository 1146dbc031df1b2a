package com.tickpipe.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the ticks table. One row per received tick; duplicates from queue
 * redelivery are kept (the table is an append-only ledger).
 */
@Entity
@Table(
        name = "ticks",
        indexes = {
            @Index(name = "idx_ticks_token_date", columnList = "instrument_token, trade_date"),
            @Index(name = "idx_ticks_symbol_date", columnList = "trading_symbol, trade_date"),
            @Index(name = "idx_ticks_exchange_ts", columnList = "exchange_timestamp")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TickRowEntity {

    public static final int SYMBOL_LENGTH = 50;
    public static final int PRICE_PRECISION = 15;
    public static final int PRICE_SCALE = 2;
    public static final int CHANGE_PRECISION = 12;
    public static final int CHANGE_SCALE = 4;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instrument_token", nullable = false)
    private Long instrumentToken;

    @Column(name = "trading_symbol", length = SYMBOL_LENGTH, nullable = false)
    private String tradingSymbol;

    @Column(name = "exchange_timestamp")
    private LocalDateTime exchangeTimestamp;

    @Column(name = "last_trade_time")
    private LocalDateTime lastTradeTime;

    @Column(name = "last_price", precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal lastPrice;

    @Column(name = "last_traded_quantity")
    private Long lastTradedQuantity;

    @Column(name = "average_traded_price", precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal averageTradedPrice;

    @Column(name = "volume_traded")
    private Long volume;

    @Column(name = "total_buy_quantity")
    private Long totalBuyQuantity;

    @Column(name = "total_sell_quantity")
    private Long totalSellQuantity;

    @Column(name = "open_price", precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal open;

    @Column(name = "high_price", precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal high;

    @Column(name = "low_price", precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal low;

    @Column(name = "close_price", precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal close;

    @Column(name = "change_pct", precision = CHANGE_PRECISION, scale = CHANGE_SCALE)
    private BigDecimal change;

    private Long oi;

    @Column(name = "oi_day_high")
    private Long oiDayHigh;

    @Column(name = "oi_day_low")
    private Long oiDayLow;

    /** LTP, QUOTE or FULL. */
    @Column(name = "tick_mode", length = 10)
    private String tickMode;

    @Column(name = "received_at")
    private LocalDateTime receivedAt;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;
}
