package com.tickpipe.broker;

import com.tickpipe.domain.enums.TickMode;
import com.tickpipe.domain.model.DepthLevel;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.exception.DecodeException;
import com.zerodhatech.models.Depth;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps Kite SDK ticks to the domain {@link Tick}.
 *
 * <p>Key mappings:
 * <ul>
 *   <li>Doubles to BigDecimal for prices, to long for quantities and OI</li>
 *   <li>{@code java.util.Date} timestamps to IST {@link LocalDateTime}</li>
 *   <li>Depth map ("buy"/"sell") to ordered {@link DepthLevel} lists</li>
 *   <li>Quote fields only for QUOTE/FULL, depth only for FULL</li>
 *   <li>Trading symbol from the session's instruments, {@code TOKEN_<id>} when unknown</li>
 * </ul>
 */
@Component
public class KiteTickMapper {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    /**
     * @throws DecodeException when the tick has no usable token or price
     */
    public Tick map(com.zerodhatech.models.Tick kiteTick, Map<Long, String> symbols, TickMode subscribedMode, LocalDateTime receivedAt) {
        if (kiteTick == null) {
            throw new DecodeException("Null tick in batch");
        }
        try {
            long token = kiteTick.getInstrumentToken();
            if (token <= 0) {
                throw new DecodeException("Tick without instrument token");
            }
            double lastPrice = kiteTick.getLastTradedPrice();
            if (Double.isNaN(lastPrice) || Double.isInfinite(lastPrice)) {
                throw new DecodeException("Tick for " + token + " has no valid last price");
            }

            TickMode mode = TickMode.fromKite(kiteTick.getMode(), subscribedMode);
            String symbol = symbols.get(token);

            Tick.TickBuilder builder = Tick.builder()
                    .instrumentToken(token)
                    .tradingSymbol(symbol != null ? symbol : "TOKEN_" + token)
                    .mode(mode)
                    .lastPrice(BigDecimal.valueOf(lastPrice))
                    .exchangeTimestamp(toIst(kiteTick.getTickTimestamp()))
                    .receivedAt(receivedAt);

            if (mode != TickMode.LTP) {
                builder.lastTradeTime(toIst(kiteTick.getLastTradedTime()))
                        .lastTradedQuantity((long) kiteTick.getLastTradedQuantity())
                        .averageTradedPrice(BigDecimal.valueOf(kiteTick.getAverageTradePrice()))
                        .volume((long) kiteTick.getVolumeTradedToday())
                        .totalBuyQuantity((long) kiteTick.getTotalBuyQuantity())
                        .totalSellQuantity((long) kiteTick.getTotalSellQuantity())
                        .open(BigDecimal.valueOf(kiteTick.getOpenPrice()))
                        .high(BigDecimal.valueOf(kiteTick.getHighPrice()))
                        .low(BigDecimal.valueOf(kiteTick.getLowPrice()))
                        .close(BigDecimal.valueOf(kiteTick.getClosePrice()))
                        .change(BigDecimal.valueOf(kiteTick.getChange()))
                        .oi((long) kiteTick.getOi())
                        .oiDayHigh((long) kiteTick.getOpenInterestDayHigh())
                        .oiDayLow((long) kiteTick.getOpenInterestDayLow());
            }

            if (mode == TickMode.FULL) {
                Map<String, ArrayList<Depth>> depth = kiteTick.getMarketDepth();
                builder.buyDepth(mapDepth(depth, "buy")).sellDepth(mapDepth(depth, "sell"));
            }
            return builder.build();
        } catch (DecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecodeException("Malformed tick: " + e.getMessage(), e);
        }
    }

    private LocalDateTime toIst(Date date) {
        if (date == null) {
            return null;
        }
        return date.toInstant().atZone(IST).toLocalDateTime();
    }

    private List<DepthLevel> mapDepth(Map<String, ArrayList<Depth>> depth, String side) {
        if (depth == null || depth.get(side) == null) {
            return null;
        }
        return depth.get(side).stream()
                .map(d -> DepthLevel.builder()
                        .price(BigDecimal.valueOf(d.getPrice()))
                        .quantity((long) d.getQuantity())
                        .orders(d.getOrders())
                        .build())
                .toList();
    }
}
