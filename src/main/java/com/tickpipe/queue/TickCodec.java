package com.tickpipe.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tickpipe.domain.model.DepthLevel;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.entity.TickRowEntity;
import com.tickpipe.exception.DecodeException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * JSON form of a {@link Tick} on the queue and in fast storage.
 *
 * <p>Timestamps are ISO-8601 local date-times (IST). Unknown fields are ignored so an older
 * consumer can read entries written by a newer publisher.
 *
 * <p>Decoding also rejects ticks whose symbol or prices do not fit the durable tick columns, so a
 * single such entry is dropped instead of failing every later flush batch.
 */
@Component
public class TickCodec {

    private final ObjectMapper objectMapper;

    public TickCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(Tick tick) {
        try {
            return objectMapper.writeValueAsString(tick);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Failed to serialize tick " + tick.getInstrumentToken(), e);
        }
    }

    /**
     * @throws DecodeException when the payload is not a tick
     */
    public Tick decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new DecodeException("Empty queue payload");
        }
        Tick tick;
        try {
            tick = objectMapper.readValue(payload, Tick.class);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed tick payload: " + e.getOriginalMessage(), e);
        }
        if (tick == null) {
            throw new DecodeException("Tick payload is null");
        }
        if (tick.getInstrumentToken() <= 0 || tick.getTradingSymbol() == null) {
            throw new DecodeException("Tick payload missing instrument token or symbol");
        }
        if (tick.getTradingSymbol().length() > TickRowEntity.SYMBOL_LENGTH) {
            throw new DecodeException("Trading symbol longer than " + TickRowEntity.SYMBOL_LENGTH + " characters");
        }
        checkPrice("lastPrice", tick.getLastPrice());
        checkPrice("averageTradedPrice", tick.getAverageTradedPrice());
        checkPrice("open", tick.getOpen());
        checkPrice("high", tick.getHigh());
        checkPrice("low", tick.getLow());
        checkPrice("close", tick.getClose());
        checkFits("change", tick.getChange(), TickRowEntity.CHANGE_PRECISION, TickRowEntity.CHANGE_SCALE);
        checkDepth("buyDepth", tick.getBuyDepth());
        checkDepth("sellDepth", tick.getSellDepth());
        return tick;
    }

    private static void checkDepth(String field, List<DepthLevel> levels) {
        if (levels == null) {
            return;
        }
        for (DepthLevel level : levels) {
            if (level != null) {
                checkPrice(field, level.getPrice());
            }
        }
    }

    private static void checkPrice(String field, BigDecimal value) {
        checkFits(field, value, TickRowEntity.PRICE_PRECISION, TickRowEntity.PRICE_SCALE);
    }

    // the column rounds to its scale, which can add an integer digit
    private static void checkFits(String field, BigDecimal value, int precision, int scale) {
        if (value == null) {
            return;
        }
        BigDecimal rounded = value.setScale(scale, RoundingMode.HALF_UP);
        if (rounded.precision() - rounded.scale() > precision - scale) {
            throw new DecodeException("Field " + field + " out of range: " + value.toPlainString());
        }
    }

    /** Serializes any value (depth snapshots, etc.) with the same settings. */
    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
