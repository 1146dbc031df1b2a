package com.tickpipe.domain.model;

import com.tickpipe.domain.enums.InstrumentKind;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A tradeable instrument from the Kite instrument master.
 *
 * <p>{@code underlying} is the root symbol (NIFTY, BANKNIFTY, RELIANCE) for derivatives and the
 * F&amp;O underlying name for spot rows (e.g. "NIFTY 50" maps to NIFTY). {@code expiry} and
 * {@code strike} are null where they do not apply.
 */
@Value
@Builder
public class Instrument {

    long token;
    String tradingSymbol;
    String name;
    String underlying;
    InstrumentKind kind;
    String exchange;
    String segment;
    LocalDate expiry;
    BigDecimal strike;
    int lotSize;
}
