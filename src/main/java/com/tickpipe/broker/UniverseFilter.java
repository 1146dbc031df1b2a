package com.tickpipe.broker;

import com.tickpipe.domain.enums.InstrumentKind;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Which instruments of the master to stream: underlyings, kinds, expiry policy and the
 * optional strike window around spot.
 *
 * <p>{@code spotPrices} is resolved by the caller before partitioning; underlyings without a
 * spot price are not strike-filtered.
 */
@Value
@Builder
public class UniverseFilter {

    @Singular
    Set<String> underlyings;

    String derivativeExchange;
    String underlyingExchange;

    @Singular
    Set<InstrumentKind> kinds;

    int weeklyExpiries;
    int monthlyExpiries;

    /** Percent band around spot for option strikes; null keeps every strike. */
    BigDecimal strikeRangePct;

    boolean includeUnderlying;

    @Singular
    Map<String, BigDecimal> spotPrices;
}
