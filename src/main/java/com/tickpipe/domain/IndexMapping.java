package com.tickpipe.domain;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps F&amp;O underlying names to the trading symbol of their spot index.
 *
 * <p>Kite lists index derivatives under the short name (NIFTY) but the spot index under its
 * display name (NIFTY 50). Stock derivatives use the same symbol on both sides, so anything
 * missing here is looked up as-is.
 */
public final class IndexMapping {

    /** F&amp;O underlying -> spot index trading symbol. */
    public static final Map<String, String> UNDERLYING_TO_SPOT = Map.of(
            "NIFTY", "NIFTY 50",
            "BANKNIFTY", "NIFTY BANK",
            "FINNIFTY", "NIFTY FIN SERVICE",
            "MIDCPNIFTY", "NIFTY MID SELECT",
            "SENSEX", "SENSEX");

    /** Spot index trading symbol -> F&amp;O underlying. */
    public static final Map<String, String> SPOT_TO_UNDERLYING;

    /** Indices that are not listed on the default underlying exchange. */
    private static final Map<String, String> SPOT_EXCHANGE_OVERRIDES = Map.of("SENSEX", "BSE");

    static {
        Map<String, String> reverse = new HashMap<>();
        UNDERLYING_TO_SPOT.forEach((underlying, spot) -> reverse.put(spot, underlying));
        SPOT_TO_UNDERLYING = Collections.unmodifiableMap(reverse);
    }

    private IndexMapping() {}

    public static String spotSymbol(String underlying) {
        return UNDERLYING_TO_SPOT.getOrDefault(underlying, underlying);
    }

    /** Underlying for a spot row; equities map to themselves. */
    public static String underlyingOfSpot(String spotSymbol) {
        return SPOT_TO_UNDERLYING.getOrDefault(spotSymbol, spotSymbol);
    }

    public static String spotExchange(String underlying, String defaultExchange) {
        return SPOT_EXCHANGE_OVERRIDES.getOrDefault(underlying, defaultExchange);
    }

    /** Kite quote key, e.g. {@code NSE:NIFTY 50}. */
    public static String quoteKey(String underlying, String defaultExchange) {
        return spotExchange(underlying, defaultExchange) + ":" + spotSymbol(underlying);
    }
}
