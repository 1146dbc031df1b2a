package com.tickpipe.domain.enums;

import com.zerodhatech.ticker.KiteTicker;

/** Kite streaming modes. Only FULL carries market depth. */
public enum TickMode {
    LTP(KiteTicker.modeLTP),
    QUOTE(KiteTicker.modeQuote),
    FULL(KiteTicker.modeFull);

    private final String kiteMode;

    TickMode(String kiteMode) {
        this.kiteMode = kiteMode;
    }

    public String getKiteMode() {
        return kiteMode;
    }

    /** Resolves the mode string reported on a Kite tick; unknown or missing values fall back. */
    public static TickMode fromKite(String mode, TickMode fallback) {
        if (mode == null) {
            return fallback;
        }
        for (TickMode tickMode : values()) {
            if (tickMode.kiteMode.equalsIgnoreCase(mode)) {
                return tickMode;
            }
        }
        return fallback;
    }
}
