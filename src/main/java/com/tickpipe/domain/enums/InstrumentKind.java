package com.tickpipe.domain.enums;

/**
 * Kind of a subscribable instrument. Closed set: every filter over kinds switches exhaustively.
 */
public enum InstrumentKind {
    SPOT,
    FUTURE,
    CALL,
    PUT;

    /**
     * Maps a Kite {@code instrument_type} (plus segment, for indices) to a kind.
     *
     * @return the kind, or null when the Kite type has no counterpart (the row is skipped)
     */
    public static InstrumentKind fromKite(String instrumentType, String segment) {
        if ("INDICES".equals(segment)) {
            return SPOT;
        }
        if (instrumentType == null) {
            return null;
        }
        return switch (instrumentType) {
            case "EQ" -> SPOT;
            case "FUT" -> FUTURE;
            case "CE" -> CALL;
            case "PE" -> PUT;
            default -> null;
        };
    }

    public boolean isOption() {
        return switch (this) {
            case CALL, PUT -> true;
            case SPOT, FUTURE -> false;
        };
    }
}
