package com.tickpipe.exception;

import java.util.Map;

public class CapacityExceededException extends BaseException {

    public CapacityExceededException(int instrumentCount, int maxConnections, int maxPerConnection) {
        super(
                ErrorCode.CAPACITY_EXCEEDED,
                String.format(
                        "%d instruments exceed capacity of %d connections x %d tokens",
                        instrumentCount, maxConnections, maxPerConnection),
                Map.of(
                        "instrumentCount", instrumentCount,
                        "maxConnections", maxConnections,
                        "maxPerConnection", maxPerConnection));
    }
}
