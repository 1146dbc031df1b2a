package com.tickpipe.domain.model;

import lombok.Value;

/** Rows written by one committed flush. */
@Value
public class FlushResult {

    public static final FlushResult EMPTY = new FlushResult(0, 0);

    int tickRows;
    int depthRows;

    public boolean isEmpty() {
        return tickRows == 0 && depthRows == 0;
    }
}
