package com.tickpipe.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One order-book level. */
@Value
@Builder
@Jacksonized
public class DepthLevel {

    BigDecimal price;
    long quantity;
    int orders;
}
