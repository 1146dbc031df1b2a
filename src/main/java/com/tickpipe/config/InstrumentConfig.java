package com.tickpipe.config;

import com.tickpipe.domain.enums.InstrumentKind;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Instrument universe selection ({@code tickpipe.instruments.*}). */
@Configuration
@ConfigurationProperties(prefix = "tickpipe.instruments")
@Validated
@Getter
@Setter
public class InstrumentConfig {

    /** Root symbols whose derivatives are streamed. */
    @NotEmpty
    private List<String> underlyings = List.of("NIFTY");

    @NotBlank
    private String derivativeExchange = "NFO";

    /** Exchange holding the spot rows (indices and equities). */
    @NotBlank
    private String underlyingExchange = "NSE";

    @NotEmpty
    private Set<InstrumentKind> kinds = EnumSet.of(InstrumentKind.CALL, InstrumentKind.PUT);

    /** Nearest expiries kept regardless of month (current + next week by default). */
    @Min(0)
    private int weeklyExpiries = 2;

    /** Calendar months (from the current one) whose last expiry is kept. */
    @Min(0)
    private int monthlyExpiries = 2;

    /** Options further than this percentage from spot are dropped. Null disables the filter. */
    @DecimalMin("0.0")
    private BigDecimal strikeRangePct;

    private boolean includeUnderlying = true;
}
