package com.tickpipe.broker;

import com.tickpipe.config.InstrumentConfig;
import com.tickpipe.domain.IndexMapping;
import com.tickpipe.domain.enums.InstrumentKind;
import com.tickpipe.domain.model.Instrument;
import com.tickpipe.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.LTPQuote;
import io.github.resilience4j.retry.annotation.Retry;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Downloads the Kite instrument master and spot prices.
 *
 * <p>The instrument dump for the derivative exchange and the underlying exchange is fetched once
 * per trading date and held in memory; Kite regenerates the dump daily before market open.
 * Rows whose {@code instrument_type} has no {@link InstrumentKind} are skipped.
 *
 * <p>Both calls go through the {@code kiteApi} retry policy. SDK failures surface as
 * {@link BrokerException}.
 */
@Service
@ConditionalOnProperty(prefix = "tickpipe.connector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InstrumentMasterService {

    private static final Logger log = LoggerFactory.getLogger(InstrumentMasterService.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final KiteConnect kiteConnect;
    private final InstrumentConfig instrumentConfig;

    private final Map<LocalDate, List<Instrument>> instrumentsByDate = new ConcurrentHashMap<>();

    public InstrumentMasterService(KiteConnect kiteConnect, InstrumentConfig instrumentConfig) {
        this.kiteConnect = kiteConnect;
        this.instrumentConfig = instrumentConfig;
    }

    /** All instruments of the configured exchanges for the given trading date. */
    @Retry(name = "kiteApi")
    public List<Instrument> listInstruments(LocalDate tradingDate) {
        List<Instrument> cached = instrumentsByDate.get(tradingDate);
        if (cached != null) {
            return cached;
        }

        List<Instrument> instruments = new ArrayList<>();
        for (String exchange : exchanges()) {
            List<com.zerodhatech.models.Instrument> kiteInstruments = download(exchange);
            List<Instrument> mapped = kiteInstruments.stream()
                    .map(this::mapFromKite)
                    .filter(Objects::nonNull)
                    .toList();
            log.info("Downloaded {} {} instruments ({} usable)", kiteInstruments.size(), exchange, mapped.size());
            instruments.addAll(mapped);
        }

        List<Instrument> result = List.copyOf(instruments);
        instrumentsByDate.clear();
        instrumentsByDate.put(tradingDate, result);
        return result;
    }

    /**
     * Last traded price of the spot instrument for each underlying.
     * Underlyings missing from the LTP response are absent from the result.
     */
    @Retry(name = "kiteApi")
    public Map<String, BigDecimal> spotPrices(Collection<String> underlyings) {
        Map<String, String> quoteKeys = new LinkedHashMap<>();
        for (String underlying : underlyings) {
            quoteKeys.put(underlying, IndexMapping.quoteKey(underlying, instrumentConfig.getUnderlyingExchange()));
        }

        try {
            Map<String, LTPQuote> quotes = kiteConnect.getLTP(quoteKeys.values().toArray(new String[0]));
            Map<String, BigDecimal> prices = new LinkedHashMap<>();
            quoteKeys.forEach((underlying, key) -> {
                LTPQuote quote = quotes.get(key);
                if (quote != null) {
                    prices.put(underlying, BigDecimal.valueOf(quote.lastPrice));
                }
            });
            log.info("Spot prices: {}", prices);
            return prices;
        } catch (KiteException e) {
            throw new BrokerException("Kite LTP request failed: " + e.message, e);
        } catch (JSONException | IOException e) {
            throw new BrokerException("Kite LTP request failed: " + e.getMessage(), e);
        }
    }

    private Set<String> exchanges() {
        Set<String> exchanges = new LinkedHashSet<>();
        exchanges.add(instrumentConfig.getDerivativeExchange());
        exchanges.add(instrumentConfig.getUnderlyingExchange());
        instrumentConfig.getUnderlyings()
                .forEach(u -> exchanges.add(IndexMapping.spotExchange(u, instrumentConfig.getUnderlyingExchange())));
        return exchanges;
    }

    private List<com.zerodhatech.models.Instrument> download(String exchange) {
        try {
            return kiteConnect.getInstruments(exchange);
        } catch (KiteException e) {
            // KiteException extends Throwable (not Exception), caught on its own
            throw new BrokerException("Failed to download " + exchange + " instruments: " + e.message, e);
        } catch (JSONException | IOException e) {
            throw new BrokerException("Failed to download " + exchange + " instruments: " + e.getMessage(), e);
        }
    }

    private Instrument mapFromKite(com.zerodhatech.models.Instrument ki) {
        InstrumentKind kind = InstrumentKind.fromKite(ki.instrument_type, ki.segment);
        if (kind == null) {
            return null;
        }
        return Instrument.builder()
                .token(ki.instrument_token)
                .tradingSymbol(ki.tradingsymbol)
                .name(ki.name)
                .underlying(kind == InstrumentKind.SPOT ? IndexMapping.underlyingOfSpot(ki.tradingsymbol) : ki.name)
                .kind(kind)
                .exchange(ki.exchange)
                .segment(ki.segment)
                .expiry(ki.expiry != null ? ki.expiry.toInstant().atZone(IST).toLocalDate() : null)
                .strike(parseStrike(ki.strike))
                .lotSize(ki.lot_size)
                .build();
    }

    private BigDecimal parseStrike(String strike) {
        if (strike == null || strike.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(strike);
        } catch (NumberFormatException e) {
            log.warn("Could not parse strike value: {}", strike);
            return null;
        }
    }
}
