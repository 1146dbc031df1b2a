package com.tickpipe.broker;

import com.tickpipe.calendar.ExpirySelector;
import com.tickpipe.config.ConnectorConfig;
import com.tickpipe.domain.IndexMapping;
import com.tickpipe.domain.enums.InstrumentKind;
import com.tickpipe.domain.model.Instrument;
import com.tickpipe.domain.model.SubscriptionSet;
import com.tickpipe.exception.CapacityExceededException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Selects the instruments to stream and splits them across socket connections.
 *
 * <p>Kite allows 3 streaming connections per API key and 3000 tokens per connection. The
 * selected instruments are sorted by token and dealt round-robin, so every token lands on
 * exactly one connection, set sizes differ by at most one, and the same universe always
 * yields the same assignment. Selections larger than the total capacity are rejected with
 * {@link CapacityExceededException}, never truncated.
 *
 * <p>Stateless: the caller passes the universe, filter and limits on every call.
 */
@Component
public class InstrumentPartitioner {

    private static final Logger log = LoggerFactory.getLogger(InstrumentPartitioner.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ExpirySelector expirySelector;

    public InstrumentPartitioner(ExpirySelector expirySelector) {
        this.expirySelector = expirySelector;
    }

    /**
     * Filters the universe and distributes the result.
     *
     * @throws CapacityExceededException when the selection exceeds {@code maxConnections * maxPerConnection}
     */
    public List<SubscriptionSet> partition(
            Collection<Instrument> universe,
            UniverseFilter filter,
            int maxConnections,
            int maxPerConnection,
            LocalDate today) {
        List<Instrument> selected = select(universe, filter, today);
        return distribute(selected, maxConnections, maxPerConnection);
    }

    /**
     * Applies underlying, kind, expiry and strike filters. Spot rows are added when the filter
     * asks for the underlying. Result is de-duplicated by token.
     */
    public List<Instrument> select(Collection<Instrument> universe, UniverseFilter filter, LocalDate today) {
        Map<Long, Instrument> selected = new LinkedHashMap<>();

        for (String underlying : filter.getUnderlyings()) {
            List<Instrument> derivatives = universe.stream()
                    .filter(i -> underlying.equals(i.getUnderlying()))
                    .filter(i -> filter.getDerivativeExchange().equals(i.getExchange()))
                    .filter(i -> isDerivative(i.getKind()))
                    .filter(i -> filter.getKinds().contains(i.getKind()))
                    .filter(i -> i.getExpiry() != null && !i.getExpiry().isBefore(today))
                    .toList();

            Set<LocalDate> expiries = expirySelector.select(
                    derivatives.stream().map(Instrument::getExpiry).toList(),
                    today,
                    filter.getWeeklyExpiries(),
                    filter.getMonthlyExpiries());

            BigDecimal spot = filter.getSpotPrices().get(underlying);
            int before = selected.size();
            derivatives.stream()
                    .filter(i -> expiries.contains(i.getExpiry()))
                    .filter(i -> withinStrikeRange(i, spot, filter.getStrikeRangePct()))
                    .forEach(i -> selected.putIfAbsent(i.getToken(), i));

            if (filter.isIncludeUnderlying() || filter.getKinds().contains(InstrumentKind.SPOT)) {
                findSpot(universe, underlying, filter.getUnderlyingExchange())
                        .ifPresentOrElse(
                                i -> selected.putIfAbsent(i.getToken(), i),
                                () -> log.warn("Spot instrument for {} not found in master", underlying));
            }

            log.info(
                    "Selected {} instruments for {} (expiries={}, spot={})",
                    selected.size() - before,
                    underlying,
                    expiries,
                    spot);
        }
        return new ArrayList<>(selected.values());
    }

    /**
     * Round-robins instruments, in token order, over {@code min(maxConnections, 3)} connections.
     * Trailing connections that would receive nothing are omitted.
     */
    public List<SubscriptionSet> distribute(List<Instrument> instruments, int maxConnections, int maxPerConnection) {
        int connections = Math.max(1, Math.min(maxConnections, ConnectorConfig.BROKER_MAX_CONNECTIONS));
        List<Instrument> ordered = instruments.stream()
                .collect(Collectors.toMap(Instrument::getToken, i -> i, (a, b) -> a, LinkedHashMap::new))
                .values()
                .stream()
                .sorted(Comparator.comparingLong(Instrument::getToken))
                .toList();

        long capacity = (long) connections * maxPerConnection;
        if (ordered.size() > capacity) {
            throw new CapacityExceededException(ordered.size(), connections, maxPerConnection);
        }

        List<List<Instrument>> buckets = new ArrayList<>();
        for (int i = 0; i < connections; i++) {
            buckets.add(new ArrayList<>());
        }
        for (int i = 0; i < ordered.size(); i++) {
            buckets.get(i % connections).add(ordered.get(i));
        }

        List<SubscriptionSet> sets = new ArrayList<>();
        for (int i = 0; i < connections; i++) {
            if (!buckets.get(i).isEmpty()) {
                sets.add(new SubscriptionSet(i, buckets.get(i)));
            }
        }

        log.info(
                "Partitioned {} instruments over {} connections: {}",
                ordered.size(),
                sets.size(),
                sets.stream().map(SubscriptionSet::size).toList());
        return sets;
    }

    private boolean isDerivative(InstrumentKind kind) {
        if (kind == null) {
            return false;
        }
        return switch (kind) {
            case FUTURE, CALL, PUT -> true;
            case SPOT -> false;
        };
    }

    private boolean withinStrikeRange(Instrument instrument, BigDecimal spot, BigDecimal rangePct) {
        if (rangePct == null || spot == null || !instrument.getKind().isOption() || instrument.getStrike() == null) {
            return true;
        }
        BigDecimal band = spot.multiply(rangePct).divide(HUNDRED, 4, RoundingMode.HALF_UP);
        BigDecimal low = spot.subtract(band);
        BigDecimal high = spot.add(band);
        return instrument.getStrike().compareTo(low) >= 0 && instrument.getStrike().compareTo(high) <= 0;
    }

    private Optional<Instrument> findSpot(Collection<Instrument> universe, String underlying, String underlyingExchange) {
        String spotSymbol = IndexMapping.spotSymbol(underlying);
        String exchange = IndexMapping.spotExchange(underlying, underlyingExchange);
        return universe.stream()
                .filter(i -> i.getKind() == InstrumentKind.SPOT)
                .filter(i -> spotSymbol.equals(i.getTradingSymbol()))
                .filter(i -> exchange.equals(i.getExchange()))
                .findFirst();
    }
}
