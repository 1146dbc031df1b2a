package com.tickpipe.broker;

import com.tickpipe.config.ConnectorConfig;
import com.tickpipe.config.InstrumentConfig;
import com.tickpipe.domain.model.Instrument;
import com.tickpipe.domain.model.SubscriptionSet;
import com.tickpipe.exception.BrokerException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Turns the configured universe into subscription sets: downloads the instrument master,
 * resolves spot prices when a strike window is configured, then partitions.
 */
@Service
@ConditionalOnProperty(prefix = "tickpipe.connector", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InstrumentUniverseService {

    private static final Logger log = LoggerFactory.getLogger(InstrumentUniverseService.class);

    private final InstrumentMasterService instrumentMasterService;
    private final InstrumentPartitioner instrumentPartitioner;
    private final InstrumentConfig instrumentConfig;
    private final ConnectorConfig connectorConfig;

    public InstrumentUniverseService(
            InstrumentMasterService instrumentMasterService,
            InstrumentPartitioner instrumentPartitioner,
            InstrumentConfig instrumentConfig,
            ConnectorConfig connectorConfig) {
        this.instrumentMasterService = instrumentMasterService;
        this.instrumentPartitioner = instrumentPartitioner;
        this.instrumentConfig = instrumentConfig;
        this.connectorConfig = connectorConfig;
    }

    /**
     * @throws com.tickpipe.exception.CapacityExceededException when the selection does not fit the connections
     * @throws BrokerException when the instrument master cannot be downloaded
     */
    public List<SubscriptionSet> resolve(LocalDate today) {
        UniverseFilter filter = buildFilter();
        List<Instrument> universe = instrumentMasterService.listInstruments(today);
        List<SubscriptionSet> partitions = instrumentPartitioner.partition(
                universe,
                filter,
                connectorConfig.getMaxConnections(),
                connectorConfig.getMaxPerConnection(),
                today);
        log.info(
                "Universe resolved: {} instruments across {} connection(s)",
                partitions.stream().mapToInt(SubscriptionSet::size).sum(),
                partitions.size());
        return partitions;
    }

    UniverseFilter buildFilter() {
        UniverseFilter.UniverseFilterBuilder builder = UniverseFilter.builder()
                .underlyings(instrumentConfig.getUnderlyings())
                .kinds(instrumentConfig.getKinds())
                .derivativeExchange(instrumentConfig.getDerivativeExchange())
                .underlyingExchange(instrumentConfig.getUnderlyingExchange())
                .weeklyExpiries(instrumentConfig.getWeeklyExpiries())
                .monthlyExpiries(instrumentConfig.getMonthlyExpiries())
                .strikeRangePct(instrumentConfig.getStrikeRangePct())
                .includeUnderlying(instrumentConfig.isIncludeUnderlying());

        if (instrumentConfig.getStrikeRangePct() != null) {
            try {
                Map<String, BigDecimal> spots = instrumentMasterService.spotPrices(instrumentConfig.getUnderlyings());
                builder.spotPrices(spots);
            } catch (BrokerException e) {
                log.warn("Spot prices unavailable ({}), streaming every strike", e.getMessage());
            }
        }
        return builder.build();
    }
}
