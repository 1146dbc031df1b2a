package com.tickpipe.domain.model;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * The instruments assigned to one socket connection. Order is the partitioner's token order.
 */
@Value
public class SubscriptionSet {

    int connectionIndex;
    List<Instrument> instruments;

    public SubscriptionSet(int connectionIndex, List<Instrument> instruments) {
        this.connectionIndex = connectionIndex;
        this.instruments = List.copyOf(instruments);
    }

    public List<Long> tokens() {
        return instruments.stream().map(Instrument::getToken).toList();
    }

    public Map<Long, String> symbolsByToken() {
        return instruments.stream()
                .collect(Collectors.toUnmodifiableMap(Instrument::getToken, Instrument::getTradingSymbol, (a, b) -> a));
    }

    public int size() {
        return instruments.size();
    }
}
