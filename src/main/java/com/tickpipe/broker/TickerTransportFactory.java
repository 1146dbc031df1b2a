package com.tickpipe.broker;

@FunctionalInterface
public interface TickerTransportFactory {

    TickerTransport create(String accessToken);
}
