package com.globalai.backend.model;

import lombok.Builder;

import java.time.Instant;

@Builder(toBuilder = true)
public record ConnectionState(
        Broker broker,
        boolean connected,
        boolean credentialsPresent,
        Instant lastCheckedAt,
        TradingMode mode,
        String accountId,
        String error
) {

    public static ConnectionState disconnected(Broker broker, Instant now) {
        return ConnectionState.builder()
                .broker(broker)
                .connected(false)
                .credentialsPresent(false)
                .lastCheckedAt(now)
                .mode(TradingMode.PAPER)
                .build();
    }
}
