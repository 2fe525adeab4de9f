package com.globalai.backend.service.execution;

import com.globalai.backend.model.Broker;
import com.globalai.backend.model.BrokerCredentials;
import com.globalai.backend.model.TradingMode;

import java.time.Instant;

/**
 * Authenticated broker session held in memory by the connection manager.
 */
public record BrokerSession(
        Broker broker,
        BrokerCredentials credentials,
        TradingMode mode,
        String baseUrl,
        String accessToken,
        Instant expiresAt,
        String accountId
) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "BrokerSession[broker=" + broker + ", mode=" + mode + ", accountId=" + accountId + "]";
    }
}
