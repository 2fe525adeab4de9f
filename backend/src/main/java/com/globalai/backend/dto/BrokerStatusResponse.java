package com.globalai.backend.dto;

import com.globalai.backend.model.Broker;
import com.globalai.backend.model.ConnectionState;
import com.globalai.backend.model.TradingMode;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class BrokerStatusResponse {
    private boolean connected;
    private Broker broker;
    private boolean credentialsPresent;
    private TradingMode mode;
    private Instant lastCheckedAt;
    private String accountId;
    private String error;

    public static BrokerStatusResponse from(ConnectionState state) {
        return BrokerStatusResponse.builder()
                .connected(state.connected())
                .broker(state.broker())
                .credentialsPresent(state.credentialsPresent())
                .mode(state.mode())
                .lastCheckedAt(state.lastCheckedAt())
                .accountId(state.accountId())
                .error(state.error())
                .build();
    }
}
