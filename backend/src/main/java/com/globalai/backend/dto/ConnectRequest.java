package com.globalai.backend.dto;

import com.globalai.backend.model.BrokerCredentials;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectRequest {

    @ToString.Exclude
    private String apiKey;

    @ToString.Exclude
    private String apiSecret;

    @Builder.Default
    private boolean paper = true;

    public BrokerCredentials toCredentials() {
        return new BrokerCredentials(apiKey, apiSecret, paper);
    }
}
