package com.globalai.backend.config;

import com.globalai.backend.model.Broker;
import com.globalai.backend.model.BrokerCredentials;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "brokers")
@Data
@Validated
public class BrokerProperties {

    private long healthCheckIntervalMs = 300_000;

    private Settings alpaca = new Settings();

    private Settings swissquote = new Settings();

    public Settings forBroker(Broker broker) {
        return switch (broker) {
            case ALPACA -> alpaca;
            case SWISSQUOTE -> swissquote;
        };
    }

    @Data
    public static class Settings {
        private String liveUrl;
        private String paperUrl;
        private boolean fractionalShares;
        private String orderType = "market";
        private String timeInForce = "day";
        private String apiKey;
        private String apiSecret;
        private boolean paper = true;

        public String baseUrl(boolean paperMode) {
            return paperMode ? paperUrl : liveUrl;
        }

        public BrokerCredentials configuredCredentials() {
            return new BrokerCredentials(apiKey, apiSecret, paper);
        }
    }
}
