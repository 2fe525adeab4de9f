package com.globalai.backend.model;

/**
 * Held in memory only for the lifetime of a broker session.
 */
public record BrokerCredentials(String apiKey, String apiSecret, boolean paper) {

    public boolean isPresent() {
        return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }

    @Override
    public String toString() {
        return "BrokerCredentials[apiKey=***, apiSecret=***, paper=" + paper + "]";
    }
}
