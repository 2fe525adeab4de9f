package com.globalai.backend.exception;

public class MarketDataProviderException extends RuntimeException {
    private final String provider;
    private final int statusCode;

    public MarketDataProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
        this.statusCode = -1;
    }

    public MarketDataProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = -1;
    }

    public MarketDataProviderException(String provider, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String getProvider() {
        return provider;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
