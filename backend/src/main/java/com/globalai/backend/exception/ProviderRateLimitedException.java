package com.globalai.backend.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Raised when a provider signals rate limiting. Never leaves the market data layer.
 */
public class ProviderRateLimitedException extends MarketDataProviderException {
    private final Duration retryAfter;

    public ProviderRateLimitedException(String provider, String message) {
        this(provider, message, null, null);
    }

    public ProviderRateLimitedException(String provider, String message, Duration retryAfter, Throwable cause) {
        super(provider, message, 429, cause);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
