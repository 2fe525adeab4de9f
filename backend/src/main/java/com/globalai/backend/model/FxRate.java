package com.globalai.backend.model;

import java.math.BigDecimal;

/**
 * Units of {@code quote} currency per one unit of {@code base}.
 */
public record FxRate(String base, String quote, BigDecimal rate, SnapshotSource source, String provider) {

    public static FxRate identity(String currency) {
        return new FxRate(currency, currency, BigDecimal.ONE, SnapshotSource.PROVIDER, "identity");
    }

    public boolean degraded() {
        return source == SnapshotSource.SYNTHETIC;
    }

    public FxRate fromCache() {
        return new FxRate(base, quote, rate, SnapshotSource.CACHE, provider);
    }
}
