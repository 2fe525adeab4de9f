package com.globalai.backend.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable price and fundamentals record. {@code symbol} is the listing actually quoted, which
 * differs from {@code ticker} for venue-specific broker symbols.
 */
@Builder(toBuilder = true)
public record PriceSnapshot(
        String ticker,
        String symbol,
        String displayName,
        BigDecimal price,
        String currency,
        Instant asOf,
        SnapshotSource source,
        String provider,
        boolean degraded,
        double sixMonthReturn,
        Fundamentals fundamentals
) {

    public boolean hasUsablePrice() {
        return price != null && price.signum() > 0;
    }

    public PriceSnapshot fromCache() {
        return toBuilder().source(SnapshotSource.CACHE).build();
    }
}
