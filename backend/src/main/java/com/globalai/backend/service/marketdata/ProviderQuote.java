package com.globalai.backend.service.marketdata;

import com.globalai.backend.model.Fundamentals;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw provider answer before caching. {@code closes} may contain nulls for missing sessions.
 */
@Builder
public record ProviderQuote(
        String symbol,
        String displayName,
        BigDecimal price,
        String currency,
        Fundamentals fundamentals,
        List<BigDecimal> closes
) {

    public boolean isComplete() {
        return price != null && price.signum() > 0;
    }
}
