package com.globalai.backend.service.marketdata;

import java.math.BigDecimal;
import java.util.List;

/**
 * One external market data source. Implementations perform a single attempt per call and signal
 * rate limiting with {@link com.globalai.backend.exception.ProviderRateLimitedException}; all
 * other failures surface as {@link com.globalai.backend.exception.MarketDataProviderException}.
 */
public interface MarketDataProvider {

    String name();

    default boolean isConfigured() {
        return true;
    }

    ProviderQuote fetchQuote(QuoteRequest request);

    default List<BigDecimal> fetchCloses(String symbol) {
        throw new UnsupportedOperationException(name() + " does not serve price history");
    }

    default BigDecimal fetchFxRate(String base, String quote) {
        throw new UnsupportedOperationException(name() + " does not quote FX");
    }
}
