package com.globalai.backend.service.marketdata;

import com.globalai.backend.model.BrokerSymbolMapping;

/**
 * What to quote. {@code symbol} is the listing to price, {@code currency} the listing currency
 * when known from the symbol registry.
 */
public record QuoteRequest(String ticker, String symbol, String currency, boolean includeFundamentals) {

    public static QuoteRequest of(String ticker) {
        return new QuoteRequest(ticker, ticker, null, true);
    }

    public static QuoteRequest forMapping(BrokerSymbolMapping mapping) {
        return new QuoteRequest(mapping.ticker(), mapping.brokerSymbol(), mapping.currency(), true);
    }

    public QuoteRequest withoutFundamentals() {
        return new QuoteRequest(ticker, symbol, currency, false);
    }

    public boolean isVenueSpecific() {
        return symbol != null && !symbol.equalsIgnoreCase(ticker);
    }

    public String cacheKey() {
        return symbol;
    }
}
