package com.globalai.backend.service.marketdata;

import com.globalai.backend.model.Fundamentals;
import com.globalai.backend.model.FxRate;
import com.globalai.backend.model.PriceSnapshot;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared snapshot store, keyed by quoted symbol (prices, fundamentals) and currency pair (FX).
 */
public class MarketDataCache {

    private final TtlCache<String, PriceSnapshot> prices;
    private final TtlCache<String, Fundamentals> fundamentals;
    private final TtlCache<String, FxRate> fxRates;

    public MarketDataCache(Duration priceTtl, Duration fundamentalsTtl, Duration fxTtl, Clock clock) {
        this.prices = new TtlCache<>(priceTtl, clock);
        this.fundamentals = new TtlCache<>(fundamentalsTtl, clock);
        this.fxRates = new TtlCache<>(fxTtl, clock);
    }

    public TtlCache<String, PriceSnapshot> prices() {
        return prices;
    }

    public TtlCache<String, Fundamentals> fundamentals() {
        return fundamentals;
    }

    public TtlCache<String, FxRate> fxRates() {
        return fxRates;
    }

    public void clear() {
        prices.clear();
        fundamentals.clear();
        fxRates.clear();
    }
}
