package com.globalai.backend.service.marketdata;

import com.globalai.backend.model.Fundamentals;
import com.globalai.backend.model.FxRate;
import com.globalai.backend.model.PriceSnapshot;
import com.globalai.backend.model.SnapshotSource;
import com.globalai.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Deterministic demo data used once every provider is exhausted. Output depends only on the
 * configured tables, never on the clock.
 */
public class SyntheticSnapshotFactory {

    public static final String PROVIDER = "synthetic";

    private final Map<String, BigDecimal> prices;
    private final Map<String, BigDecimal> fxRates;

    public SyntheticSnapshotFactory(Map<String, BigDecimal> prices, Map<String, BigDecimal> fxRates) {
        this.prices = Map.copyOf(prices);
        this.fxRates = Map.copyOf(fxRates);
    }

    public PriceSnapshot snapshot(QuoteRequest request) {
        BigDecimal price = prices.getOrDefault(request.symbol(), prices.getOrDefault(request.ticker(), MoneyUtils.ZERO));
        return PriceSnapshot.builder()
                .ticker(request.ticker())
                .symbol(request.symbol())
                .displayName(request.ticker())
                .price(MoneyUtils.scale(price))
                .currency(request.currency() != null ? request.currency() : "USD")
                .asOf(Instant.EPOCH)
                .source(SnapshotSource.SYNTHETIC)
                .provider(PROVIDER)
                .degraded(true)
                .sixMonthReturn(0.0)
                .fundamentals(Fundamentals.builder().build())
                .build();
    }

    public Optional<FxRate> fxRate(String base, String quote) {
        String baseCode = base.toUpperCase(Locale.ROOT);
        String quoteCode = quote.toUpperCase(Locale.ROOT);
        BigDecimal direct = fxRates.get(baseCode + quoteCode);
        if (direct != null && direct.signum() > 0) {
            return Optional.of(new FxRate(baseCode, quoteCode, direct, SnapshotSource.SYNTHETIC, PROVIDER));
        }
        BigDecimal inverse = fxRates.get(quoteCode + baseCode);
        if (inverse != null && inverse.signum() > 0) {
            BigDecimal rate = BigDecimal.ONE.divide(inverse, 8, RoundingMode.HALF_UP);
            return Optional.of(new FxRate(baseCode, quoteCode, rate, SnapshotSource.SYNTHETIC, PROVIDER));
        }
        return Optional.empty();
    }
}
