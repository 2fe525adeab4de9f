package com.globalai.backend.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Engine output for one position. {@code dollarAmount} is in the strategy base currency,
 * {@code price} and {@code currency} belong to the traded listing.
 */
@Builder
public record Order(
        String ticker,
        String displayName,
        String brokerSymbol,
        String venue,
        OrderSide side,
        BigDecimal quantity,
        BigDecimal price,
        BigDecimal dollarAmount,
        BigDecimal weight,
        BigDecimal portfolioWeight,
        String currency,
        String baseCurrency,
        BigDecimal fxRate,
        String rationale,
        SnapshotSource priceSource,
        String priceProvider,
        boolean degraded,
        BigDecimal beta
) {}
