package com.globalai.backend.model;

import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record TargetPosition(
        String ticker,
        String displayName,
        PositionSide side,
        BigDecimal weight,
        String rationale,
        Integer confidence,
        String market
) {

    public CanonicalInstrument instrument() {
        return new CanonicalInstrument(ticker, displayName);
    }
}
