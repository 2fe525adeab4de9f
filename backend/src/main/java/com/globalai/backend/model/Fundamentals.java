package com.globalai.backend.model;

import lombok.Builder;

import java.math.BigDecimal;

@Builder(toBuilder = true)
public record Fundamentals(
        BigDecimal pe,
        BigDecimal ps,
        BigDecimal pb,
        BigDecimal evEbitda,
        BigDecimal marketCap,
        BigDecimal fiftyTwoWeekHigh,
        BigDecimal fiftyTwoWeekLow,
        Long volume,
        BigDecimal beta
) {

    /**
     * Fills every field missing here from {@code fallback}.
     */
    public Fundamentals mergedWith(Fundamentals fallback) {
        if (fallback == null) {
            return this;
        }
        return new Fundamentals(
                pe != null ? pe : fallback.pe,
                ps != null ? ps : fallback.ps,
                pb != null ? pb : fallback.pb,
                evEbitda != null ? evEbitda : fallback.evEbitda,
                marketCap != null ? marketCap : fallback.marketCap,
                fiftyTwoWeekHigh != null ? fiftyTwoWeekHigh : fallback.fiftyTwoWeekHigh,
                fiftyTwoWeekLow != null ? fiftyTwoWeekLow : fallback.fiftyTwoWeekLow,
                volume != null ? volume : fallback.volume,
                beta != null ? beta : fallback.beta
        );
    }

    public boolean hasValuationRatios() {
        return ps != null || pb != null || evEbitda != null;
    }
}
