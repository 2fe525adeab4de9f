package com.globalai.backend.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Amounts are in the strategy base currency; short exposure is negative. Percentages are of the
 * allocated capital.
 */
@Builder
public record ExposureMetrics(
        BigDecimal longExposure,
        BigDecimal shortExposure,
        BigDecimal netExposure,
        BigDecimal grossExposure,
        BigDecimal longExposurePercent,
        BigDecimal shortExposurePercent,
        BigDecimal netExposurePercent,
        BigDecimal grossExposurePercent,
        BigDecimal shortMargin,
        BigDecimal netCapitalRequired,
        BigDecimal portfolioBeta
) {}
