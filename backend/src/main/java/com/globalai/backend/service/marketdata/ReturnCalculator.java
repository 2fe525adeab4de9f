package com.globalai.backend.service.marketdata;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

public final class ReturnCalculator {

    private ReturnCalculator() {
    }

    /**
     * Percent change from the first to the last non-null close, rounded to two decimals.
     * Fewer than two usable closes yields 0.0.
     */
    public static double sixMonthReturn(List<BigDecimal> closes) {
        if (closes == null) {
            return 0.0;
        }
        List<BigDecimal> usable = closes.stream().filter(Objects::nonNull).toList();
        if (usable.size() < 2) {
            return 0.0;
        }
        BigDecimal first = usable.get(0);
        BigDecimal last = usable.get(usable.size() - 1);
        if (first.signum() == 0) {
            return 0.0;
        }
        return last.subtract(first)
                .multiply(BigDecimal.valueOf(100))
                .divide(first, 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
