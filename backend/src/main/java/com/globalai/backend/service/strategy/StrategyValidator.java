package com.globalai.backend.service.strategy;

import com.globalai.backend.exception.StrategyValidationException;
import com.globalai.backend.model.PositionSide;
import com.globalai.backend.model.StrategyVersion;
import com.globalai.backend.model.TargetPosition;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class StrategyValidator {

    static final BigDecimal EPSILON = new BigDecimal("0.000001");

    private StrategyValidator() {
    }

    public static void validate(StrategyVersion strategy) {
        if (strategy.id() == null || strategy.id().isBlank()) {
            throw new StrategyValidationException("Strategy id is required");
        }
        String label = strategy.id() + " v" + strategy.version();
        if (strategy.version() < 1) {
            throw new StrategyValidationException(label + ": version must be positive");
        }
        requireCurrency(label, strategy.baseCurrency());
        requireShare(label, "longShare", strategy.longShare());
        requireShare(label, "shortShare", strategy.shortShare());
        if (!isOne(strategy.longShare().add(strategy.shortShare()))) {
            throw new StrategyValidationException(label + ": longShare + shortShare must equal 1");
        }

        Set<String> tickers = new HashSet<>();
        for (TargetPosition position : strategy.positions()) {
            if (position.ticker() == null || position.ticker().isBlank()) {
                throw new StrategyValidationException(label + ": position without ticker");
            }
            if (!tickers.add(position.ticker().toUpperCase(Locale.ROOT))) {
                throw new StrategyValidationException(label + ": duplicate ticker " + position.ticker());
            }
            if (position.side() == null) {
                throw new StrategyValidationException(label + ": " + position.ticker() + " has no side");
            }
            BigDecimal weight = position.weight();
            if (weight == null || weight.signum() <= 0 || weight.compareTo(BigDecimal.ONE) > 0) {
                throw new StrategyValidationException(label + ": " + position.ticker() + " weight must be in (0, 1]");
            }
        }

        for (PositionSide side : PositionSide.values()) {
            List<TargetPosition> positions = strategy.positions(side);
            if (positions.isEmpty()) {
                if (strategy.shareFor(side).signum() > 0) {
                    throw new StrategyValidationException(label + ": " + side + " share is set but the side has no positions");
                }
                continue;
            }
            BigDecimal total = positions.stream().map(TargetPosition::weight).reduce(BigDecimal.ZERO, BigDecimal::add);
            if (!isOne(total)) {
                throw new StrategyValidationException(label + ": " + side + " weights sum to " + total.toPlainString() + ", expected 1");
            }
        }
    }

    private static void requireShare(String label, String field, BigDecimal share) {
        if (share == null || share.signum() < 0 || share.compareTo(BigDecimal.ONE) > 0) {
            throw new StrategyValidationException(label + ": " + field + " must be in [0, 1]");
        }
    }

    private static void requireCurrency(String label, String code) {
        if (code == null) {
            throw new StrategyValidationException(label + ": baseCurrency is required");
        }
        try {
            Currency.getInstance(code);
        } catch (IllegalArgumentException e) {
            throw new StrategyValidationException(label + ": unknown base currency " + code, e);
        }
    }

    private static boolean isOne(BigDecimal value) {
        return value.subtract(BigDecimal.ONE).abs().compareTo(EPSILON) <= 0;
    }
}
