package com.globalai.backend.service.strategy;

import com.globalai.backend.model.PositionSide;
import com.globalai.backend.model.StrategyVersion;
import com.globalai.backend.model.TargetPosition;
import lombok.Builder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

@Builder
public record StrategySummary(
        String id,
        int version,
        String name,
        String description,
        String baseCurrency,
        BigDecimal longShare,
        BigDecimal shortShare,
        int longCount,
        int shortCount,
        List<String> markets,
        Double averageConfidence,
        List<PositionView> positions
) {

    public static StrategySummary of(StrategyVersion strategy) {
        OptionalDouble confidence = strategy.positions().stream()
                .map(TargetPosition::confidence)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average();
        return StrategySummary.builder()
                .id(strategy.id())
                .version(strategy.version())
                .name(strategy.name())
                .description(strategy.description())
                .baseCurrency(strategy.baseCurrency())
                .longShare(strategy.longShare())
                .shortShare(strategy.shortShare())
                .longCount(strategy.positions(PositionSide.LONG).size())
                .shortCount(strategy.positions(PositionSide.SHORT).size())
                .markets(strategy.positions().stream()
                        .map(TargetPosition::market)
                        .filter(Objects::nonNull)
                        .distinct()
                        .sorted()
                        .toList())
                .averageConfidence(confidence.isPresent()
                        ? BigDecimal.valueOf(confidence.getAsDouble()).setScale(1, RoundingMode.HALF_UP).doubleValue()
                        : null)
                .positions(strategy.positions().stream()
                        .map(position -> new PositionView(
                                position.ticker(),
                                position.displayName(),
                                position.side(),
                                position.weight(),
                                strategy.shareFor(position.side()).multiply(position.weight()),
                                position.confidence(),
                                position.market(),
                                position.rationale()))
                        .toList())
                .build();
    }

    public record PositionView(
            String ticker,
            String displayName,
            PositionSide side,
            BigDecimal weight,
            BigDecimal portfolioWeight,
            Integer confidence,
            String market,
            String rationale
    ) {
    }
}
