package com.globalai.backend.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * One immutable revision of a long/short strategy. Position order is significant: allocation
 * output follows it.
 */
@Builder
public record StrategyVersion(
        String id,
        int version,
        String name,
        String description,
        String baseCurrency,
        BigDecimal longShare,
        BigDecimal shortShare,
        List<TargetPosition> positions
) {

    public StrategyVersion {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public BigDecimal shareFor(PositionSide side) {
        return side == PositionSide.LONG ? longShare : shortShare;
    }

    public List<TargetPosition> positions(PositionSide side) {
        return positions.stream()
                .filter(position -> position.side() == side)
                .toList();
    }
}
