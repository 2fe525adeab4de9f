package com.globalai.backend.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

@Builder
public record AllocationResult(
        String strategyId,
        int strategyVersion,
        Broker broker,
        String baseCurrency,
        BigDecimal allocatedCapital,
        List<Order> orders,
        List<AllocationWarning> warnings,
        boolean degraded,
        boolean aborted
) {

    public AllocationResult {
        orders = orders == null ? List.of() : List.copyOf(orders);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
