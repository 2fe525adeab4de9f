package com.globalai.backend.model;

import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record ExecutionResult(
        String ticker,
        String brokerSymbol,
        OrderSide side,
        BigDecimal quantity,
        BigDecimal dollarAmount,
        ExecutionStatus status,
        String brokerOrderId,
        String brokerStatus,
        String error
) {}
