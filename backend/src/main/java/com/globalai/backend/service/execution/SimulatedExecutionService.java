package com.globalai.backend.service.execution;

import com.globalai.backend.model.ExecutionResult;
import com.globalai.backend.model.ExecutionStatus;
import com.globalai.backend.model.Order;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Demo-mode execution used while a broker is not connected. Identifiers are derived from the
 * order itself, so the same order always simulates to the same id.
 */
@Service
public class SimulatedExecutionService {

    static final String STATUS = "SIMULATED";

    public ExecutionResult simulate(Order order) {
        return ExecutionResult.builder()
                .ticker(order.ticker())
                .brokerSymbol(order.brokerSymbol())
                .side(order.side())
                .quantity(order.quantity())
                .dollarAmount(order.dollarAmount())
                .status(ExecutionStatus.SIMULATED)
                .brokerOrderId(simulatedId(order))
                .brokerStatus(STATUS)
                .build();
    }

    String simulatedId(Order order) {
        String fingerprint = order.brokerSymbol() + "|" + order.side() + "|"
                + plain(order.quantity()) + "|" + plain(order.dollarAmount());
        String hash = UUID.nameUUIDFromBytes(fingerprint.getBytes(StandardCharsets.UTF_8)).toString().replace("-", "");
        return "SIM-" + order.brokerSymbol() + "-" + hash.substring(0, 12);
    }

    private String plain(BigDecimal value) {
        return value == null ? "" : value.stripTrailingZeros().toPlainString();
    }
}
