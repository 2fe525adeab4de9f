package com.globalai.backend.controller;

import com.globalai.backend.dto.AllocationRequest;
import com.globalai.backend.dto.AllocationResponse;
import com.globalai.backend.model.AllocationResult;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.StrategyVersion;
import com.globalai.backend.service.allocation.AllocationEngine;
import com.globalai.backend.service.allocation.PortfolioMetricsService;
import com.globalai.backend.service.strategy.StrategyPositionStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/allocations")
@RequiredArgsConstructor
@Tag(name = "Allocation")
public class AllocationController {

    private final AllocationEngine allocationEngine;
    private final StrategyPositionStore strategyPositionStore;
    private final PortfolioMetricsService portfolioMetricsService;

    @PostMapping
    @Operation(summary = "Compute orders for a share of capital deployed into a strategy")
    public ResponseEntity<AllocationResponse> allocate(@Valid @RequestBody AllocationRequest request) {
        Broker broker = Broker.fromRequest(request.getBroker());
        StrategyVersion strategy = resolveStrategy(request);
        AllocationResult result = allocationEngine.allocate(request.getTotalCapital(), request.getAllocationPercent(), strategy, broker);
        return ResponseEntity.ok(AllocationResponse.from(result, portfolioMetricsService.exposure(result)));
    }

    private StrategyVersion resolveStrategy(AllocationRequest request) {
        if (request.getStrategyId() == null || request.getStrategyId().isBlank()) {
            return strategyPositionStore.defaultStrategy();
        }
        if (request.getStrategyVersion() != null) {
            return strategyPositionStore.version(request.getStrategyId(), request.getStrategyVersion());
        }
        return strategyPositionStore.latest(request.getStrategyId());
    }
}
