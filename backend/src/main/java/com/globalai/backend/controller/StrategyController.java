package com.globalai.backend.controller;

import com.globalai.backend.model.StrategyVersion;
import com.globalai.backend.service.strategy.StrategyPositionStore;
import com.globalai.backend.service.strategy.StrategySummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/strategies")
@RequiredArgsConstructor
@Tag(name = "Strategy")
public class StrategyController {

    private final StrategyPositionStore strategyPositionStore;

    @GetMapping
    @Operation(summary = "List loaded strategy ids")
    public ResponseEntity<List<String>> list() {
        return ResponseEntity.ok(strategyPositionStore.ids());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Strategy summary, latest version unless one is requested")
    public ResponseEntity<StrategySummary> summary(@PathVariable String id,
                                                   @RequestParam(required = false) Integer version) {
        StrategyVersion strategy = version == null
                ? strategyPositionStore.latest(id)
                : strategyPositionStore.version(id, version);
        return ResponseEntity.ok(StrategySummary.of(strategy));
    }
}
