package com.globalai.backend.controller;

import com.globalai.backend.dto.ExecutionRequest;
import com.globalai.backend.dto.ExecutionResponse;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.ExecutionResult;
import com.globalai.backend.model.ExecutionStatus;
import com.globalai.backend.service.execution.ExecutionAdapter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
@Tag(name = "Execution")
public class ExecutionController {

    private final ExecutionAdapter executionAdapter;

    @PostMapping
    @Operation(summary = "Submit orders to a broker, simulated when it is not connected")
    public ResponseEntity<ExecutionResponse> execute(@Valid @RequestBody ExecutionRequest request) {
        Broker broker = Broker.fromRequest(request.getBroker());
        List<ExecutionResult> results = executionAdapter.execute(request.getOrders(), broker);
        return ResponseEntity.ok(ExecutionResponse.builder()
                .broker(broker)
                .simulated(!results.isEmpty() && results.stream().allMatch(result -> result.status() == ExecutionStatus.SIMULATED))
                .submitted((int) results.stream().filter(result -> result.status() == ExecutionStatus.SUBMITTED).count())
                .failed((int) results.stream().filter(result -> result.status() == ExecutionStatus.FAILED).count())
                .results(results)
                .build());
    }
}
