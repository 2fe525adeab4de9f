package com.globalai.backend.dto;

import com.globalai.backend.model.Broker;
import com.globalai.backend.model.ExecutionResult;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ExecutionResponse {
    private Broker broker;
    private boolean simulated;
    private int submitted;
    private int failed;
    private List<ExecutionResult> results;
}
