package com.globalai.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationRequest {

    @NotNull
    private BigDecimal totalCapital;

    @NotNull
    private BigDecimal allocationPercent;

    @NotBlank
    private String broker;

    // defaults to the configured strategy
    private String strategyId;

    // defaults to the latest version
    private Integer strategyVersion;
}
