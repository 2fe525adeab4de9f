package com.globalai.backend.dto;

import com.globalai.backend.model.AllocationResult;
import com.globalai.backend.model.AllocationWarning;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.ExposureMetrics;
import com.globalai.backend.model.Order;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
public class AllocationResponse {
    private String strategyId;
    private int strategyVersion;
    private Broker broker;
    private String baseCurrency;
    private BigDecimal allocatedCapital;
    private List<Order> orders;
    private List<AllocationWarning> warnings;
    private boolean degraded;
    private boolean aborted;
    private ExposureMetrics metrics;

    public static AllocationResponse from(AllocationResult result, ExposureMetrics metrics) {
        return AllocationResponse.builder()
                .strategyId(result.strategyId())
                .strategyVersion(result.strategyVersion())
                .broker(result.broker())
                .baseCurrency(result.baseCurrency())
                .allocatedCapital(result.allocatedCapital())
                .orders(result.orders())
                .warnings(result.warnings())
                .degraded(result.degraded())
                .aborted(result.aborted())
                .metrics(metrics)
                .build();
    }
}
