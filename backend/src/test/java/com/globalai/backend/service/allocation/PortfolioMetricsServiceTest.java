package com.globalai.backend.service.allocation;

import com.globalai.backend.config.AllocationProperties;
import com.globalai.backend.model.AllocationResult;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.ExposureMetrics;
import com.globalai.backend.model.Order;
import com.globalai.backend.model.OrderSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PortfolioMetricsServiceTest {

    private final PortfolioMetricsService service = new PortfolioMetricsService(new AllocationProperties());

    @Test
    void exposureAndBetaOfLongShortBook() {
        AllocationResult result = result("10000", List.of(
                order("NVDA", OrderSide.BUY, "4000", "1.5"),
                order("MSFT", OrderSide.BUY, "2000", null),
                order("HRB", OrderSide.SELL, "3000", "0.8")));

        ExposureMetrics metrics = service.exposure(result);

        assertThat(metrics.longExposure()).isEqualByComparingTo("6000");
        assertThat(metrics.shortExposure()).isEqualByComparingTo("-3000");
        assertThat(metrics.netExposure()).isEqualByComparingTo("3000");
        assertThat(metrics.grossExposure()).isEqualByComparingTo("9000");
        assertThat(metrics.longExposurePercent()).isEqualByComparingTo("60.0");
        assertThat(metrics.shortExposurePercent()).isEqualByComparingTo("-30.0");
        assertThat(metrics.netExposurePercent()).isEqualByComparingTo("30.0");
        assertThat(metrics.grossExposurePercent()).isEqualByComparingTo("90.0");
        assertThat(metrics.shortMargin()).isEqualByComparingTo("1500");
        assertThat(metrics.netCapitalRequired()).isEqualByComparingTo("4500");
        assertThat(metrics.portfolioBeta()).isEqualByComparingTo("0.56");
    }

    @Test
    void emptyResultHasZeroExposure() {
        ExposureMetrics metrics = service.exposure(result("0", List.of()));

        assertThat(metrics.grossExposure()).isEqualByComparingTo("0");
        assertThat(metrics.grossExposurePercent()).isEqualByComparingTo("0");
        assertThat(metrics.portfolioBeta()).isEqualByComparingTo("0");
    }

    private AllocationResult result(String capital, List<Order> orders) {
        return AllocationResult.builder()
                .strategyId("global-ai-long-short")
                .strategyVersion(1)
                .broker(Broker.ALPACA)
                .baseCurrency("USD")
                .allocatedCapital(new BigDecimal(capital))
                .orders(orders)
                .build();
    }

    private Order order(String ticker, OrderSide side, String amount, String beta) {
        return Order.builder()
                .ticker(ticker)
                .brokerSymbol(ticker)
                .side(side)
                .quantity(BigDecimal.ONE)
                .dollarAmount(new BigDecimal(amount))
                .beta(beta == null ? null : new BigDecimal(beta))
                .build();
    }
}
