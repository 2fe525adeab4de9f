package com.globalai.backend.service.allocation;

import com.globalai.backend.config.AllocationProperties;
import com.globalai.backend.model.AllocationResult;
import com.globalai.backend.model.ExposureMetrics;
import com.globalai.backend.model.Order;
import com.globalai.backend.model.OrderSide;
import com.globalai.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Service
@RequiredArgsConstructor
public class PortfolioMetricsService {

    private static final BigDecimal DEFAULT_BETA = BigDecimal.ONE;

    private final AllocationProperties allocationProperties;

    public ExposureMetrics exposure(AllocationResult result) {
        BigDecimal longExposure = BigDecimal.ZERO;
        BigDecimal shortExposure = BigDecimal.ZERO;
        BigDecimal betaTotal = BigDecimal.ZERO;
        BigDecimal capital = result.allocatedCapital();
        boolean hasCapital = MoneyUtils.isPositive(capital);

        for (Order order : result.orders()) {
            BigDecimal amount = order.dollarAmount();
            boolean sell = order.side() == OrderSide.SELL;
            if (sell) {
                shortExposure = shortExposure.add(amount);
            } else {
                longExposure = longExposure.add(amount);
            }
            if (hasCapital) {
                // shorts reduce portfolio beta
                BigDecimal weight = amount.divide(capital, 8, RoundingMode.HALF_UP);
                BigDecimal beta = order.beta() != null ? order.beta() : DEFAULT_BETA;
                betaTotal = sell ? betaTotal.subtract(weight.multiply(beta)) : betaTotal.add(weight.multiply(beta));
            }
        }

        BigDecimal margin = BigDecimal.valueOf(allocationProperties.getShortMarginRequirement());
        BigDecimal shortMargin = shortExposure.multiply(margin);
        BigDecimal net = longExposure.subtract(shortExposure);
        BigDecimal gross = longExposure.add(shortExposure);

        return ExposureMetrics.builder()
                .longExposure(MoneyUtils.scale(longExposure))
                .shortExposure(MoneyUtils.scale(shortExposure.negate()))
                .netExposure(MoneyUtils.scale(net))
                .grossExposure(MoneyUtils.scale(gross))
                .longExposurePercent(percent(longExposure, capital))
                .shortExposurePercent(percent(shortExposure.negate(), capital))
                .netExposurePercent(percent(net, capital))
                .grossExposurePercent(percent(gross, capital))
                .shortMargin(MoneyUtils.scale(shortMargin))
                .netCapitalRequired(MoneyUtils.scale(longExposure.subtract(shortExposure).add(shortMargin)))
                .portfolioBeta(betaTotal.setScale(2, RoundingMode.HALF_UP))
                .build();
    }

    private BigDecimal percent(BigDecimal amount, BigDecimal capital) {
        if (!MoneyUtils.isPositive(capital)) {
            return BigDecimal.ZERO.setScale(1, RoundingMode.HALF_UP);
        }
        return amount.multiply(MoneyUtils.HUNDRED).divide(capital, 1, RoundingMode.HALF_UP);
    }
}
