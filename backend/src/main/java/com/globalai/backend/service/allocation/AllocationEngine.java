package com.globalai.backend.service.allocation;

import com.globalai.backend.config.AllocationProperties;
import com.globalai.backend.config.BrokerProperties;
import com.globalai.backend.exception.InvalidInputException;
import com.globalai.backend.exception.UnmappedInstrumentException;
import com.globalai.backend.model.AllocationResult;
import com.globalai.backend.model.AllocationWarning;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.BrokerSymbolMapping;
import com.globalai.backend.model.FxRate;
import com.globalai.backend.model.Order;
import com.globalai.backend.model.PositionSide;
import com.globalai.backend.model.PriceSnapshot;
import com.globalai.backend.model.SnapshotSource;
import com.globalai.backend.model.StrategyVersion;
import com.globalai.backend.model.TargetPosition;
import com.globalai.backend.model.WarningCode;
import com.globalai.backend.service.marketdata.FetchDeadline;
import com.globalai.backend.service.marketdata.MarketDataFetcher;
import com.globalai.backend.service.marketdata.QuoteRequest;
import com.globalai.backend.service.registry.SymbolRegistry;
import com.globalai.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns capital, an allocation percentage and a strategy into broker-ready orders. Per-position
 * problems drop the position with a warning; only invalid request input is thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AllocationEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SymbolRegistry symbolRegistry;
    private final MarketDataFetcher marketDataFetcher;
    private final AllocationProperties allocationProperties;
    private final BrokerProperties brokerProperties;
    private final Clock clock;

    public AllocationResult allocate(BigDecimal totalCapital, BigDecimal allocationPercent, StrategyVersion strategy, Broker broker) {
        return allocate(totalCapital, allocationPercent, strategy, broker,
                FetchDeadline.after(allocationProperties.getFetchDeadline(), clock));
    }

    public AllocationResult allocate(BigDecimal totalCapital, BigDecimal allocationPercent, StrategyVersion strategy,
                                     Broker broker, FetchDeadline deadline) {
        validate(totalCapital, allocationPercent, strategy, broker);

        BigDecimal allocatedCapital = MoneyUtils.floor(MoneyUtils.percentOf(totalCapital, allocationPercent));
        AllocationResult.AllocationResultBuilder result = AllocationResult.builder()
                .strategyId(strategy.id())
                .strategyVersion(strategy.version())
                .broker(broker)
                .baseCurrency(strategy.baseCurrency())
                .allocatedCapital(allocatedCapital);
        if (allocatedCapital.signum() == 0 || strategy.positions().isEmpty()) {
            return result.orders(List.of()).warnings(List.of()).build();
        }

        List<Candidate> candidates = plan(strategy, broker, allocatedCapital);

        List<QuoteRequest> requests = candidates.stream()
                .filter(Candidate::isMapped)
                .map(candidate -> QuoteRequest.forMapping(candidate.mapping()))
                .toList();
        List<Optional<PriceSnapshot>> snapshots = marketDataFetcher.fetchAll(requests, deadline);

        Map<String, Optional<FxRate>> fxRates = new HashMap<>();
        boolean fractional = brokerProperties.forBroker(broker).isFractionalShares();
        int quantityScale = fractional ? allocationProperties.getFractionalScale() : 0;

        List<Order> orders = new ArrayList<>();
        List<AllocationWarning> warnings = new ArrayList<>();
        int snapshotIndex = 0;
        for (Candidate candidate : candidates) {
            if (!candidate.isMapped()) {
                warnings.add(candidate.warning());
                continue;
            }
            Optional<PriceSnapshot> snapshot = snapshots.get(snapshotIndex++);
            TargetPosition position = candidate.position();
            if (snapshot.isEmpty() || !snapshot.get().hasUsablePrice()) {
                warnings.add(drop(position, WarningCode.PRICE_UNAVAILABLE,
                        "No usable price for " + candidate.mapping().brokerSymbol()));
                continue;
            }
            PriceSnapshot price = snapshot.get();
            String currency = price.currency() != null ? price.currency() : candidate.mapping().currency();
            Optional<FxRate> fx = fxRates.computeIfAbsent(currency,
                    code -> marketDataFetcher.fxRate(strategy.baseCurrency(), code, deadline));
            if (fx.isEmpty()) {
                warnings.add(drop(position, WarningCode.FX_UNAVAILABLE,
                        "No " + strategy.baseCurrency() + "/" + currency + " rate for " + candidate.mapping().brokerSymbol()));
                continue;
            }

            BigDecimal localAmount = candidate.dollarAmount().multiply(fx.get().rate());
            BigDecimal quantity = localAmount.divide(price.price(), quantityScale, RoundingMode.DOWN);
            if (quantity.signum() <= 0) {
                warnings.add(drop(position, WarningCode.QUANTITY_BELOW_MINIMUM,
                        candidate.dollarAmount().toPlainString() + " " + strategy.baseCurrency()
                                + " buys less than the minimum quantity of " + candidate.mapping().brokerSymbol()));
                continue;
            }

            boolean degraded = price.degraded() || fx.get().degraded();
            orders.add(Order.builder()
                    .ticker(position.ticker())
                    .displayName(position.displayName())
                    .brokerSymbol(candidate.mapping().brokerSymbol())
                    .venue(candidate.mapping().venue())
                    .side(position.side().toOrderSide())
                    .quantity(quantity)
                    .price(price.price())
                    .dollarAmount(candidate.dollarAmount())
                    .weight(position.weight())
                    .portfolioWeight(strategy.shareFor(position.side()).multiply(position.weight()))
                    .currency(currency)
                    .baseCurrency(strategy.baseCurrency())
                    .fxRate(fx.get().rate())
                    .rationale(position.rationale())
                    .priceSource(price.source())
                    .priceProvider(price.provider())
                    .degraded(degraded)
                    .beta(price.fundamentals() != null ? price.fundamentals().beta() : null)
                    .build());
            if (price.source() == SnapshotSource.SYNTHETIC) {
                warnings.add(new AllocationWarning(position.ticker(), WarningCode.DEGRADED_PRICE,
                        "Synthetic demo price used for " + candidate.mapping().brokerSymbol()));
            }
        }

        boolean degraded = orders.stream().anyMatch(Order::degraded);
        int total = strategy.positions().size();
        int dropped = total - orders.size();
        BigDecimal droppedRatio = BigDecimal.valueOf(dropped).divide(BigDecimal.valueOf(total), 6, RoundingMode.HALF_UP);
        if (droppedRatio.compareTo(BigDecimal.valueOf(allocationProperties.getMaxDroppedRatio())) > 0) {
            log.warn("Allocation for {} on {} aborted: {} of {} positions dropped", strategy.id(), broker, dropped, total);
            warnings.add(new AllocationWarning(null, WarningCode.ALLOCATION_ABORTED,
                    dropped + " of " + total + " positions could not be allocated"));
            return result.orders(List.of()).warnings(warnings).degraded(degraded).aborted(true).build();
        }

        log.info("Allocated {} {} of {} v{} on {}: {} orders, {} warnings{}",
                allocatedCapital.toPlainString(), strategy.baseCurrency(), strategy.id(), strategy.version(), broker,
                orders.size(), warnings.size(), degraded ? " (degraded)" : "");
        return result.orders(orders).warnings(warnings).degraded(degraded).aborted(false).build();
    }

    private List<Candidate> plan(StrategyVersion strategy, Broker broker, BigDecimal allocatedCapital) {
        Map<PositionSide, BigDecimal> remaining = new EnumMap<>(PositionSide.class);
        for (PositionSide side : PositionSide.values()) {
            remaining.put(side, allocatedCapital.multiply(strategy.shareFor(side)));
        }
        List<Candidate> candidates = new ArrayList<>();
        for (TargetPosition position : strategy.positions()) {
            BigDecimal pool = allocatedCapital.multiply(strategy.shareFor(position.side()));
            BigDecimal dollarAmount = MoneyUtils.min(MoneyUtils.floor(pool.multiply(position.weight())),
                    MoneyUtils.floor(remaining.get(position.side())));
            remaining.merge(position.side(), dollarAmount, BigDecimal::subtract);
            try {
                BrokerSymbolMapping mapping = symbolRegistry.resolve(position.instrument(), broker);
                candidates.add(new Candidate(position, dollarAmount, mapping, null));
            } catch (UnmappedInstrumentException e) {
                candidates.add(new Candidate(position, dollarAmount, null,
                        drop(position, WarningCode.UNMAPPED_INSTRUMENT, e.getMessage())));
            }
        }
        return candidates;
    }

    private AllocationWarning drop(TargetPosition position, WarningCode code, String message) {
        log.warn("Dropping {} from allocation: {} ({})", position.ticker(), code, message);
        return new AllocationWarning(position.ticker(), code, message);
    }

    private void validate(BigDecimal totalCapital, BigDecimal allocationPercent, StrategyVersion strategy, Broker broker) {
        if (totalCapital == null || totalCapital.signum() <= 0) {
            throw new InvalidInputException("totalCapital must be greater than zero");
        }
        if (allocationPercent == null || allocationPercent.signum() < 0 || allocationPercent.compareTo(HUNDRED) > 0) {
            throw new InvalidInputException("allocationPercent must be between 0 and 100");
        }
        if (strategy == null) {
            throw new InvalidInputException("strategy is required");
        }
        if (broker == null) {
            throw new InvalidInputException("broker is required");
        }
    }

    private record Candidate(TargetPosition position, BigDecimal dollarAmount, BrokerSymbolMapping mapping,
                             AllocationWarning warning) {

        boolean isMapped() {
            return mapping != null;
        }
    }
}
