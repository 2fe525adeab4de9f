package com.globalai.backend.service.allocation;

import com.globalai.backend.config.AllocationProperties;
import com.globalai.backend.config.BrokerProperties;
import com.globalai.backend.exception.InvalidInputException;
import com.globalai.backend.model.AllocationResult;
import com.globalai.backend.model.AllocationWarning;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.Fundamentals;
import com.globalai.backend.model.FxRate;
import com.globalai.backend.model.Order;
import com.globalai.backend.model.OrderSide;
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
import com.globalai.backend.service.strategy.StrategyDefinitionLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AllocationEngineTest {

    private static final StrategyVersion STRATEGY = new StrategyDefinitionLoader()
            .read(new ClassPathResource("strategies/global-ai-long-short.json"));
    private static final SymbolRegistry REGISTRY = SymbolRegistry.load(new ClassPathResource("symbol-mappings.csv"));

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-05T14:00:00Z"), ZoneOffset.UTC);
    private final Map<String, PriceSnapshot> prices = new HashMap<>();
    private final Map<String, BigDecimal> fxRates = new HashMap<>();
    private MarketDataFetcher fetcher;
    private AllocationEngine engine;

    @BeforeEach
    void setUp() {
        fetcher = mock(MarketDataFetcher.class);
        when(fetcher.fetchAll(anyList(), any(FetchDeadline.class))).thenAnswer(invocation -> {
            List<QuoteRequest> requests = invocation.getArgument(0);
            return requests.stream()
                    .map(request -> Optional.ofNullable(prices.get(request.symbol())))
                    .toList();
        });
        when(fetcher.fxRate(anyString(), anyString(), any(FetchDeadline.class))).thenAnswer(invocation -> {
            String base = invocation.getArgument(0);
            String quote = invocation.getArgument(1);
            if (base.equals(quote)) {
                return Optional.of(FxRate.identity(base));
            }
            return Optional.ofNullable(fxRates.get(base + quote))
                    .map(rate -> new FxRate(base, quote, rate, SnapshotSource.PROVIDER, "fmp"));
        });

        BrokerProperties brokerProperties = new BrokerProperties();
        brokerProperties.getAlpaca().setFractionalShares(true);
        brokerProperties.getSwissquote().setFractionalShares(false);
        engine = new AllocationEngine(REGISTRY, fetcher, new AllocationProperties(), brokerProperties, clock);

        price("NVDA", "875.50", "USD");
        price("MSFT", "415.25", "USD");
        price("ASML", "950.80", "USD");
        price("GOOGL", "142.80", "USD");
        price("TSM", "105.30", "USD");
        price("HRB", "45.20", "USD");
        price("NWSA", "26.75", "USD");
        price("WPP", "45.60", "USD");
        price("UBER", "62.40", "USD");
        price("ASML.AS", "650.80", "EUR");
        price("TEP.PA", "285.40", "EUR");
        price("WPP.L", "8.50", "GBP");
        fxRates.put("USDEUR", new BigDecimal("0.92"));
        fxRates.put("USDGBP", new BigDecimal("0.79"));
    }

    @Test
    void alpacaAllocationUsesFractionalShares() {
        AllocationResult result = engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), STRATEGY, Broker.ALPACA);

        assertThat(result.allocatedCapital()).isEqualByComparingTo("50000");
        assertThat(result.aborted()).isFalse();
        assertThat(result.degraded()).isFalse();
        assertThat(result.orders()).extracting(Order::ticker)
                .containsExactly("NVDA", "MSFT", "ASML", "GOOGL", "TSM", "HRB", "NWSA", "WPP", "UBER");
        assertThat(quantities(result)).containsExactly(
                new BigDecimal("8.566533"), new BigDecimal("14.449127"), new BigDecimal("6.310475"),
                new BigDecimal("31.512605"), new BigDecimal("56.980056"), new BigDecimal("88.495575"),
                new BigDecimal("149.532710"), new BigDecimal("87.719298"), new BigDecimal("48.076923"));

        Order nvda = result.orders().get(0);
        assertThat(nvda.side()).isEqualTo(OrderSide.BUY);
        assertThat(nvda.dollarAmount()).isEqualByComparingTo("7500");
        assertThat(nvda.portfolioWeight()).isEqualByComparingTo("0.15");
        assertThat(nvda.brokerSymbol()).isEqualTo("NVDA");
        assertThat(result.orders().get(5).side()).isEqualTo(OrderSide.SELL);

        assertThat(total(result, OrderSide.BUY)).isEqualByComparingTo("30000");
        assertThat(total(result, OrderSide.SELL)).isEqualByComparingTo("15000");
        assertThat(total(result, OrderSide.BUY).add(total(result, OrderSide.SELL))).isEqualByComparingTo("45000");

        assertThat(result.warnings()).singleElement().satisfies(warning -> {
            assertThat(warning.ticker()).isEqualTo("TEP");
            assertThat(warning.code()).isEqualTo(WarningCode.UNMAPPED_INSTRUMENT);
            assertThat(warning.message()).contains("Teleperformance SE");
        });
    }

    @Test
    void splitsCapitalBySideShareAndWeight() {
        StrategyVersion strategy = StrategyVersion.builder()
                .id("four-names")
                .version(1)
                .baseCurrency("USD")
                .longShare(new BigDecimal("0.6"))
                .shortShare(new BigDecimal("0.4"))
                .positions(List.of(
                        position("NVDA", PositionSide.LONG, "0.5"),
                        position("MSFT", PositionSide.LONG, "0.5"),
                        position("HRB", PositionSide.SHORT, "0.5"),
                        position("UBER", PositionSide.SHORT, "0.5")))
                .build();
        List.of("NVDA", "MSFT", "HRB", "UBER").forEach(ticker -> price(ticker, "100", "USD"));

        AllocationResult result = engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), strategy, Broker.ALPACA);

        assertThat(result.warnings()).isEmpty();
        assertThat(result.orders()).extracting(Order::ticker, Order::side)
                .containsExactly(tuple("NVDA", OrderSide.BUY), tuple("MSFT", OrderSide.BUY),
                        tuple("HRB", OrderSide.SELL), tuple("UBER", OrderSide.SELL));
        assertThat(result.orders()).satisfiesExactly(
                order -> assertOrder(order, "15000", "150"),
                order -> assertOrder(order, "15000", "150"),
                order -> assertOrder(order, "10000", "100"),
                order -> assertOrder(order, "10000", "100"));
    }

    @Test
    void swissquoteAllocationUsesVenueListingsFxAndWholeShares() {
        AllocationResult result = engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), STRATEGY, Broker.SWISSQUOTE);

        assertThat(result.warnings()).isEmpty();
        assertThat(result.orders()).extracting(Order::brokerSymbol)
                .containsExactly("NVDA", "MSFT", "ASML.AS", "GOOGL", "TSM", "TEP.PA", "HRB", "NWSA", "WPP.L", "UBER");
        assertThat(quantities(result)).containsExactly(
                new BigDecimal("8"), new BigDecimal("14"), new BigDecimal("8"), new BigDecimal("31"), new BigDecimal("56"),
                new BigDecimal("16"), new BigDecimal("88"), new BigDecimal("149"), new BigDecimal("371"), new BigDecimal("48"));

        Order wpp = result.orders().get(8);
        assertThat(wpp.currency()).isEqualTo("GBP");
        assertThat(wpp.fxRate()).isEqualByComparingTo("0.79");
        assertThat(wpp.dollarAmount()).isEqualByComparingTo("4000");
        assertThat(wpp.venue()).isEqualTo("London Stock Exchange");

        verify(fetcher, times(1)).fxRate(eq("USD"), eq("EUR"), any(FetchDeadline.class));
    }

    @Test
    void amountsNeverExceedTheirSidePools() {
        AllocationResult result = engine.allocate(new BigDecimal("123456.789"), new BigDecimal("33.3"), STRATEGY, Broker.SWISSQUOTE);

        BigDecimal longTotal = total(result, OrderSide.BUY);
        BigDecimal shortTotal = total(result, OrderSide.SELL);
        assertThat(longTotal).isLessThanOrEqualTo(result.allocatedCapital().multiply(STRATEGY.longShare()));
        assertThat(shortTotal).isLessThanOrEqualTo(result.allocatedCapital().multiply(STRATEGY.shortShare()));
        assertThat(longTotal.add(shortTotal)).isLessThanOrEqualTo(result.allocatedCapital());
        assertThat(result.allocatedCapital().scale()).isEqualTo(4);
    }

    @Test
    void missingPriceDropsOnlyThatPosition() {
        prices.remove("NVDA");

        AllocationResult result = engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), STRATEGY, Broker.ALPACA);

        assertThat(result.aborted()).isFalse();
        assertThat(result.orders()).hasSize(8).extracting(Order::ticker).doesNotContain("NVDA");
        assertThat(result.orders().get(0).quantity()).isEqualByComparingTo("14.449127");
        assertThat(result.warnings()).extracting(AllocationWarning::ticker, AllocationWarning::code)
                .containsExactlyInAnyOrder(
                        tuple("TEP", WarningCode.UNMAPPED_INSTRUMENT),
                        tuple("NVDA", WarningCode.PRICE_UNAVAILABLE));
    }

    @Test
    void zeroPriceIsTreatedAsUnavailable() {
        price("MSFT", "0", "USD");

        AllocationResult result = engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), STRATEGY, Broker.ALPACA);

        assertThat(result.orders()).extracting(Order::ticker).doesNotContain("MSFT");
        assertThat(codesFor(result, "MSFT")).containsExactly(WarningCode.PRICE_UNAVAILABLE);
    }

    @Test
    void missingFxRateDropsForeignListing() {
        fxRates.remove("USDGBP");

        AllocationResult result = engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), STRATEGY, Broker.SWISSQUOTE);

        assertThat(result.orders()).hasSize(9).extracting(Order::ticker).doesNotContain("WPP");
        assertThat(codesFor(result, "WPP")).containsExactly(WarningCode.FX_UNAVAILABLE);
    }

    @Test
    void syntheticPriceKeepsOrderButFlagsDegradation() {
        prices.put("UBER", prices.get("UBER").toBuilder()
                .source(SnapshotSource.SYNTHETIC)
                .provider("synthetic")
                .degraded(true)
                .build());

        AllocationResult result = engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), STRATEGY, Broker.ALPACA);

        assertThat(result.degraded()).isTrue();
        assertThat(result.orders()).extracting(Order::ticker).contains("UBER");
        assertThat(result.orders()).filteredOn(Order::degraded).extracting(Order::ticker).containsExactly("UBER");
        assertThat(codesFor(result, "UBER")).containsExactly(WarningCode.DEGRADED_PRICE);
    }

    @Test
    void wholeShareRemainderBelowOneShareIsDropped() {
        StrategyVersion strategy = StrategyVersion.builder()
                .id("two-longs")
                .version(1)
                .baseCurrency("USD")
                .longShare(BigDecimal.ONE)
                .shortShare(BigDecimal.ZERO)
                .positions(List.of(
                        position("NVDA", PositionSide.LONG, "0.1"),
                        position("MSFT", PositionSide.LONG, "0.9")))
                .build();

        AllocationResult result = engine.allocate(new BigDecimal("5000"), new BigDecimal("100"), strategy, Broker.SWISSQUOTE);

        assertThat(result.aborted()).isFalse();
        assertThat(result.orders()).singleElement().satisfies(order -> {
            assertThat(order.ticker()).isEqualTo("MSFT");
            assertThat(order.quantity()).isEqualByComparingTo("10");
        });
        assertThat(codesFor(result, "NVDA")).containsExactly(WarningCode.QUANTITY_BELOW_MINIMUM);
    }

    @Test
    void tooManyDroppedPositionsAbortsTheAllocation() {
        List.of("NVDA", "MSFT", "ASML", "GOOGL", "TSM").forEach(prices::remove);

        AllocationResult result = engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), STRATEGY, Broker.ALPACA);

        assertThat(result.aborted()).isTrue();
        assertThat(result.orders()).isEmpty();
        assertThat(result.warnings()).extracting(AllocationWarning::code).contains(WarningCode.ALLOCATION_ABORTED);
        assertThat(result.warnings()).filteredOn(warning -> warning.code() == WarningCode.PRICE_UNAVAILABLE).hasSize(5);
    }

    @Test
    void zeroPercentYieldsEmptyResultWithoutFetching() {
        AllocationResult result = engine.allocate(new BigDecimal("100000"), BigDecimal.ZERO, STRATEGY, Broker.ALPACA);

        assertThat(result.allocatedCapital()).isEqualByComparingTo("0");
        assertThat(result.orders()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        verifyNoInteractions(fetcher);
    }

    @Test
    void invalidInputIsRejectedBeforeAnyFetch() {
        assertThatThrownBy(() -> engine.allocate(BigDecimal.ZERO, new BigDecimal("50"), STRATEGY, Broker.ALPACA))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("totalCapital");
        assertThatThrownBy(() -> engine.allocate(new BigDecimal("-1"), new BigDecimal("50"), STRATEGY, Broker.ALPACA))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> engine.allocate(new BigDecimal("100000"), new BigDecimal("100.01"), STRATEGY, Broker.ALPACA))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("allocationPercent");
        assertThatThrownBy(() -> engine.allocate(new BigDecimal("100000"), new BigDecimal("-5"), STRATEGY, Broker.ALPACA))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), null, Broker.ALPACA))
                .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(fetcher);
    }

    @Test
    void sameInputsProduceSameResult() {
        AllocationResult first = engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), STRATEGY, Broker.SWISSQUOTE);
        AllocationResult second = engine.allocate(new BigDecimal("100000"), new BigDecimal("50"), STRATEGY, Broker.SWISSQUOTE);

        assertThat(second).isEqualTo(first);
    }

    private void price(String symbol, String price, String currency) {
        prices.put(symbol, PriceSnapshot.builder()
                .ticker(symbol.contains(".") ? symbol.substring(0, symbol.indexOf('.')) : symbol)
                .symbol(symbol)
                .displayName(symbol)
                .price(new BigDecimal(price))
                .currency(currency)
                .asOf(clock.instant())
                .source(SnapshotSource.PROVIDER)
                .provider("fmp")
                .fundamentals(Fundamentals.builder().beta(new BigDecimal("1.2")).build())
                .build());
    }

    private TargetPosition position(String ticker, PositionSide side, String weight) {
        return TargetPosition.builder()
                .ticker(ticker)
                .displayName(ticker)
                .side(side)
                .weight(new BigDecimal(weight))
                .build();
    }

    private void assertOrder(Order order, String dollarAmount, String quantity) {
        assertThat(order.dollarAmount()).isEqualByComparingTo(dollarAmount);
        assertThat(order.quantity()).isEqualByComparingTo(quantity);
    }

    private List<BigDecimal> quantities(AllocationResult result) {
        return result.orders().stream().map(Order::quantity).toList();
    }

    private BigDecimal total(AllocationResult result, OrderSide side) {
        return result.orders().stream()
                .filter(order -> order.side() == side)
                .map(Order::dollarAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private List<WarningCode> codesFor(AllocationResult result, String ticker) {
        return result.warnings().stream()
                .filter(warning -> ticker.equals(warning.ticker()))
                .map(AllocationWarning::code)
                .toList();
    }
}
