package com.globalai.backend.service.strategy;

import com.globalai.backend.config.AllocationProperties;
import com.globalai.backend.exception.NotFoundException;
import com.globalai.backend.exception.StrategyValidationException;
import com.globalai.backend.model.PositionSide;
import com.globalai.backend.model.StrategyVersion;
import com.globalai.backend.model.TargetPosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyPositionStoreTest {

    private StrategyPositionStore store;

    @BeforeEach
    void setUp() {
        store = new StrategyPositionStore(new AllocationProperties());
        store.init();
    }

    @Test
    void defaultStrategyIsLoadedFromClasspath() {
        assertThat(store.defaultStrategy().id()).isEqualTo("global-ai-long-short");
        assertThat(store.ids()).containsExactly("global-ai-long-short");
    }

    @Test
    void newVersionBecomesLatestWhileOldVersionStaysAddressable() {
        StrategyVersion v1 = store.latest("global-ai-long-short");
        store.register(longOnly("global-ai-long-short", 2));

        assertThat(store.latest("global-ai-long-short").version()).isEqualTo(2);
        assertThat(store.version("global-ai-long-short", 1)).isSameAs(v1);
    }

    @Test
    void registeredVersionIsNeverReplaced() {
        assertThatThrownBy(() -> store.register(longOnly("global-ai-long-short", 1)))
                .isInstanceOf(StrategyValidationException.class)
                .hasMessageContaining("already registered");
        assertThat(store.version("global-ai-long-short", 1).positions()).hasSize(10);
    }

    @Test
    void unknownIdOrVersionIsNotFound() {
        assertThat(store.find("missing")).isEmpty();
        assertThatThrownBy(() -> store.latest("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.version("global-ai-long-short", 7)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void startupFailsWhenDefaultStrategyIsAbsent() {
        AllocationProperties properties = new AllocationProperties();
        properties.setDefaultStrategy("does-not-exist");
        StrategyPositionStore misconfigured = new StrategyPositionStore(properties);

        assertThatThrownBy(misconfigured::init)
                .isInstanceOf(StrategyValidationException.class)
                .hasMessageContaining("does-not-exist");
    }

    @Test
    void summaryReportsPortfolioWeights() {
        StrategySummary summary = StrategySummary.of(store.defaultStrategy());

        assertThat(summary.longCount()).isEqualTo(5);
        assertThat(summary.shortCount()).isEqualTo(5);
        assertThat(summary.markets()).containsExactly("ASIA", "EU", "US");
        assertThat(summary.averageConfidence()).isEqualTo(83.5);
        assertThat(summary.positions().get(0).portfolioWeight()).isEqualByComparingTo("0.15");
    }

    private StrategyVersion longOnly(String id, int version) {
        return StrategyVersion.builder()
                .id(id)
                .version(version)
                .baseCurrency("USD")
                .longShare(BigDecimal.ONE)
                .shortShare(BigDecimal.ZERO)
                .positions(List.of(TargetPosition.builder()
                        .ticker("NVDA")
                        .side(PositionSide.LONG)
                        .weight(BigDecimal.ONE)
                        .build()))
                .build();
    }
}
