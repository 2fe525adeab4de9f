package com.globalai.backend.service.strategy;

import com.globalai.backend.exception.StrategyValidationException;
import com.globalai.backend.model.PositionSide;
import com.globalai.backend.model.StrategyVersion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.core.io.ClassPathResource;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyDefinitionLoaderTest {

    private final StrategyDefinitionLoader loader = new StrategyDefinitionLoader();

    @Test
    void loadsBundledStrategyInDeclaredOrder() {
        List<StrategyVersion> strategies = loader.load("classpath*:strategies/*.json");

        assertThat(strategies).hasSize(1);
        StrategyVersion strategy = strategies.get(0);
        assertThat(strategy.id()).isEqualTo("global-ai-long-short");
        assertThat(strategy.version()).isEqualTo(1);
        assertThat(strategy.baseCurrency()).isEqualTo("USD");
        assertThat(strategy.longShare()).isEqualByComparingTo("0.6");
        assertThat(strategy.shortShare()).isEqualByComparingTo("0.4");
        assertThat(strategy.positions(PositionSide.LONG))
                .extracting(position -> position.ticker())
                .containsExactly("NVDA", "MSFT", "ASML", "GOOGL", "TSM");
        assertThat(strategy.positions(PositionSide.SHORT))
                .extracting(position -> position.ticker())
                .containsExactly("TEP", "HRB", "NWSA", "WPP", "UBER");
        assertThat(strategy.positions().get(0).weight()).isEqualByComparingTo(new BigDecimal("0.25"));
    }

    @ParameterizedTest
    @CsvSource({
            "weights-off.json, LONG weights sum to 0.9",
            "duplicate-ticker.json, duplicate ticker nvda",
            "empty-short-side.json, SHORT share is set but the side has no positions",
            "unknown-currency.json, unknown base currency XYZ",
            "truncated.json, Unreadable strategy definition"
    })
    void rejectsInvalidDefinitions(String file, String expectedMessage) {
        ClassPathResource resource = new ClassPathResource("strategies-invalid/" + file);

        assertThatThrownBy(() -> loader.read(resource))
                .isInstanceOf(StrategyValidationException.class)
                .hasMessageContaining(expectedMessage);
    }

    @Test
    void anyInvalidFileAbortsTheWholeLoad() {
        assertThatThrownBy(() -> loader.load("classpath*:strategies-invalid/*.json"))
                .isInstanceOf(StrategyValidationException.class);
    }
}
