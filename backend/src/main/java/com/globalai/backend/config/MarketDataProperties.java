package com.globalai.backend.config;

import com.globalai.backend.service.marketdata.ProviderCapability;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "market-data")
@Data
@Validated
public class MarketDataProperties {

    @Valid
    private List<Provider> providers = new ArrayList<>();

    @NotNull
    private Duration priceTtl = Duration.ofSeconds(120);

    @NotNull
    private Duration fundamentalsTtl = Duration.ofHours(6);

    @NotNull
    private Duration fxTtl = Duration.ofMinutes(5);

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(4);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(2);

    // applies to single lookups that carry no caller deadline
    @NotNull
    private Duration defaultDeadline = Duration.ofSeconds(10);

    @Min(1)
    private int maxConcurrency = 8;

    @Min(0)
    private int queueCapacity = 200;

    private String historyRange = "6mo";

    private Cooldown cooldown = new Cooldown();

    private Synthetic synthetic = new Synthetic();

    public Optional<Provider> provider(String name) {
        return providers.stream()
                .filter(provider -> provider.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    @Data
    public static class Provider {
        @NotBlank
        private String name;

        private int priority = 100;

        private boolean enabled = true;

        private String baseUrl;

        private String apiKey;

        private Set<ProviderCapability> capabilities = EnumSet.of(ProviderCapability.QUOTE);

        @Positive
        private int limitPerSecond = 5;
    }

    @Data
    public static class Cooldown {
        @NotNull
        private Duration base = Duration.ofSeconds(5);

        @NotNull
        private Duration max = Duration.ofMinutes(5);
    }

    @Data
    public static class Synthetic {
        // keyed by quoted symbol; bracket the key in YAML when it contains a dot
        private Map<String, BigDecimal> prices = new LinkedHashMap<>();

        // keyed by pair, e.g. USDEUR = units of EUR per USD
        private Map<String, BigDecimal> fxRates = new LinkedHashMap<>();
    }
}
