package com.globalai.backend.config;

import com.globalai.backend.service.marketdata.MarketDataCache;
import com.globalai.backend.service.marketdata.MarketDataProvider;
import com.globalai.backend.service.marketdata.ProviderChain;
import com.globalai.backend.service.marketdata.ProviderCooldownStore;
import com.globalai.backend.service.marketdata.SyntheticSnapshotFactory;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class MarketDataConfig {

    @Bean
    public ProviderChain providerChain(List<MarketDataProvider> providers, MarketDataProperties properties) {
        return ProviderChain.from(providers, properties.getProviders());
    }

    @Bean
    public MarketDataCache marketDataCache(MarketDataProperties properties, Clock clock) {
        return new MarketDataCache(properties.getPriceTtl(), properties.getFundamentalsTtl(), properties.getFxTtl(), clock);
    }

    @Bean
    public ProviderCooldownStore providerCooldownStore(IntervalFunction providerCooldownBackoff,
                                                       MarketDataProperties properties,
                                                       Clock clock) {
        return new ProviderCooldownStore(providerCooldownBackoff, properties.getCooldown().getMax(), clock);
    }

    @Bean
    public SyntheticSnapshotFactory syntheticSnapshotFactory(MarketDataProperties properties) {
        MarketDataProperties.Synthetic synthetic = properties.getSynthetic();
        return new SyntheticSnapshotFactory(synthetic.getPrices(), synthetic.getFxRates());
    }
}
