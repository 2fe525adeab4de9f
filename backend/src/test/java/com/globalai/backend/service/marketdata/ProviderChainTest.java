package com.globalai.backend.service.marketdata;

import com.globalai.backend.config.MarketDataProperties;
import com.globalai.backend.support.StubMarketDataProvider;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderChainTest {

    @Test
    void ordersByPriorityAndSkipsDisabledOrUnknownProviders() {
        List<MarketDataProvider> providers = List.of(
                new StubMarketDataProvider("yahoo"),
                new StubMarketDataProvider("fmp"),
                new StubMarketDataProvider("polygon"));

        ProviderChain chain = ProviderChain.from(providers, List.of(
                setting("yahoo", 20, true, EnumSet.of(ProviderCapability.QUOTE, ProviderCapability.VENUE_AWARE)),
                setting("fmp", 10, true, EnumSet.of(ProviderCapability.QUOTE, ProviderCapability.FX)),
                setting("polygon", 5, false, EnumSet.of(ProviderCapability.QUOTE)),
                setting("alphavantage", 1, true, EnumSet.of(ProviderCapability.QUOTE))));

        assertThat(chain.names()).containsExactly("fmp", "yahoo");
    }

    @Test
    void skipsProvidersWithoutCredentials() {
        MarketDataProvider unconfigured = new StubMarketDataProvider("fmp") {
            @Override
            public boolean isConfigured() {
                return false;
            }
        };

        ProviderChain chain = ProviderChain.from(List.of(unconfigured),
                List.of(setting("fmp", 10, true, EnumSet.of(ProviderCapability.QUOTE))));

        assertThat(chain.descriptors()).isEmpty();
    }

    @Test
    void venueSpecificSymbolsOnlyGoToVenueAwareProviders() {
        ProviderChain chain = ProviderChain.of(List.of(
                new ProviderDescriptor("fmp", 10, EnumSet.of(ProviderCapability.QUOTE), new StubMarketDataProvider("fmp")),
                new ProviderDescriptor("yahoo", 20, EnumSet.of(ProviderCapability.QUOTE, ProviderCapability.VENUE_AWARE),
                        new StubMarketDataProvider("yahoo"))));

        assertThat(chain.forQuote(QuoteRequest.of("NVDA")))
                .extracting(ProviderDescriptor::name)
                .containsExactly("fmp", "yahoo");
        assertThat(chain.forQuote(new QuoteRequest("ASML", "ASML.AS", "EUR", true)))
                .extracting(ProviderDescriptor::name)
                .containsExactly("yahoo");
    }

    private MarketDataProperties.Provider setting(String name, int priority, boolean enabled, EnumSet<ProviderCapability> capabilities) {
        MarketDataProperties.Provider provider = new MarketDataProperties.Provider();
        provider.setName(name);
        provider.setPriority(priority);
        provider.setEnabled(enabled);
        provider.setCapabilities(capabilities);
        return provider;
    }
}
