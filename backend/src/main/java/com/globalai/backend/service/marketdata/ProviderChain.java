package com.globalai.backend.service.marketdata;

import com.globalai.backend.config.MarketDataProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ordered, immutable list of provider descriptors. Lower priority values are tried first.
 */
@Slf4j
public final class ProviderChain {

    private final List<ProviderDescriptor> descriptors;

    private ProviderChain(List<ProviderDescriptor> descriptors) {
        this.descriptors = descriptors.stream()
                .sorted(Comparator.comparingInt(ProviderDescriptor::priority))
                .toList();
    }

    public static ProviderChain of(List<ProviderDescriptor> descriptors) {
        return new ProviderChain(descriptors);
    }

    public static ProviderChain from(List<MarketDataProvider> providers, List<MarketDataProperties.Provider> settings) {
        Map<String, MarketDataProvider> byName = providers.stream()
                .collect(Collectors.toMap(provider -> provider.name().toLowerCase(Locale.ROOT), Function.identity()));
        List<ProviderDescriptor> descriptors = new ArrayList<>();
        for (MarketDataProperties.Provider setting : settings) {
            MarketDataProvider provider = byName.get(setting.getName().toLowerCase(Locale.ROOT));
            if (provider == null) {
                log.warn("No market data provider implementation named {}", setting.getName());
                continue;
            }
            if (!setting.isEnabled()) {
                log.info("Market data provider {} disabled by configuration", setting.getName());
                continue;
            }
            if (!provider.isConfigured()) {
                log.info("Market data provider {} skipped: missing API key", setting.getName());
                continue;
            }
            descriptors.add(new ProviderDescriptor(provider.name(), setting.getPriority(), setting.getCapabilities(), provider));
        }
        ProviderChain chain = new ProviderChain(descriptors);
        log.info("Market data provider chain: {}", chain.names());
        return chain;
    }

    /**
     * Providers able to quote the request. A listing symbol that differs from the canonical
     * ticker can only be quoted by venue-aware providers.
     */
    public List<ProviderDescriptor> forQuote(QuoteRequest request) {
        boolean venueSpecific = request.isVenueSpecific();
        return descriptors.stream()
                .filter(descriptor -> descriptor.supports(ProviderCapability.QUOTE))
                .filter(descriptor -> !venueSpecific || descriptor.supports(ProviderCapability.VENUE_AWARE))
                .toList();
    }

    public List<ProviderDescriptor> supporting(ProviderCapability capability) {
        return descriptors.stream()
                .filter(descriptor -> descriptor.supports(capability))
                .toList();
    }

    public List<ProviderDescriptor> descriptors() {
        return descriptors;
    }

    public List<String> names() {
        return descriptors.stream().map(ProviderDescriptor::name).toList();
    }
}
