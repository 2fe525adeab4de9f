package com.globalai.backend.service.marketdata;

import java.util.EnumSet;
import java.util.Set;

public record ProviderDescriptor(String name, int priority, Set<ProviderCapability> capabilities,
                                 MarketDataProvider provider) {

    public ProviderDescriptor {
        capabilities = capabilities == null || capabilities.isEmpty()
                ? EnumSet.noneOf(ProviderCapability.class)
                : EnumSet.copyOf(capabilities);
    }

    public boolean supports(ProviderCapability capability) {
        return capabilities.contains(capability);
    }
}
