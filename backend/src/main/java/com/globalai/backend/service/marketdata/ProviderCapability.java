package com.globalai.backend.service.marketdata;

public enum ProviderCapability {
    QUOTE,
    FUNDAMENTALS,
    HISTORY,
    FX,
    // accepts listing-specific symbols such as ASML.AS
    VENUE_AWARE
}
