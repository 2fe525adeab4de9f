package com.globalai.backend.model;

public record BrokerSymbolMapping(
        String ticker,
        Broker broker,
        String brokerSymbol,
        String currency,
        String venue
) {}
