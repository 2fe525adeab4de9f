package com.globalai.backend.service.marketdata;

import com.globalai.backend.model.PriceSnapshot;
import com.globalai.backend.model.SnapshotSource;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class MarketDataChainIntegrationTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    static {
        wireMock.start();
    }

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("market-data.providers[0].name", () -> "fmp");
        registry.add("market-data.providers[0].priority", () -> "10");
        registry.add("market-data.providers[0].base-url", () -> "http://localhost:" + wireMock.port() + "/stable");
        registry.add("market-data.providers[0].api-key", () -> "test-key");
        registry.add("market-data.providers[0].capabilities", () -> "QUOTE,FUNDAMENTALS,FX");
        registry.add("market-data.providers[1].name", () -> "yahoo");
        registry.add("market-data.providers[1].priority", () -> "20");
        registry.add("market-data.providers[1].base-url", () -> "http://localhost:" + wireMock.port());
        registry.add("market-data.providers[1].capabilities", () -> "QUOTE,HISTORY,FX,VENUE_AWARE");
        registry.add("brokers.alpaca.api-key", () -> "");
        registry.add("brokers.swissquote.api-key", () -> "");
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @Autowired
    private MarketDataFetcher fetcher;

    @Autowired
    private MarketDataCache cache;

    @Autowired
    private ProviderCooldownStore cooldownStore;

    @Autowired
    private ProviderChain providerChain;

    @BeforeEach
    void reset() {
        wireMock.resetAll();
        cache.clear();
        cooldownStore.clear();
    }

    @Test
    void chainFollowsConfiguredPriority() {
        assertThat(providerChain.names()).containsExactly("fmp", "yahoo");
    }

    @Test
    void rateLimitedPrimaryFallsBackAndStaysSkipped() {
        wireMock.stubFor(get(urlPathEqualTo("/stable/quote")).willReturn(aResponse().withStatus(429)));
        stubYahoo("NVDA", "870.0");
        stubYahoo("MSFT", "415.0");

        PriceSnapshot nvda = fetcher.priceOf("NVDA");
        PriceSnapshot msft = fetcher.priceOf("MSFT");

        assertThat(nvda.provider()).isEqualTo("yahoo");
        assertThat(nvda.source()).isEqualTo(SnapshotSource.PROVIDER);
        assertThat(nvda.sixMonthReturn()).isEqualTo(8.75);
        assertThat(msft.provider()).isEqualTo("yahoo");
        wireMock.verify(1, getRequestedFor(urlPathEqualTo("/stable/quote")));
    }

    @Test
    void everyProviderDownYieldsSyntheticSnapshot() {
        wireMock.stubFor(get(urlPathEqualTo("/stable/quote")).willReturn(serverError()));
        wireMock.stubFor(get(urlPathMatching("/v8/finance/chart/.*")).willReturn(serverError()));

        PriceSnapshot snapshot = fetcher.priceOf("GOOGL");

        assertThat(snapshot.source()).isEqualTo(SnapshotSource.SYNTHETIC);
        assertThat(snapshot.degraded()).isTrue();
        assertThat(snapshot.price()).isEqualByComparingTo("142.80");
    }

    private void stubYahoo(String symbol, String price) {
        wireMock.stubFor(get(urlPathEqualTo("/v8/finance/chart/" + symbol))
                .willReturn(okJson("{\"chart\":{\"result\":[{\"meta\":{\"currency\":\"USD\",\"regularMarketPrice\":" + price + "},"
                        + "\"indicators\":{\"quote\":[{\"close\":[800.0, " + price + "]}]}}],\"error\":null}}")));
    }
}
