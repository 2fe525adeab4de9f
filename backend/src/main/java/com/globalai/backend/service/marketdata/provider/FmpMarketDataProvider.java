package com.globalai.backend.service.marketdata.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.globalai.backend.config.MarketDataProperties;
import com.globalai.backend.exception.MarketDataProviderException;
import com.globalai.backend.exception.ProviderRateLimitedException;
import com.globalai.backend.model.Fundamentals;
import com.globalai.backend.service.marketdata.MarketDataHttpClient;
import com.globalai.backend.service.marketdata.MarketDataProvider;
import com.globalai.backend.service.marketdata.ProviderQuote;
import com.globalai.backend.service.marketdata.QuoteRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.util.Optional;

/**
 * Financial Modeling Prep stable API. Metered: every call counts against the account quota, and
 * quota exhaustion is reported either as HTTP 429 or as an "Error Message" body.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FmpMarketDataProvider implements MarketDataProvider {

    public static final String NAME = "fmp";

    private final MarketDataHttpClient httpClient;
    private final MarketDataProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return settings()
                .filter(settings -> settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank())
                .filter(settings -> settings.getApiKey() != null && !settings.getApiKey().isBlank())
                .isPresent();
    }

    @Override
    public ProviderQuote fetchQuote(QuoteRequest request) {
        String symbol = request.symbol();
        JsonNode quote = firstRow(call("/quote", symbol), symbol);

        Fundamentals.FundamentalsBuilder fundamentals = Fundamentals.builder()
                .pe(JsonValues.decimal(quote, "pe"))
                .marketCap(JsonValues.decimal(quote, "marketCap"))
                .fiftyTwoWeekHigh(JsonValues.decimal(quote, "yearHigh"))
                .fiftyTwoWeekLow(JsonValues.decimal(quote, "yearLow"))
                .volume(JsonValues.longValue(quote, "volume"));

        if (request.includeFundamentals()) {
            addRatios(fundamentals, symbol);
            addBeta(fundamentals, symbol);
        }

        return ProviderQuote.builder()
                .symbol(symbol)
                .displayName(JsonValues.text(quote, "name"))
                .price(JsonValues.decimal(quote, "price"))
                .fundamentals(fundamentals.build())
                .build();
    }

    @Override
    public BigDecimal fetchFxRate(String base, String quote) {
        String pair = base + quote;
        JsonNode row = firstRow(call("/quote", pair), pair);
        return JsonValues.decimal(row, "price");
    }

    private void addRatios(Fundamentals.FundamentalsBuilder fundamentals, String symbol) {
        try {
            JsonNode ratios = firstRow(call("/ratios-ttm", symbol), symbol);
            fundamentals
                    .ps(JsonValues.decimal(ratios, "priceToSalesRatioTTM"))
                    .pb(JsonValues.decimal(ratios, "priceToBookRatioTTM"))
                    .evEbitda(JsonValues.decimal(ratios, "enterpriseValueMultipleTTM"));
        } catch (ProviderRateLimitedException e) {
            throw e;
        } catch (MarketDataProviderException e) {
            log.info("FMP ratios unavailable for {}: {}", symbol, e.getMessage());
        }
    }

    private void addBeta(Fundamentals.FundamentalsBuilder fundamentals, String symbol) {
        try {
            JsonNode profile = firstRow(call("/profile", symbol), symbol);
            fundamentals.beta(JsonValues.decimal(profile, "beta"));
        } catch (ProviderRateLimitedException e) {
            throw e;
        } catch (MarketDataProviderException e) {
            log.info("FMP profile unavailable for {}: {}", symbol, e.getMessage());
        }
    }

    private JsonNode call(String path, String symbol) {
        MarketDataProperties.Provider settings = settings()
                .orElseThrow(() -> new MarketDataProviderException(NAME, "FMP is not configured"));
        URI uri = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
                .path(path)
                .queryParam("symbol", symbol)
                .queryParam("apikey", settings.getApiKey())
                .build()
                .encode()
                .toUri();
        String body = httpClient.get(NAME, uri);
        if (body == null || body.isBlank()) {
            throw new MarketDataProviderException(NAME, "empty FMP response for " + symbol);
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            checkError(root, symbol);
            return root;
        } catch (JsonProcessingException e) {
            throw new MarketDataProviderException(NAME, "malformed FMP response for " + symbol, e);
        }
    }

    private void checkError(JsonNode root, String symbol) {
        if (!root.isObject() || !root.has("Error Message")) {
            return;
        }
        String message = root.path("Error Message").asText();
        if (message.contains("Limit Reach")) {
            throw new ProviderRateLimitedException(NAME, "FMP quota exhausted");
        }
        throw new MarketDataProviderException(NAME, "FMP error for " + symbol + ": " + MarketDataHttpClient.mask(message));
    }

    private JsonNode firstRow(JsonNode root, String symbol) {
        if (root.isArray() && !root.isEmpty()) {
            return root.get(0);
        }
        if (root.isObject() && !root.isEmpty()) {
            return root;
        }
        throw new MarketDataProviderException(NAME, "FMP returned no data for " + symbol);
    }

    private Optional<MarketDataProperties.Provider> settings() {
        return properties.provider(NAME);
    }
}
