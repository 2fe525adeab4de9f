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
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Yahoo Finance chart endpoint. Unmetered, venue aware through listing suffixes, and the only
 * source of daily closes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class YahooMarketDataProvider implements MarketDataProvider {

    public static final String NAME = "yahoo";

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; globalai-allocator/1.0)";
    private static final BigDecimal PENCE_PER_POUND = BigDecimal.valueOf(100);

    private final MarketDataHttpClient httpClient;
    private final MarketDataProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return properties.provider(NAME)
                .map(MarketDataProperties.Provider::getBaseUrl)
                .filter(url -> !url.isBlank())
                .isPresent();
    }

    @Override
    public ProviderQuote fetchQuote(QuoteRequest request) {
        String symbol = request.symbol();
        JsonNode result = chart(symbol, properties.getHistoryRange());
        JsonNode meta = result.path("meta");

        String currency = JsonValues.text(meta, "currency");
        boolean pence = "GBp".equals(currency) || "GBX".equalsIgnoreCase(currency);

        Fundamentals fundamentals = Fundamentals.builder()
                .fiftyTwoWeekHigh(toPounds(JsonValues.decimal(meta, "fiftyTwoWeekHigh"), pence))
                .fiftyTwoWeekLow(toPounds(JsonValues.decimal(meta, "fiftyTwoWeekLow"), pence))
                .volume(JsonValues.longValue(meta, "regularMarketVolume"))
                .build();

        String displayName = JsonValues.text(meta, "longName");
        if (displayName == null) {
            displayName = JsonValues.text(meta, "shortName");
        }

        return ProviderQuote.builder()
                .symbol(symbol)
                .displayName(displayName)
                .price(toPounds(JsonValues.decimal(meta, "regularMarketPrice"), pence))
                .currency(pence ? "GBP" : currency)
                .fundamentals(fundamentals)
                .closes(closes(result))
                .build();
    }

    @Override
    public List<BigDecimal> fetchCloses(String symbol) {
        return closes(chart(symbol, properties.getHistoryRange()));
    }

    @Override
    public BigDecimal fetchFxRate(String base, String quote) {
        JsonNode meta = chart(base + quote + "=X", "1d").path("meta");
        return JsonValues.decimal(meta, "regularMarketPrice");
    }

    private JsonNode chart(String symbol, String range) {
        String baseUrl = properties.provider(NAME)
                .map(MarketDataProperties.Provider::getBaseUrl)
                .orElseThrow(() -> new MarketDataProviderException(NAME, "Yahoo is not configured"));
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment("v8", "finance", "chart", symbol)
                .queryParam("range", range)
                .queryParam("interval", "1d")
                .build()
                .encode()
                .toUri();
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        String body = httpClient.get(NAME, uri, headers);
        if (body == null || body.isBlank()) {
            throw new MarketDataProviderException(NAME, "empty Yahoo response for " + symbol);
        }
        if (body.startsWith("Too Many Requests")) {
            throw new ProviderRateLimitedException(NAME, "Yahoo rate limit");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarketDataProviderException(NAME, "malformed Yahoo response for " + symbol, e);
        }
        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new MarketDataProviderException(NAME, "Yahoo error for " + symbol + ": " + error.path("description").asText());
        }
        JsonNode result = chart.path("result");
        if (!result.isArray() || result.isEmpty()) {
            throw new MarketDataProviderException(NAME, "Yahoo returned no chart for " + symbol);
        }
        return result.get(0);
    }

    private List<BigDecimal> closes(JsonNode result) {
        JsonNode closeNode = result.path("indicators").path("quote").path(0).path("close");
        List<BigDecimal> closes = new ArrayList<>();
        if (!closeNode.isArray()) {
            return closes;
        }
        for (JsonNode value : closeNode) {
            closes.add(value.isNumber() ? value.decimalValue() : null);
        }
        return closes;
    }

    private BigDecimal toPounds(BigDecimal value, boolean pence) {
        if (value == null || !pence) {
            return value;
        }
        return value.divide(PENCE_PER_POUND, 6, RoundingMode.HALF_UP);
    }
}
