package com.globalai.backend.controller;

import com.globalai.backend.exception.InvalidInputException;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.FxRate;
import com.globalai.backend.model.PriceSnapshot;
import com.globalai.backend.service.marketdata.FetchDeadline;
import com.globalai.backend.service.marketdata.MarketDataFetcher;
import com.globalai.backend.service.marketdata.QuoteRequest;
import com.globalai.backend.service.registry.SymbolRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
@Tag(name = "Market Data")
public class MarketDataController {

    private final MarketDataFetcher marketDataFetcher;
    private final SymbolRegistry symbolRegistry;

    @GetMapping("/snapshot")
    @Operation(summary = "Price snapshot for one ticker, optionally for a broker's listing")
    public ResponseEntity<PriceSnapshot> snapshot(@RequestParam String ticker,
                                                  @RequestParam(required = false) String broker) {
        return ResponseEntity.ok(marketDataFetcher.fetch(toRequest(ticker.trim(), broker)));
    }

    @GetMapping("/snapshots")
    @Operation(summary = "Price snapshots for several tickers, in request order")
    public ResponseEntity<List<PriceSnapshot>> snapshots(@RequestParam String tickers,
                                                         @RequestParam(required = false) String broker) {
        List<QuoteRequest> requests = Arrays.stream(tickers.split(","))
                .map(String::trim)
                .filter(ticker -> !ticker.isEmpty())
                .map(ticker -> toRequest(ticker, broker))
                .toList();
        if (requests.isEmpty()) {
            throw new InvalidInputException("At least one ticker is required");
        }
        FetchDeadline deadline = marketDataFetcher.newDeadline();
        List<PriceSnapshot> snapshots = marketDataFetcher.fetchAll(requests, deadline).stream()
                .map(snapshot -> snapshot.orElse(null))
                .toList();
        return ResponseEntity.ok(snapshots);
    }

    @GetMapping("/fx")
    @Operation(summary = "FX rate, units of quote currency per unit of base")
    public ResponseEntity<FxRate> fx(@RequestParam String base, @RequestParam String quote) {
        Optional<FxRate> rate = marketDataFetcher.fxRate(base, quote, marketDataFetcher.newDeadline());
        return rate.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
    }

    private QuoteRequest toRequest(String ticker, String broker) {
        if (broker == null || broker.isBlank()) {
            return QuoteRequest.of(ticker.toUpperCase(Locale.ROOT));
        }
        return QuoteRequest.forMapping(symbolRegistry.resolve(ticker, Broker.fromRequest(broker)));
    }
}
