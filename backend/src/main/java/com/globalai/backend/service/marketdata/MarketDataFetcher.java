package com.globalai.backend.service.marketdata;

import com.globalai.backend.config.MarketDataProperties;
import com.globalai.backend.exception.MarketDataProviderException;
import com.globalai.backend.exception.PriceUnavailableException;
import com.globalai.backend.exception.ProviderRateLimitedException;
import com.globalai.backend.model.Fundamentals;
import com.globalai.backend.model.FxRate;
import com.globalai.backend.model.PriceSnapshot;
import com.globalai.backend.model.SnapshotSource;
import com.globalai.backend.util.MoneyUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Resolves price snapshots and FX rates: cache first, then the provider chain in priority order,
 * then synthetic demo data. Provider failures never escape; only an expired caller deadline does.
 */
@Slf4j
@Service
public class MarketDataFetcher {

    private final ProviderChain providerChain;
    private final MarketDataCache cache;
    private final ProviderCooldownStore cooldownStore;
    private final SyntheticSnapshotFactory syntheticSnapshotFactory;
    private final Executor marketDataExecutor;
    private final MarketDataProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public MarketDataFetcher(ProviderChain providerChain,
                             MarketDataCache cache,
                             ProviderCooldownStore cooldownStore,
                             SyntheticSnapshotFactory syntheticSnapshotFactory,
                             @Qualifier("marketDataExecutor") Executor marketDataExecutor,
                             MarketDataProperties properties,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.providerChain = providerChain;
        this.cache = cache;
        this.cooldownStore = cooldownStore;
        this.syntheticSnapshotFactory = syntheticSnapshotFactory;
        this.marketDataExecutor = marketDataExecutor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public PriceSnapshot priceOf(String ticker) {
        return fetch(QuoteRequest.of(ticker));
    }

    public PriceSnapshot fetch(QuoteRequest request) {
        return fetch(request, newDeadline());
    }

    public FetchDeadline newDeadline() {
        return FetchDeadline.after(properties.getDefaultDeadline(), clock);
    }

    public PriceSnapshot fetch(QuoteRequest request, FetchDeadline deadline) {
        String key = request.cacheKey();
        Optional<PriceSnapshot> cached = cache.prices().get(key);
        if (cached.isPresent()) {
            countFallback("cache");
            return cached.get().fromCache();
        }

        Optional<Fundamentals> knownFundamentals = cache.fundamentals().get(key);
        QuoteRequest effective = knownFundamentals.filter(Fundamentals::hasValuationRatios).isPresent()
                ? request.withoutFundamentals()
                : request;

        Optional<Hit<ProviderQuote>> hit = walk(providerChain.forQuote(effective), request.symbol(), deadline, descriptor -> {
            ProviderQuote quote = descriptor.provider().fetchQuote(effective);
            if (quote == null || !quote.isComplete()) {
                throw new MarketDataProviderException(descriptor.name(), "incomplete quote payload for " + request.symbol());
            }
            return quote;
        });

        if (hit.isEmpty()) {
            if (deadline.isExpired()) {
                throw new PriceUnavailableException((deadline.isCancelled() ? "Request cancelled" : "Deadline reached")
                        + " before " + request.symbol() + " could be priced");
            }
            log.warn("All market data providers exhausted for {}, using synthetic snapshot", request.symbol());
            countFallback("synthetic");
            return syntheticSnapshotFactory.snapshot(request);
        }

        ProviderQuote quote = hit.get().value();
        Fundamentals fundamentals = quote.fundamentals() != null ? quote.fundamentals() : Fundamentals.builder().build();
        Fundamentals merged = fundamentals.mergedWith(knownFundamentals.orElse(null));
        if (effective.includeFundamentals()) {
            cache.fundamentals().put(key, merged);
        }

        PriceSnapshot snapshot = PriceSnapshot.builder()
                .ticker(request.ticker())
                .symbol(request.symbol())
                .displayName(quote.displayName() != null ? quote.displayName() : request.ticker())
                .price(MoneyUtils.scale(quote.price()))
                .currency(resolveCurrency(quote, request))
                .asOf(clock.instant())
                .source(SnapshotSource.PROVIDER)
                .provider(hit.get().descriptor().name())
                .degraded(false)
                .sixMonthReturn(sixMonthReturn(quote, hit.get().descriptor(), request.symbol(), deadline))
                .fundamentals(merged)
                .build();
        cache.prices().put(key, snapshot);
        return snapshot;
    }

    /**
     * Fetches every request concurrently on the market data pool and joins the results in request
     * order. A slot is empty when its pipeline failed, missed the deadline or was cancelled.
     * Cancelling the deadline interrupts pipelines that are still running.
     */
    public List<Optional<PriceSnapshot>> fetchAll(List<QuoteRequest> requests, FetchDeadline deadline) {
        List<Future<PriceSnapshot>> futures = new ArrayList<>(requests.size());
        for (QuoteRequest request : requests) {
            FutureTask<PriceSnapshot> future = new FutureTask<>(() -> fetch(request, deadline));
            deadline.register(future);
            submit(future);
            futures.add(future);
        }
        List<Optional<PriceSnapshot>> results = new ArrayList<>(requests.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), requests.get(i), deadline));
        }
        return results;
    }

    public Optional<FxRate> fxRate(String base, String quote, FetchDeadline deadline) {
        String baseCode = base.toUpperCase(Locale.ROOT);
        String quoteCode = quote.toUpperCase(Locale.ROOT);
        if (baseCode.equals(quoteCode)) {
            return Optional.of(FxRate.identity(baseCode));
        }
        String pair = baseCode + quoteCode;
        Optional<FxRate> cached = cache.fxRates().get(pair);
        if (cached.isPresent()) {
            return Optional.of(cached.get().fromCache());
        }

        Optional<Hit<BigDecimal>> hit = walk(providerChain.supporting(ProviderCapability.FX), pair, deadline, descriptor -> {
            BigDecimal rate = descriptor.provider().fetchFxRate(baseCode, quoteCode);
            if (rate == null || rate.signum() <= 0) {
                throw new MarketDataProviderException(descriptor.name(), "no usable FX rate for " + pair);
            }
            return rate;
        });
        if (hit.isPresent()) {
            FxRate rate = new FxRate(baseCode, quoteCode, hit.get().value(), SnapshotSource.PROVIDER, hit.get().descriptor().name());
            cache.fxRates().put(pair, rate);
            return Optional.of(rate);
        }
        if (deadline.isExpired()) {
            return Optional.empty();
        }
        Optional<FxRate> synthetic = syntheticSnapshotFactory.fxRate(baseCode, quoteCode);
        if (synthetic.isPresent()) {
            log.warn("No provider quoted {}, using synthetic FX rate", pair);
            countFallback("synthetic");
        }
        return synthetic;
    }

    private double sixMonthReturn(ProviderQuote quote, ProviderDescriptor source, String symbol, FetchDeadline deadline) {
        if (quote.closes() != null && !quote.closes().isEmpty()) {
            return ReturnCalculator.sixMonthReturn(quote.closes());
        }
        List<ProviderDescriptor> historyProviders = providerChain.supporting(ProviderCapability.HISTORY).stream()
                .filter(descriptor -> !descriptor.name().equals(source.name()))
                .toList();
        return walk(historyProviders, symbol, deadline, descriptor -> descriptor.provider().fetchCloses(symbol))
                .map(history -> ReturnCalculator.sixMonthReturn(history.value()))
                .orElse(0.0);
    }

    private <T> Optional<Hit<T>> walk(List<ProviderDescriptor> providers, String subject, FetchDeadline deadline,
                                      Function<ProviderDescriptor, T> call) {
        for (ProviderDescriptor descriptor : providers) {
            if (deadline.isExpired()) {
                log.debug("Deadline reached before {} could try {}", subject, descriptor.name());
                return Optional.empty();
            }
            if (cooldownStore.isCoolingDown(descriptor.name())) {
                log.debug("Skipping {} for {}: cooling down", descriptor.name(), subject);
                continue;
            }
            try {
                T value = deadline.bind(() -> call.apply(descriptor));
                cooldownStore.reset(descriptor.name());
                return Optional.of(new Hit<>(descriptor, value));
            } catch (ProviderRateLimitedException e) {
                cooldownStore.registerRateLimit(descriptor.name(), e.getRetryAfter());
            } catch (MarketDataProviderException e) {
                log.warn("Provider {} failed for {}: {}", descriptor.name(), subject, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Provider {} returned an unusable answer for {}: {}", descriptor.name(), subject, e.toString());
            }
        }
        return Optional.empty();
    }

    private void submit(FutureTask<PriceSnapshot> task) {
        try {
            marketDataExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Market data pool saturated, fetching on caller thread");
            task.run();
        }
    }

    private Optional<PriceSnapshot> await(Future<PriceSnapshot> future, QuoteRequest request, FetchDeadline deadline) {
        try {
            return Optional.ofNullable(future.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Quote for {} missed the request deadline", request.symbol());
            return Optional.empty();
        } catch (CancellationException e) {
            log.warn("Quote for {} cancelled{}", request.symbol(), deadline.isCancelled() ? " with its request" : "");
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Quote for {} failed: {}", request.symbol(), cause.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Optional.empty();
        }
    }

    private String resolveCurrency(ProviderQuote quote, QuoteRequest request) {
        if (quote.currency() != null && !quote.currency().isBlank()) {
            return quote.currency().toUpperCase(Locale.ROOT);
        }
        return request.currency() != null ? request.currency() : "USD";
    }

    private void countFallback(String kind) {
        meterRegistry.counter("market_data_fallback_total", "kind", kind).increment();
    }

    private record Hit<T>(ProviderDescriptor descriptor, T value) {
    }
}
