package com.globalai.backend.service.marketdata;

import com.globalai.backend.exception.MarketDataProviderException;
import com.globalai.backend.exception.ProviderRateLimitedException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Single-attempt GET against a market data provider, throttled by that provider's rate limiter
 * and guarded by its circuit breaker. Never retries.
 */
@Slf4j
@Component
public class MarketDataHttpClient {

    private static final Pattern API_KEY = Pattern.compile("(?i)(apikey|api_key|token)=[^&\\s\"]*");

    private final RestTemplate marketDataRestTemplate;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public MarketDataHttpClient(@Qualifier("marketDataRestTemplate") RestTemplate marketDataRestTemplate,
                                CircuitBreakerRegistry circuitBreakerRegistry,
                                RateLimiterRegistry rateLimiterRegistry,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.marketDataRestTemplate = marketDataRestTemplate;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.rateLimiterRegistry = rateLimiterRegistry;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public String get(String provider, URI uri) {
        return get(provider, uri, new HttpHeaders());
    }

    public String get(String provider, URI uri, HttpHeaders headers) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        Supplier<String> supplier = () -> doRequest(provider, uri, headers);
        try {
            Supplier<String> decorated = CircuitBreaker.decorateSupplier(circuitBreakerRegistry.circuitBreaker(provider), supplier);
            decorated = RateLimiter.decorateSupplier(rateLimiterRegistry.rateLimiter(provider), decorated);
            String body = decorated.get();
            status = "success";
            return body;
        } catch (CallNotPermittedException e) {
            status = "circuit_open";
            throw new MarketDataProviderException(provider, provider + " circuit breaker open", e);
        } catch (RequestNotPermitted e) {
            status = "throttled";
            throw new MarketDataProviderException(provider, provider + " local request limit reached", e);
        } catch (ProviderRateLimitedException e) {
            status = "rate_limited";
            throw e;
        } finally {
            sample.stop(Timer.builder("market_data_call_latency")
                    .tag("provider", provider)
                    .tag("status", status)
                    .register(meterRegistry));
        }
    }

    private String doRequest(String provider, URI uri, HttpHeaders headers) {
        log.debug("{} GET {}", provider, mask(uri.toString()));
        try {
            ResponseEntity<String> response = marketDataRestTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            Duration retryAfter = parseRetryAfter(e.getResponseHeaders());
            throw new ProviderRateLimitedException(provider, provider + " rate limit (429)", retryAfter, e);
        } catch (HttpServerErrorException e) {
            int code = e.getStatusCode().value();
            throw new MarketDataProviderException(provider, provider + " server error (" + code + ")", code, e);
        } catch (HttpClientErrorException e) {
            int code = e.getStatusCode().value();
            throw new MarketDataProviderException(provider, provider + " rejected request (" + code + ")", code, e);
        } catch (ResourceAccessException e) {
            throw new MarketDataProviderException(provider, provider + " unreachable: " + mask(e.getMessage()), e);
        }
    }

    Duration parseRetryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        try {
            Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration wait = Duration.between(clock.instant(), at);
            return wait.isNegative() ? Duration.ZERO : wait;
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Retry-After header: {}", value);
            return null;
        }
    }

    public static String mask(String text) {
        if (text == null) {
            return null;
        }
        return API_KEY.matcher(text).replaceAll("$1=***");
    }
}
