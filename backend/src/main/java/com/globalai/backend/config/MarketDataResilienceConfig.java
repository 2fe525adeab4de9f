package com.globalai.backend.config;

import com.globalai.backend.exception.ProviderRateLimitedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class MarketDataResilienceConfig {

    @Bean
    public CircuitBreakerRegistry marketDataCircuitBreakerRegistry(
            @Value("${resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        // rate limiting is handled by the cooldown store, it must not also trip the breaker
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(slidingWindowSize)
                .ignoreExceptions(ProviderRateLimitedException.class)
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public RateLimiterRegistry marketDataRateLimiterRegistry(MarketDataProperties properties) {
        RateLimiterRegistry registry = RateLimiterRegistry.ofDefaults();
        for (MarketDataProperties.Provider provider : properties.getProviders()) {
            RateLimiterConfig config = RateLimiterConfig.custom()
                    .limitRefreshPeriod(Duration.ofSeconds(1))
                    .limitForPeriod(provider.getLimitPerSecond())
                    .timeoutDuration(Duration.ZERO)
                    .build();
            registry.rateLimiter(provider.getName(), config);
        }
        return registry;
    }

    @Bean
    public IntervalFunction providerCooldownBackoff(MarketDataProperties properties) {
        MarketDataProperties.Cooldown cooldown = properties.getCooldown();
        return IntervalFunction.ofExponentialBackoff(cooldown.getBase(), 2.0, cooldown.getMax());
    }
}
