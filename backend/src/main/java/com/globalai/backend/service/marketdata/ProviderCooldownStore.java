package com.globalai.backend.service.marketdata;

import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider rate-limit cooldowns. Consecutive rate-limit signals grow the window
 * exponentially up to {@code maxBackoff}; a successful call resets it.
 */
@Slf4j
public class ProviderCooldownStore {

    private final ConcurrentHashMap<String, CooldownState> states = new ConcurrentHashMap<>();
    private final IntervalFunction backoff;
    private final Duration maxBackoff;
    private final Clock clock;

    public ProviderCooldownStore(IntervalFunction backoff, Duration maxBackoff, Clock clock) {
        this.backoff = backoff;
        this.maxBackoff = maxBackoff;
        this.clock = clock;
    }

    public boolean isCoolingDown(String provider) {
        CooldownState state = states.get(provider);
        return state != null && clock.instant().isBefore(state.until());
    }

    public Optional<Instant> cooldownUntil(String provider) {
        return Optional.ofNullable(states.get(provider))
                .map(CooldownState::until)
                .filter(until -> clock.instant().isBefore(until));
    }

    public Duration registerRateLimit(String provider, Optional<Duration> retryAfter) {
        CooldownState next = states.compute(provider, (key, previous) -> {
            int strikes = previous == null ? 1 : previous.strikes() + 1;
            Duration wait = Duration.ofMillis(backoff.apply(strikes));
            if (retryAfter.isPresent() && retryAfter.get().compareTo(wait) > 0) {
                wait = retryAfter.get();
            }
            if (wait.compareTo(maxBackoff) > 0) {
                wait = maxBackoff;
            }
            return new CooldownState(strikes, clock.instant().plus(wait), wait);
        });
        log.warn("Provider {} rate limited, cooling down for {}s (strike {})",
                provider, next.backoff().toSeconds(), next.strikes());
        return next.backoff();
    }

    public void reset(String provider) {
        states.remove(provider);
    }

    public void clear() {
        states.clear();
    }

    private record CooldownState(int strikes, Instant until, Duration backoff) {
    }
}
