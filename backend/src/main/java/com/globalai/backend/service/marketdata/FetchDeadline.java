package com.globalai.backend.service.marketdata;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Deadline and cancellation scope of one caller. Each request owns its own instance, so
 * cancelling it only affects the futures and connections registered here.
 */
public final class FetchDeadline {

    private static final ThreadLocal<FetchDeadline> CURRENT = new ThreadLocal<>();

    private final Instant deadline;
    private final Clock clock;
    private final List<Future<?>> inFlight = new CopyOnWriteArrayList<>();
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    private FetchDeadline(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static FetchDeadline after(Duration timeout, Clock clock) {
        return new FetchDeadline(clock.instant().plus(timeout), clock);
    }

    /**
     * Deadline of the provider call running on this thread, if any.
     */
    public static Optional<FetchDeadline> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public boolean isExpired() {
        return cancelled || !clock.instant().isBefore(deadline);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Duration remaining() {
        if (cancelled) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Runs {@code call} with this deadline bound to the current thread, so HTTP connections opened
     * inside it are bounded by {@link #remaining()} and closed on {@link #cancel()}.
     */
    public <T> T bind(Supplier<T> call) {
        FetchDeadline previous = CURRENT.get();
        CURRENT.set(this);
        try {
            return call.get();
        } finally {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }

    public void register(Future<?> future) {
        inFlight.add(future);
        if (cancelled) {
            future.cancel(true);
        }
    }

    public void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (cancelled) {
            hook.run();
        }
    }

    public void cancel() {
        cancelled = true;
        inFlight.forEach(future -> future.cancel(true));
        cancelHooks.forEach(Runnable::run);
    }
}
