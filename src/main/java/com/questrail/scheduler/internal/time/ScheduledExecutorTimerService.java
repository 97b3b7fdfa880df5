package com.questrail.scheduler.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorTimerService
 * =============================================================================
 * Production {@link TimerService} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Monotonic deadlines are converted to relative delays at arm time using the
 * supplied {@link MonotonicClock}. A deadline already in the past fires with
 * zero delay; deadlines too far out to express saturate at the longest delay.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>The executor is not shut down by this class. Whoever created it owns it;
 * {@code SerialScheduler} shuts down the executor it creates for itself.</p>
 *
 * <h2>Precision</h2>
 * <p>Timers may fire slightly late under load, never early.</p>
 */
public final class ScheduledExecutorTimerService implements TimerService {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorTimerService(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable armAtNanos(long deadlineNanos, Runnable onFire) {
        Objects.requireNonNull(onFire, "onFire");

        long delayNanos;
        try {
            delayNanos = Math.max(0, Math.subtractExact(deadlineNanos, clock.nowNanos()));
        } catch (ArithmeticException e) {
            // Only a far-future deadline minus a negative tick overflows.
            delayNanos = Long.MAX_VALUE;
        }
        ScheduledFuture<?> future = executor.schedule(onFire, delayNanos, TimeUnit.NANOSECONDS);
        return new FutureCancellable(future);
    }

    private static final class FutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private FutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }
    }
}
