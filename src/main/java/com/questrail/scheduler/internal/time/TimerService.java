package com.questrail.scheduler.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * TimerService
 * =============================================================================
 * One-shot timers used by each schedule's timing loop.
 *
 * <p>A fired timer runs its callback on a thread owned by the implementation.
 * Callbacks are expected to return quickly: the schedule only hands a token to
 * its own timing loop from inside the callback, it never blocks there.</p>
 *
 * <h2>Binding invariant</h2>
 * Deadlines are expressed in monotonic nanoseconds obtained from the same
 * {@link MonotonicClock} the implementation converts against.
 */
public interface TimerService
{
    /**
     * Arm a timer that fires at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds
     * @param onFire        callback run once when the timer fires
     * @return handle that disarms the timer
     */
    Cancellable armAtNanos(long deadlineNanos, Runnable onFire);

    /**
     * Arm a timer that fires after {@code delay}, measured on {@code clock}.
     * Delays beyond the nanosecond range (about 292 years) saturate at the
     * furthest representable deadline.
     */
    default Cancellable armAfter(Duration delay, MonotonicClock clock, Runnable onFire)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(onFire, "onFire");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long delayNanos;
        try {
            delayNanos = delay.toNanos();
        } catch (ArithmeticException e) {
            delayNanos = Long.MAX_VALUE;
        }

        long deadline;
        try {
            deadline = Math.addExact(clock.nowNanos(), delayNanos);
        } catch (ArithmeticException e) {
            deadline = Long.MAX_VALUE;
        }
        return armAtNanos(deadline, onFire);
    }
}
