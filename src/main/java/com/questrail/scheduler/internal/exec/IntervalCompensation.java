package com.questrail.scheduler.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * IntervalCompensation
 * -----------------------------------------------------------------------------
 * Computes the delay before a schedule's next run from the time its last run
 * consumed.
 *
 * <p>{@code elapsed} is measured from the moment the timer fired to the moment
 * the acknowledgment arrived, so it covers both the wait for the dispatch
 * channel and the job itself. Subtracting it from the interval keeps the
 * start-to-start period at {@code interval} whenever the run fits inside it.</p>
 *
 * <p>Example with a 20s interval: a run taking 5s re-arms for 15s, one taking
 * 10s re-arms for 10s, one taking 1s re-arms for 19s. A run longer than the
 * interval re-arms with {@code minimumWait}, so the next run follows
 * back-to-back and skipped ticks are not replayed.</p>
 */
public final class IntervalCompensation {

    private IntervalCompensation() {}

    /**
     * Returns {@code interval - elapsed}, or {@code minimumWait} when that is zero or negative.
     */
    public static Duration nextWait(Duration interval, Duration elapsed, Duration minimumWait) {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(elapsed, "elapsed");
        Objects.requireNonNull(minimumWait, "minimumWait");

        Duration wait = interval.minus(elapsed);
        if (wait.isNegative() || wait.isZero()) {
            return minimumWait;
        }
        return wait;
    }

    /**
     * Whether {@link #nextWait} falls back to the minimum wait for these values.
     */
    public static boolean isClamped(Duration interval, Duration elapsed) {
        return interval.compareTo(elapsed) <= 0;
    }
}
