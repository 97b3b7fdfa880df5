package com.questrail.scheduler.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for interval compensation.
 *
 * <h2>Binding invariant</h2>
 * Elapsed-time measurement for a run (fire to acknowledgment) and timer
 * deadlines MUST use this clock. Wall-clock time is used only for the
 * timestamps carried by observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     * Values are only meaningful relative to each other.
     */
    long nowNanos();
}
