package com.questrail.scheduler.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a one-shot timer armed through a {@link TimerService}.
 */
public interface Cancellable
{
    /**
     * Disarm the timer.
     *
     * @return {@code true} if the timer was disarmed before it fired;
     *         {@code false} if it already fired or was disarmed earlier.
     */
    boolean cancel();
}
