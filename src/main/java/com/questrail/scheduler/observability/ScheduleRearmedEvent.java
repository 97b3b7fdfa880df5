package com.questrail.scheduler.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * A schedule received its acknowledgment and armed its next timer.
 *
 * @param elapsed  time from timer fire to acknowledgment (dispatch wait plus execution)
 * @param nextWait the delay the timer was armed with
 * @param clamped  whether {@code nextWait} is the minimum wait because the run overran its interval
 */
public record ScheduleRearmedEvent(
    Instant timestamp,
    String scheduleName,
    long runNumber,
    Duration interval,
    Duration elapsed,
    Duration nextWait,
    boolean clamped
) {
}
