package com.questrail.scheduler.observability;

import java.time.Instant;

/**
 * A failure observed by the scheduler, typically a job that threw.
 */
public record SchedulerErrorEvent(
    Instant timestamp,
    String scheduleName,
    String message,
    Throwable cause
) {
}
