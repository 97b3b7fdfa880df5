package com.questrail.scheduler.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * The dispatch loop returned from a job.
 *
 * @param executionTime time spent inside {@code performWork()}
 * @param failed        whether the job ended by throwing
 */
public record JobCompletedEvent(
    Instant timestamp,
    String scheduleName,
    long runNumber,
    Duration executionTime,
    boolean failed
) {
}
