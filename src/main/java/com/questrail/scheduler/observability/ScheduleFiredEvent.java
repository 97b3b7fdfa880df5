package com.questrail.scheduler.observability;

import java.time.Instant;

/**
 * A schedule's timer fired and the schedule is about to hand itself to the dispatch channel.
 */
public record ScheduleFiredEvent(
    Instant timestamp,
    String scheduleName,
    long runNumber
) {
}
