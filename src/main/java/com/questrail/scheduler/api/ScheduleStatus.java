package com.questrail.scheduler.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Point-in-time view of one registered schedule.
 *
 * @param name          name given at registration
 * @param interval      configured interval between run starts
 * @param state         current position in the timing cycle
 * @param completedRuns number of runs acknowledged so far
 */
public record ScheduleStatus(
        String name,
        Duration interval,
        ScheduleState state,
        long completedRuns
) {
    public ScheduleStatus {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(state, "state");
    }
}
