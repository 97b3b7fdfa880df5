package com.questrail.scheduler.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SchedulerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSchedulerObservabilitySink implements SchedulerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSchedulerObservabilitySink.class);

    @Override
    public void onScheduleFired(ScheduleFiredEvent event) {
        log.debug("Schedule {}: run {} fired", event.scheduleName(), event.runNumber());
    }

    @Override
    public void onJobCompleted(JobCompletedEvent event) {
        if (event.failed()) {
            log.debug("Schedule {}: run {} failed after {}ms",
                event.scheduleName(),
                event.runNumber(),
                event.executionTime().toMillis());
        } else {
            log.debug("Schedule {}: run {} completed in {}ms",
                event.scheduleName(),
                event.runNumber(),
                event.executionTime().toMillis());
        }
    }

    @Override
    public void onScheduleRearmed(ScheduleRearmedEvent event) {
        if (event.clamped()) {
            log.warn("Schedule {}: run {} took {}ms, longer than its {}ms interval; next run starts immediately",
                event.scheduleName(),
                event.runNumber(),
                event.elapsed().toMillis(),
                event.interval().toMillis());
        } else {
            log.debug("Schedule {}: next run in {}ms", event.scheduleName(), event.nextWait().toMillis());
        }
    }

    @Override
    public void onError(SchedulerErrorEvent event) {
        log.error("Schedule {}: {}", event.scheduleName(), event.message(), event.cause());
    }
}
