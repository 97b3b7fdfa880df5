package com.questrail.scheduler.observability;

/**
 * Receives scheduler lifecycle events.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Callbacks run on scheduler threads (timing loops and the dispatch loop)
 * and must not block.</p>
 */
public interface SchedulerObservabilitySink {
    /**
     * Called when a schedule's timer fires, before it enters the dispatch channel.
     */
    void onScheduleFired(ScheduleFiredEvent event);

    /**
     * Called by the dispatch loop after a job returns or throws.
     */
    void onJobCompleted(JobCompletedEvent event);

    /**
     * Called after a schedule has armed its next timer.
     */
    void onScheduleRearmed(ScheduleRearmedEvent event);

    /**
     * Called when a job fails or a loop hits an unexpected error.
     */
    void onError(SchedulerErrorEvent event);
}
