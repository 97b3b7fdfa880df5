package com.questrail.scheduler.observability;

/**
 * No-op implementation of SchedulerObservabilitySink.
 */
public final class NullObservabilitySink implements SchedulerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onScheduleFired(ScheduleFiredEvent event) {}

    @Override
    public void onJobCompleted(JobCompletedEvent event) {}

    @Override
    public void onScheduleRearmed(ScheduleRearmedEvent event) {}

    @Override
    public void onError(SchedulerErrorEvent event) {}
}
