package com.questrail.scheduler.observability;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Test sink that throws from one chosen callback the first time it is called,
 * and otherwise records into a {@link RecordingObservabilitySink}.
 */
public final class FailingOnceObservabilitySink implements SchedulerObservabilitySink {

    public enum Callback { FIRED, COMPLETED, REARMED, ERROR }

    private final Callback failing;
    private final RecordingObservabilitySink recorder = new RecordingObservabilitySink();
    private final AtomicBoolean failed = new AtomicBoolean(false);

    public FailingOnceObservabilitySink(Callback failing) {
        this.failing = failing;
    }

    public RecordingObservabilitySink recorder() {
        return recorder;
    }

    public boolean hasFailed() {
        return failed.get();
    }

    @Override
    public void onScheduleFired(ScheduleFiredEvent event) {
        failOnce(Callback.FIRED);
        recorder.onScheduleFired(event);
    }

    @Override
    public void onJobCompleted(JobCompletedEvent event) {
        failOnce(Callback.COMPLETED);
        recorder.onJobCompleted(event);
    }

    @Override
    public void onScheduleRearmed(ScheduleRearmedEvent event) {
        failOnce(Callback.REARMED);
        recorder.onScheduleRearmed(event);
    }

    @Override
    public void onError(SchedulerErrorEvent event) {
        failOnce(Callback.ERROR);
        recorder.onError(event);
    }

    private void failOnce(Callback callback) {
        if (callback == failing && failed.compareAndSet(false, true)) {
            throw new IllegalStateException("sink unavailable in " + callback);
        }
    }
}
