package com.questrail.scheduler.api;

/**
 * A recurring unit of work registered with a {@code SerialScheduler}.
 *
 * <p>The scheduler calls {@link #performWork()} synchronously from its single
 * dispatch thread, so no two jobs ever run at the same time. The call may take
 * arbitrarily long; a call that never returns blocks every other registered job.
 * Failures are the job's own concern: the scheduler does not retry.</p>
 */
@FunctionalInterface
public interface Job {

    void performWork();
}
