package com.questrail.scheduler.internal.exec;

import com.questrail.scheduler.internal.time.MonotonicClock;
import com.questrail.scheduler.internal.time.WallClock;
import com.questrail.scheduler.observability.JobCompletedEvent;
import com.questrail.scheduler.observability.SchedulerErrorEvent;
import com.questrail.scheduler.observability.SchedulerObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DispatchLoop
 * =============================================================================
 * The single consumer of the shared dispatch channel.
 *
 * <h2>Threading Model</h2>
 * One thread takes a {@link Schedule} from the channel, runs its job
 * synchronously and acknowledges that schedule, then takes the next one.
 * This is the only place jobs run, so no two jobs ever overlap.
 *
 * <p>The channel holds a single schedule. While a job runs, one more schedule
 * can be queued; any further schedule blocks in its own {@code put}.</p>
 *
 * <h2>Failures</h2>
 * A job that throws is reported to the observability sink and acknowledged
 * like any other run. A sink that throws is reported (or logged, if it also
 * rejects the error report) and the loop keeps running. A job that never returns blocks this loop and with it
 * every registered schedule.
 */
public final class DispatchLoop {
    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SchedulerObservabilitySink observabilitySink;

    private final BlockingQueue<Schedule> channel = new ArrayBlockingQueue<>(1);
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread loopThread;

    public DispatchLoop(MonotonicClock clock, WallClock wallClock, SchedulerObservabilitySink observabilitySink) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * The shared channel schedules put themselves on when their timer fires.
     */
    public BlockingQueue<Schedule> channel() {
        return channel;
    }

    /**
     * Starts the consumer thread. Idempotent.
     */
    public void start(String threadName) {
        if (running.compareAndSet(false, true)) {
            Thread thread = new Thread(this::runLoop, threadName);
            thread.setDaemon(true);
            loopThread = thread;
            thread.start();
        }
    }

    /**
     * Interrupts the consumer thread. A job that ignores interruption keeps running.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread thread = loopThread;
            if (thread != null) {
                thread.interrupt();
            }
        }
    }

    public boolean awaitTermination(Duration timeout) {
        Thread thread = loopThread;
        if (thread == null) {
            return true;
        }
        try {
            thread.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    private void runLoop() {
        while (running.get()) {
            Schedule schedule;
            try {
                schedule = channel.take();
            } catch (InterruptedException e) {
                // Expected during shutdown
                Thread.currentThread().interrupt();
                return;
            }
            try {
                execute(schedule);
            } catch (RuntimeException e) {
                reportError(schedule.name(), "Dispatch failed", e);
            }
        }
    }

    /**
     * Runs one dispatched job and acknowledges its schedule.
     * The acknowledgment is sent even if the sink throws.
     */
    void execute(Schedule schedule) {
        long runNumber = schedule.currentRun();
        long startNanos = clock.nowNanos();
        boolean failed = false;

        try {
            try {
                schedule.job().performWork();
            } catch (RuntimeException e) {
                failed = true;
                reportError(schedule.name(), "Job failed on run " + runNumber, e);
            }

            observabilitySink.onJobCompleted(new JobCompletedEvent(
                wallClock.now(),
                schedule.name(),
                runNumber,
                Duration.ofNanos(clock.nowNanos() - startNanos),
                failed
            ));
        } finally {
            schedule.acknowledge();
        }
    }

    private void reportError(String scheduleName, String message, RuntimeException cause) {
        try {
            observabilitySink.onError(new SchedulerErrorEvent(wallClock.now(), scheduleName, message, cause));
        } catch (RuntimeException sinkFailure) {
            log.error("Schedule {}: {}", scheduleName, message, cause);
            log.error("Schedule {}: observability sink rejected the error report", scheduleName, sinkFailure);
        }
    }
}
