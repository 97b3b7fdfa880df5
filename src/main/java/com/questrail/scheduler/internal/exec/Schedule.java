package com.questrail.scheduler.internal.exec;

import com.questrail.scheduler.api.Job;
import com.questrail.scheduler.api.ScheduleState;
import com.questrail.scheduler.api.ScheduleStatus;
import com.questrail.scheduler.config.SchedulerConfig;
import com.questrail.scheduler.internal.time.Cancellable;
import com.questrail.scheduler.internal.time.MonotonicClock;
import com.questrail.scheduler.internal.time.TimerService;
import com.questrail.scheduler.internal.time.WallClock;
import com.questrail.scheduler.observability.ScheduleFiredEvent;
import com.questrail.scheduler.observability.ScheduleRearmedEvent;
import com.questrail.scheduler.observability.SchedulerErrorEvent;
import com.questrail.scheduler.observability.SchedulerObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Schedule
 * =============================================================================
 * Timing state machine for one recurring job.
 *
 * <h2>Cycle</h2>
 * <pre>
 *   WAITING    --timer fires-->        record start, put self on dispatch channel
 *   DISPATCHED --acknowledgment-->     elapsed = now - start
 *                                      arm(max(interval - elapsed, minimumWait))
 *   WAITING    ...
 * </pre>
 * The first timer is armed with {@link SchedulerConfig#firstRunDelay()}.
 *
 * <h2>Threading Model</h2>
 * Each schedule runs its own timing-loop thread. The loop blocks on
 * <ul>
 *   <li>its single-slot timer channel, fed by the {@link TimerService} callback;</li>
 *   <li>the shared dispatch channel, whose capacity of one makes the put wait
 *       while another schedule is already queued;</li>
 *   <li>its single-slot acknowledgment channel, fed by the dispatch loop.</li>
 * </ul>
 * The next timer is armed only after the acknowledgment is taken, so a
 * schedule never has more than one dispatch in flight.
 *
 * <h2>Limitations</h2>
 * A job that never returns leaves this schedule in {@code DISPATCHED}
 * forever. No timeout is applied.
 */
public final class Schedule {
    private static final Logger log = LoggerFactory.getLogger(Schedule.class);

    private enum Signal { FIRED, COMPLETED }

    private final String name;
    private final Job job;
    private final Duration interval;
    private final SchedulerConfig config;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final TimerService timers;
    private final SchedulerObservabilitySink observabilitySink;
    private final BlockingQueue<Schedule> dispatchChannel;

    private final BlockingQueue<Signal> timerChannel = new ArrayBlockingQueue<>(1);
    private final BlockingQueue<Signal> ackChannel = new ArrayBlockingQueue<>(1);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedRuns = new AtomicLong();

    private volatile ScheduleState state = ScheduleState.WAITING;
    private volatile Cancellable armedTimer;
    private volatile Thread loopThread;

    public Schedule(String name,
                    Job job,
                    Duration interval,
                    SchedulerConfig config,
                    MonotonicClock clock,
                    WallClock wallClock,
                    TimerService timers,
                    SchedulerObservabilitySink observabilitySink,
                    BlockingQueue<Schedule> dispatchChannel)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.job = Objects.requireNonNull(job, "job");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timers = Objects.requireNonNull(timers, "timers");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.dispatchChannel = Objects.requireNonNull(dispatchChannel, "dispatchChannel");
    }

    /**
     * Starts the timing loop thread, which arms the first timer.
     * Idempotent.
     */
    public void start(String threadName) {
        if (running.compareAndSet(false, true)) {
            Thread thread = new Thread(this::runTimingLoop, threadName);
            thread.setDaemon(true);
            loopThread = thread;
            thread.start();
        }
    }

    /**
     * Disarms the pending timer and interrupts the timing loop. Does not wait.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Cancellable timer = armedTimer;
            if (timer != null) {
                timer.cancel();
            }
            Thread thread = loopThread;
            if (thread != null) {
                thread.interrupt();
            }
        }
    }

    /**
     * Waits for the timing loop thread to end.
     *
     * @return {@code true} if the thread is no longer alive
     */
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

    /**
     * Signals that the job dispatched by this schedule has returned.
     * Called by the dispatch loop only.
     *
     * @throws IllegalStateException if an earlier acknowledgment has not been consumed
     */
    public void acknowledge() {
        if (!ackChannel.offer(Signal.COMPLETED)) {
            throw new IllegalStateException("Schedule " + name + " acknowledged twice for one run");
        }
    }

    public String name() {
        return name;
    }

    public Job job() {
        return job;
    }

    public Duration interval() {
        return interval;
    }

    /**
     * Number of the run currently waiting or in flight, starting at 1.
     */
    public long currentRun() {
        return completedRuns.get() + 1;
    }

    public ScheduleStatus status() {
        return new ScheduleStatus(name, interval, state, completedRuns.get());
    }

    private void runTimingLoop() {
        arm(config.firstRunDelay());
        while (running.get()) {
            try {
                runCycle();
            } catch (InterruptedException e) {
                // Expected during shutdown
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                // The timer could not be re-armed; nothing will wake this loop again.
                running.set(false);
                reportError("Timing loop stopped", e);
                return;
            }
        }
    }

    private void runCycle() throws InterruptedException {
        timerChannel.take();
        armedTimer = null;

        long runNumber = currentRun();
        // Taken before the put, so elapsed includes the wait for the dispatch channel.
        long startNanos = clock.nowNanos();
        state = ScheduleState.DISPATCHED;
        publish(() -> observabilitySink.onScheduleFired(new ScheduleFiredEvent(wallClock.now(), name, runNumber)));

        dispatchChannel.put(this);
        ackChannel.take();

        Duration elapsed = Duration.ofNanos(clock.nowNanos() - startNanos);
        Duration nextWait = IntervalCompensation.nextWait(interval, elapsed, config.minimumWait());
        completedRuns.incrementAndGet();
        arm(nextWait);
        state = ScheduleState.WAITING;

        publish(() -> observabilitySink.onScheduleRearmed(new ScheduleRearmedEvent(
            wallClock.now(),
            name,
            runNumber,
            interval,
            elapsed,
            nextWait,
            IntervalCompensation.isClamped(interval, elapsed)
        )));
    }

    private void arm(Duration wait) {
        // At most one timer is armed, so the timer slot is always free when it fires.
        armedTimer = timers.armAfter(wait, clock, () -> timerChannel.offer(Signal.FIRED));
    }

    /**
     * Delivers a notification to the sink. A failing sink is reported and never
     * interrupts the timing cycle.
     */
    private void publish(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            reportError("Observability sink failed", e);
        }
    }

    private void reportError(String message, RuntimeException cause) {
        try {
            observabilitySink.onError(new SchedulerErrorEvent(wallClock.now(), name, message, cause));
        } catch (RuntimeException sinkFailure) {
            log.error("Schedule {}: {}", name, message, cause);
            log.error("Schedule {}: observability sink rejected the error report", name, sinkFailure);
        }
    }
}
