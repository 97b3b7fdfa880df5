package com.questrail.scheduler.runtime;

import com.questrail.scheduler.api.Job;
import com.questrail.scheduler.api.ScheduleStatus;
import com.questrail.scheduler.config.SchedulerConfig;
import com.questrail.scheduler.internal.exec.DispatchLoop;
import com.questrail.scheduler.internal.exec.Schedule;
import com.questrail.scheduler.internal.time.MonotonicClock;
import com.questrail.scheduler.internal.time.ScheduledExecutorTimerService;
import com.questrail.scheduler.internal.time.SystemMonotonicClock;
import com.questrail.scheduler.internal.time.SystemWallClock;
import com.questrail.scheduler.internal.time.TimerService;
import com.questrail.scheduler.internal.time.WallClock;
import com.questrail.scheduler.observability.NullObservabilitySink;
import com.questrail.scheduler.observability.SchedulerObservabilitySink;
import com.questrail.scheduler.observability.Slf4jSchedulerObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SerialScheduler
 * =============================================================================
 * Runs any number of recurring jobs, each on its own interval, one job at a time.
 *
 * <h2>Structure</h2>
 * <ul>
 *   <li>One {@link DispatchLoop} thread, started at construction. It is the
 *       only place jobs execute.</li>
 *   <li>One {@link Schedule} timing-loop thread per registered job. Each fires
 *       its job through the dispatch channel and, once acknowledged, re-arms
 *       itself for {@code interval - elapsed}.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 *   SerialScheduler scheduler = SerialScheduler.create();
 *   scheduler.register("cleanup", cleanupJob, Duration.ofSeconds(20));
 *   scheduler.register(reportJob, Duration.ofMinutes(1));
 * </pre>
 * A registered job runs almost immediately, then every interval. Jobs cannot
 * be removed. {@link #close()} stops every loop; it exists so tests and
 * embedding applications do not leak threads.
 *
 * <h2>Thread Safety</h2>
 * Registration is safe from any thread.
 */
public final class SerialScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SerialScheduler.class);

    private final SchedulerConfig config;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final TimerService timers;
    private final SchedulerObservabilitySink observabilitySink;
    private final ScheduledExecutorService ownedTimerExecutor;
    private final DispatchLoop dispatchLoop;

    private final Object registrationLock = new Object();
    private final List<Schedule> schedules = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SerialScheduler(SchedulerConfig config,
                            MonotonicClock clock,
                            WallClock wallClock,
                            TimerService timers,
                            SchedulerObservabilitySink observabilitySink,
                            ScheduledExecutorService ownedTimerExecutor)
    {
        this.config = config;
        this.clock = clock;
        this.wallClock = wallClock;
        this.timers = timers;
        this.observabilitySink = observabilitySink;
        this.ownedTimerExecutor = ownedTimerExecutor;
        this.dispatchLoop = new DispatchLoop(clock, wallClock, observabilitySink);

        dispatchLoop.start(config.threadNamePrefix() + "-dispatch");
        log.info("SerialScheduler started");
    }

    /**
     * Creates a scheduler with default configuration that logs through SLF4J,
     * and starts its dispatch loop.
     */
    public static SerialScheduler create() {
        return builder()
            .withObservabilitySink(new Slf4jSchedulerObservabilitySink())
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a job under a generated name ({@code job-1}, {@code job-2}, ...).
     *
     * @see #register(String, Job, Duration)
     */
    public void register(Job job, Duration interval) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(interval, "interval");

        synchronized (registrationLock) {
            addSchedule("job-" + (schedules.size() + 1), job, interval);
        }
    }

    /**
     * Registers a recurring job and starts its timing loop. Returns without
     * waiting for the first run.
     *
     * <p>A zero or negative interval is accepted: the job then runs back-to-back,
     * separated only by the configured minimum wait.</p>
     *
     * @throws IllegalStateException if the scheduler has been closed
     */
    public void register(String name, Job job, Duration interval) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(interval, "interval");

        synchronized (registrationLock) {
            addSchedule(name, job, interval);
        }
    }

    /**
     * Snapshot of every registered schedule in registration order.
     */
    public List<ScheduleStatus> schedules() {
        synchronized (registrationLock) {
            List<ScheduleStatus> statuses = new ArrayList<>(schedules.size());
            for (Schedule schedule : schedules) {
                statuses.add(schedule.status());
            }
            return List.copyOf(statuses);
        }
    }

    public SchedulerConfig config() {
        return config;
    }

    /**
     * Stops all timing loops and the dispatch loop, then waits up to
     * {@link SchedulerConfig#shutdownTimeout()} for each thread.
     * A job that ignores interruption is left running. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down SerialScheduler...");

        List<Schedule> snapshot;
        synchronized (registrationLock) {
            snapshot = new ArrayList<>(schedules);
        }

        for (Schedule schedule : snapshot) {
            schedule.stop();
        }
        dispatchLoop.stop();

        for (Schedule schedule : snapshot) {
            if (!schedule.awaitTermination(config.shutdownTimeout())) {
                log.warn("Timing loop for schedule {} did not terminate", schedule.name());
            }
        }
        boolean dispatchStopped = dispatchLoop.awaitTermination(config.shutdownTimeout());

        if (ownedTimerExecutor != null) {
            ownedTimerExecutor.shutdownNow();
        }

        if (dispatchStopped) {
            log.info("SerialScheduler stopped.");
        } else {
            log.warn("SerialScheduler stopped, but a job is still running on the dispatch thread");
        }
    }

    // Caller holds registrationLock.
    private void addSchedule(String name, Job job, Duration interval) {
        if (closed.get()) {
            throw new IllegalStateException("SerialScheduler is closed");
        }

        Schedule schedule = new Schedule(
            name,
            job,
            interval,
            config,
            clock,
            wallClock,
            timers,
            observabilitySink,
            dispatchLoop.channel()
        );
        schedules.add(schedule);
        schedule.start(config.threadNamePrefix() + "-" + name);

        log.info("Registered schedule {} every {}ms", name, interval.toMillis());
    }

    public static final class Builder {
        private SchedulerConfig config = SchedulerConfig.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private TimerService timerService;
        private SchedulerObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Timer service for schedule timers. When omitted, the scheduler creates
         * a single-thread executor of its own and shuts it down on close.
         * The service must interpret deadlines against the same clock.
         */
        public Builder withTimerService(TimerService timerService) {
            this.timerService = timerService;
            return this;
        }

        public Builder withObservabilitySink(SchedulerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public SerialScheduler build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            ScheduledExecutorService ownedExecutor = null;
            TimerService timers = timerService;
            if (timers == null) {
                String threadName = config.threadNamePrefix() + "-timer";
                ownedExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                    Thread thread = new Thread(runnable, threadName);
                    thread.setDaemon(true);
                    return thread;
                });
                timers = new ScheduledExecutorTimerService(ownedExecutor, clock);
            }

            return new SerialScheduler(config, clock, wallClock, timers, observabilitySink, ownedExecutor);
        }
    }
}
