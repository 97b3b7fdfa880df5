package com.questrail.scheduler.config;

import java.time.Duration;
import java.util.Objects;

/**
 * SchedulerConfig
 * -----------------------------------------------------------------------------
 * Operational settings for a {@code SerialScheduler}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>firstRunDelay</b> — delay of the first timer armed after a job is
 *       registered. Kept near zero so a new job runs almost immediately,
 *       whatever its interval.</li>
 *   <li><b>minimumWait</b> — the wait used when the compensated wait
 *       ({@code interval - elapsed}) is not positive, i.e. the run overran its
 *       interval. The next run then starts back-to-back.</li>
 *   <li><b>shutdownTimeout</b> — how long {@code close()} waits for each
 *       scheduler thread to finish.</li>
 *   <li><b>threadNamePrefix</b> — prefix for the dispatch, timing-loop and
 *       timer thread names.</li>
 * </ul>
 */
public record SchedulerConfig(
        Duration firstRunDelay,
        Duration minimumWait,
        Duration shutdownTimeout,
        String threadNamePrefix
) {
    public SchedulerConfig {
        Objects.requireNonNull(firstRunDelay, "firstRunDelay");
        Objects.requireNonNull(minimumWait, "minimumWait");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");

        if (firstRunDelay.isNegative()) {
            throw new IllegalArgumentException("firstRunDelay must be non-negative");
        }
        if (minimumWait.isNegative() || minimumWait.isZero()) {
            throw new IllegalArgumentException("minimumWait must be positive");
        }
        if (shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
            throw new IllegalArgumentException("shutdownTimeout must be positive");
        }
        if (threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix must not be blank");
        }
    }

    /**
     * Defaults:
     * <ul>
     *   <li>firstRunDelay: 1ns</li>
     *   <li>minimumWait: 1ns</li>
     *   <li>shutdownTimeout: 5s</li>
     *   <li>threadNamePrefix: {@code serial-scheduler}</li>
     * </ul>
     */
    public static SchedulerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration firstRunDelay = Duration.ofNanos(1);
        private Duration minimumWait = Duration.ofNanos(1);
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private String threadNamePrefix = "serial-scheduler";

        public Builder withFirstRunDelay(Duration firstRunDelay) {
            this.firstRunDelay = firstRunDelay;
            return this;
        }

        public Builder withMinimumWait(Duration minimumWait) {
            this.minimumWait = minimumWait;
            return this;
        }

        public Builder withShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder withThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(firstRunDelay, minimumWait, shutdownTimeout, threadNamePrefix);
        }
    }
}
