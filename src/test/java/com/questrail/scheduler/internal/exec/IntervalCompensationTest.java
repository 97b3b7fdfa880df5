package com.questrail.scheduler.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class IntervalCompensationTest {

    private static final Duration MINIMUM = Duration.ofNanos(1);

    @Test
    void subtractsElapsedFromInterval() {
        Duration interval = Duration.ofSeconds(20);

        assertEquals(Duration.ofSeconds(15), IntervalCompensation.nextWait(interval, Duration.ofSeconds(5), MINIMUM));
        assertEquals(Duration.ofSeconds(10), IntervalCompensation.nextWait(interval, Duration.ofSeconds(10), MINIMUM));
        assertEquals(Duration.ofSeconds(19), IntervalCompensation.nextWait(interval, Duration.ofSeconds(1), MINIMUM));
    }

    @Test
    void overrunClampsToMinimumWait() {
        Duration wait = IntervalCompensation.nextWait(Duration.ofMillis(10), Duration.ofMillis(15), MINIMUM);

        assertEquals(MINIMUM, wait);
        assertTrue(IntervalCompensation.isClamped(Duration.ofMillis(10), Duration.ofMillis(15)));
    }

    @Test
    void elapsedEqualToIntervalClamps() {
        assertEquals(MINIMUM, IntervalCompensation.nextWait(Duration.ofMillis(10), Duration.ofMillis(10), MINIMUM));
        assertTrue(IntervalCompensation.isClamped(Duration.ofMillis(10), Duration.ofMillis(10)));
    }

    @Test
    void zeroAndNegativeIntervalsAlwaysClamp() {
        assertEquals(MINIMUM, IntervalCompensation.nextWait(Duration.ZERO, Duration.ZERO, MINIMUM));
        assertEquals(MINIMUM, IntervalCompensation.nextWait(Duration.ofSeconds(-3), Duration.ofMillis(1), MINIMUM));
    }

    @Test
    void unclampedWaitIsReportedAsSuch() {
        assertFalse(IntervalCompensation.isClamped(Duration.ofMillis(10), Duration.ofMillis(9)));
    }

    @Test
    void keepsNanosecondPrecision() {
        Duration wait = IntervalCompensation.nextWait(Duration.ofMillis(1), Duration.ofNanos(999_999), MINIMUM);

        assertEquals(Duration.ofNanos(1), wait);
        assertFalse(IntervalCompensation.isClamped(Duration.ofMillis(1), Duration.ofNanos(999_999)));
    }
}
