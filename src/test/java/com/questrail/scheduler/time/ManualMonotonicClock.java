package com.questrail.scheduler.time;

import com.questrail.scheduler.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock that only moves when told to.
 *
 * Jobs under test advance it from the dispatch thread to simulate execution
 * time, so reads and advances are atomic.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong();

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Cannot move a monotonic clock backwards");
        }
        nowNanos.addAndGet(delta.toNanos());
    }

    public void advanceNanos(long deltaNanos) {
        advance(Duration.ofNanos(deltaNanos));
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
