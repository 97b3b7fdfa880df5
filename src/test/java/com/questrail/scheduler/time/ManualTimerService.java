package com.questrail.scheduler.time;

import com.questrail.scheduler.internal.time.Cancellable;
import com.questrail.scheduler.internal.time.MonotonicClock;
import com.questrail.scheduler.internal.time.TimerService;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic timer service driven by a {@link ManualMonotonicClock}.
 *
 * Timers fire ONLY when {@link #fireDueTimers()} is called. Timing loops arm
 * from their own threads, so arming and firing are synchronized.
 */
public final class ManualTimerService implements TimerService {

    private final MonotonicClock clock;
    private final PriorityQueue<Armed> queue = new PriorityQueue<>();

    public ManualTimerService(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable armAtNanos(long deadlineNanos, Runnable onFire) {
        Armed armed = new Armed(deadlineNanos, onFire);
        queue.add(armed);
        notifyAll();
        return armed;
    }

    /**
     * Fire every timer whose deadline is <= current clock time.
     * Callbacks run on the calling thread, outside the lock.
     */
    public void fireDueTimers() {
        List<Armed> due = new ArrayList<>();
        synchronized (this) {
            while (!queue.isEmpty() && queue.peek().deadlineNanos <= clock.nowNanos()) {
                due.add(queue.poll());
            }
        }
        for (Armed armed : due) {
            if (armed.fired.compareAndSet(false, true)) {
                armed.onFire.run();
            }
        }
    }

    /**
     * Blocks until at least {@code count} timers are armed and not yet fired.
     */
    public synchronized boolean awaitArmed(int count, long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (pendingCount() < count) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                return false;
            }
            wait(remainingMillis);
        }
        return true;
    }

    public synchronized int pendingCount() {
        int pending = 0;
        for (Armed armed : queue) {
            if (!armed.fired.get()) {
                pending++;
            }
        }
        return pending;
    }

    private static final class Armed implements Comparable<Armed>, Cancellable {
        private final long deadlineNanos;
        private final Runnable onFire;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Armed(long deadlineNanos, Runnable onFire) {
            this.deadlineNanos = deadlineNanos;
            this.onFire = onFire;
        }

        @Override
        public boolean cancel() {
            return fired.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Armed o) {
            return Long.compare(this.deadlineNanos, o.deadlineNanos);
        }
    }
}
