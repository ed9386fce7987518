package com.dinoair.resilience.scheduling;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.PriorityQueue;

/**
 * Deterministic {@link Scheduler} for tests. Nothing runs until {@link #advance(Duration)} moves the
 * clock past a task's due time; tasks then run on the calling thread in due-time order.
 */
public class ManualScheduler implements Scheduler {
    private final MutableClock clock;
    private final PriorityQueue<Entry> queue = new PriorityQueue<>();
    private long sequence;

    public ManualScheduler() {
        this(new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
    }

    public ManualScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable task, long delayMs) {
        Entry e = new Entry(task, clock.millis() + Math.max(0, delayMs), 0, sequence++);
        queue.add(e);
        return e;
    }

    @Override
    public synchronized ScheduledTask scheduleAtFixedRate(Runnable task, long periodMs) {
        Entry e = new Entry(task, clock.millis() + periodMs, periodMs, sequence++);
        queue.add(e);
        return e;
    }

    @Override
    public Clock clock() {
        return clock;
    }

    public MutableClock mutableClock() {
        return clock;
    }

    /** Advances the clock by {@code duration}, running every task that falls due on the way. */
    public void advance(Duration duration) {
        long target = clock.millis() + duration.toMillis();
        while (true) {
            Entry next;
            synchronized (this) {
                next = queue.peek();
                if (next == null || next.dueAt > target)
                    break;
                queue.poll();
            }
            if (next.cancelled)
                continue;
            clock.setTime(Instant.ofEpochMilli(next.dueAt));
            next.task.run();
            if (next.periodMs > 0 && !next.cancelled) {
                synchronized (this) {
                    next.dueAt += next.periodMs;
                    next.order = sequence++;
                    queue.add(next);
                }
            }
        }
        clock.setTime(Instant.ofEpochMilli(target));
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /** Runs tasks already due without moving the clock. */
    public void runDue() {
        advance(Duration.ZERO);
    }

    public synchronized int pendingTasks() {
        int n = 0;
        for (Entry e : queue)
            if (!e.cancelled)
                n++;
        return n;
    }

    private static final class Entry implements ScheduledTask, Comparable<Entry> {
        private final Runnable task;
        private final long periodMs;
        private long dueAt;
        private long order;
        private volatile boolean cancelled;

        Entry(Runnable task, long dueAt, long periodMs, long order) {
            this.task = task;
            this.dueAt = dueAt;
            this.periodMs = periodMs;
            this.order = order;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public int compareTo(Entry o) {
            int c = Long.compare(dueAt, o.dueAt);
            return c != 0 ? c : Long.compare(order, o.order);
        }
    }
}
