package com.dinoair.resilience.breaker;

/**
 * Ring of {@link WindowBucket}s approximating a sliding window of {@code bucketCount} equal slices.
 * Calls are recorded into the bucket under the cursor; {@link #rotate()} advances the cursor and
 * clears the bucket it lands on, so after {@code bucketCount} rotations a sample is gone.
 *
 * No per-call timestamps are kept. Whoever owns the tracker drives the rotation.
 */
public class SlidingWindowTracker {
    private final WindowBucket[] buckets;
    private int cursor;

    public SlidingWindowTracker(int bucketCount) {
        if (bucketCount <= 0)
            throw new IllegalArgumentException("bucketCount must be positive: " + bucketCount);
        this.buckets = new WindowBucket[bucketCount];
        for (int i = 0; i < bucketCount; i++)
            buckets[i] = new WindowBucket();
    }

    public synchronized void record(boolean failure, boolean slow) {
        buckets[cursor].record(failure, slow);
    }

    public synchronized void rotate() {
        cursor = (cursor + 1) % buckets.length;
        buckets[cursor].clear();
    }

    public synchronized WindowStats stats() {
        int calls = 0, failures = 0, slow = 0;
        for (WindowBucket b : buckets) {
            calls += b.getCalls();
            failures += b.getFailures();
            slow += b.getSlowCalls();
        }
        return new WindowStats(calls, failures, slow);
    }

    public synchronized void clear() {
        for (WindowBucket b : buckets)
            b.clear();
    }

    public int bucketCount() {
        return buckets.length;
    }
}
