package com.dinoair.resilience.breaker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SlidingWindowTrackerTest {
    private SlidingWindowTracker tracker = new SlidingWindowTracker(3);

    @Test
    public void emptyWindowHasZeroRates() {
        WindowStats stats = tracker.stats();
        assertEquals(0, stats.getTotalCalls());
        assertEquals(0.0, stats.getFailureRate(), 0.0001);
        assertEquals(0.0, stats.getSlowCallRate(), 0.0001);
    }

    @Test
    public void ratesCoverEveryBucket() {
        tracker.record(true, false);
        tracker.rotate();
        tracker.record(false, true);
        tracker.record(false, false);
        tracker.rotate();
        tracker.record(true, true);

        WindowStats stats = tracker.stats();
        assertEquals(4, stats.getTotalCalls());
        assertEquals(2, stats.getFailures());
        assertEquals(2, stats.getSlowCalls());
        assertEquals(0.5, stats.getFailureRate(), 0.0001);
        assertEquals(0.5, stats.getSlowCallRate(), 0.0001);
    }

    @Test
    public void sampleExpiresAfterFullRotation() {
        tracker.record(true, false);
        tracker.rotate();
        tracker.rotate();
        assertEquals(1, tracker.stats().getTotalCalls());

        // the cursor is back on the first bucket, which is cleared on arrival
        tracker.rotate();
        assertEquals(0, tracker.stats().getTotalCalls());
    }

    @Test
    public void clearEmptiesAllBuckets() {
        tracker.record(true, true);
        tracker.rotate();
        tracker.record(false, false);
        tracker.clear();
        assertEquals(WindowStats.EMPTY.getTotalCalls(), tracker.stats().getTotalCalls());
    }

    @Test
    public void rejectsNonPositiveBucketCount() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowTracker(0));
    }
}
