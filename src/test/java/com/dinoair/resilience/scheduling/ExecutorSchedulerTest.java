package com.dinoair.resilience.scheduling;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutorSchedulerTest {
    private ExecutorScheduler scheduler = new ExecutorScheduler();

    @AfterEach
    public void tearDown() {
        scheduler.close();
    }

    @Test
    public void runsOneShotTasks() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        scheduler.schedule(ran::countDown, 10);
        assertTrue(ran.await(2, TimeUnit.SECONDS));
    }

    @Test
    public void failingPeriodicTaskKeepsRunning() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch threeRuns = new CountDownLatch(3);
        scheduler.scheduleAtFixedRate(() -> {
            runs.incrementAndGet();
            threeRuns.countDown();
            throw new IllegalStateException("tick failed");
        }, 10);
        assertTrue(threeRuns.await(2, TimeUnit.SECONDS));
    }

    @Test
    public void cancelledTaskNeverRuns() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        ScheduledTask task = scheduler.schedule(runs::incrementAndGet, 200);
        task.cancel();
        assertTrue(task.isCancelled());
        Thread.sleep(300);
        assertEquals(0, runs.get());
    }

    @Test
    public void rejectsNonPositivePeriod() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleAtFixedRate(() -> { }, 0));
    }
}
