package com.dinoair.resilience.reliability;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RetryPolicyTest {

    @Test
    public void backoffDoublesUpToTheCap() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(100), Duration.ofMillis(1000), false);
        assertEquals(100, policy.backoffMillis(1));
        assertEquals(200, policy.backoffMillis(2));
        assertEquals(400, policy.backoffMillis(3));
        assertEquals(800, policy.backoffMillis(4));
        assertEquals(1000, policy.backoffMillis(5));
        assertEquals(1000, policy.backoffMillis(80));
    }

    @Test
    public void jitterStaysWithinAQuarter() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1000), Duration.ofSeconds(30), true);
        for (int i = 0; i < 200; i++) {
            long delay = policy.backoffMillis(2);
            assertTrue(delay >= 1500 && delay <= 2500, "delay out of range: " + delay);
        }
    }

    @Test
    public void retriesAreBoundedByMaxRetries() {
        RetryPolicy policy = RetryPolicy.of(2, Duration.ofMillis(10));
        assertTrue(policy.canRetry(0));
        assertTrue(policy.canRetry(1));
        assertFalse(policy.canRetry(2));
        assertFalse(RetryPolicy.NONE.canRetry(0));
    }

    @Test
    public void defaultsMatchTheDocumentedProfile() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertEquals(2, policy.getMaxRetries());
        assertEquals(Duration.ofSeconds(1), policy.getBaseDelay());
        assertEquals(Duration.ofSeconds(30), policy.getMaxDelay());
        assertTrue(policy.isJitter());
    }

    @Test
    public void invalidArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, false));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().backoffMillis(0));
    }
}
