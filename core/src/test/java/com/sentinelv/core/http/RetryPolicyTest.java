package com.sentinelv.core.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void shouldRetry_onlyOn_429_5xx_or_minus1_and_respect_maxAttempts_3() {
        var p = new DefaultRetryPolicy();

        assertEquals(3, p.maxAttempts(), "maxAttempts must be 3");

        int[] retryables = {429, 500, 502, 503, 599, -1};
        for (int sc : retryables) {
            assertTrue(p.shouldRetry(sc, 1), "should retry on first failure for " + sc);
            assertTrue(p.shouldRetry(sc, 2), "should retry on second failure for " + sc);
            assertFalse(p.shouldRetry(sc, 3), "must stop retrying at attempt=3 for " + sc);
        }

        int[] nonRetry = {200, 204, 301, 304, 400, 403, 404};
        for (int sc : nonRetry) {
            assertFalse(p.shouldRetry(sc, 1), "must not retry for non-retryable code " + sc);
        }
    }

    @Test
    void backoff_doubles_with_jitter_and_is_capped() {
        var p = new DefaultRetryPolicy(5, 500, Duration.ofMillis(1500));

        assertBetween(p.nextDelay(1).toMillis(), 450, 550, "attempt=1 backoff");
        assertBetween(p.nextDelay(2).toMillis(), 900, 1100, "attempt=2 backoff");
        assertEquals(1500, p.nextDelay(4).toMillis(), "attempt=4 capped");
    }

    @Test
    void none_policy_never_retries() {
        assertFalse(RetryPolicy.NONE.shouldRetry(503, 1));
        assertEquals(1, RetryPolicy.NONE.maxAttempts());
    }

    @Test
    void counting_policy_counts_only_granted_retries() {
        var c = new CountingRetryPolicy(new DefaultRetryPolicy());
        c.shouldRetry(500, 1);
        c.shouldRetry(200, 2);
        c.shouldRetry(500, 3);   // maxAttempts 도달 → 거부
        assertEquals(1, c.getRetryCount());
    }

    // ---- helpers ----
    private static void assertBetween(long actual, long min, long max, String label) {
        assertTrue(actual >= min && actual <= max,
                () -> label + " out of range: " + actual + "ms (expected " + min + "~" + max + "ms)");
    }
}
