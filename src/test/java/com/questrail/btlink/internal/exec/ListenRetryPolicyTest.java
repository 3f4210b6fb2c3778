package com.questrail.btlink.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ListenRetryPolicyTest
 * -----------------------------------------------------------------------------
 * Validates listen retry policy bounds and factory methods.
 */
class ListenRetryPolicyTest {

    @Test
    void disabledPolicyNeverRetries() {
        ListenRetryPolicy policy = ListenRetryPolicy.disabled();

        assertFalse(policy.enabled());
        assertFalse(policy.allowsRetry(1));
        assertEquals(Duration.ZERO, policy.retryDelay());
    }

    @Test
    void retriesAreBoundedByConsecutiveFailures() {
        ListenRetryPolicy policy = ListenRetryPolicy.of(2, Duration.ofMillis(100));

        assertTrue(policy.enabled());
        assertTrue(policy.allowsRetry(1));
        assertTrue(policy.allowsRetry(2));
        assertFalse(policy.allowsRetry(3));
    }

    @Test
    void rejectsNegativeRetries() {
        assertThrows(IllegalArgumentException.class, () ->
                new ListenRetryPolicy(-1, Duration.ZERO)
        );
    }

    @Test
    void rejectsNegativeDelay() {
        assertThrows(IllegalArgumentException.class, () ->
                ListenRetryPolicy.of(1, Duration.ofMillis(-1))
        );
    }

    @Test
    void rejectsNullDelay() {
        assertThrows(NullPointerException.class, () ->
                new ListenRetryPolicy(1, null)
        );
    }
}
