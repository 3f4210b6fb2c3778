package com.questrail.btlink.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * ListenRetryPolicy
 * -----------------------------------------------------------------------------
 * Operational policy for re-arming listening after a failed listen attempt.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>maxRetries</b>: number of consecutive failed listens that are
 *       retried automatically. {@code 0} disables automatic retry; listening is
 *       then re-armed only by a radio-enabled transition, a link disconnect of
 *       the bound peer or an explicit {@code listen()}.</li>
 *   <li><b>retryDelay</b>: delay between a failed listen and its retry.</li>
 * </ul>
 *
 * <p>The reducer remains the sole authority for whether a retry is allowed in
 * the current state; this policy only bounds how many and how late. The
 * consecutive-failure count resets when a channel is bound or the radio is
 * switched on.</p>
 */
public record ListenRetryPolicy(int maxRetries, Duration retryDelay)
{
    /**
     * Canonical constructor with validation.
     */
    public ListenRetryPolicy {
        Objects.requireNonNull(retryDelay, "retryDelay");

        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be non-negative");
        }
    }

    /**
     * No automatic retry. A failed listen leaves the manager in
     * {@code CONNECTION_ERROR} until something else re-arms it.
     */
    public static ListenRetryPolicy disabled() {
        return new ListenRetryPolicy(0, Duration.ZERO);
    }

    /**
     * Retry up to {@code maxRetries} consecutive failures, {@code retryDelay} apart.
     */
    public static ListenRetryPolicy of(int maxRetries, Duration retryDelay) {
        return new ListenRetryPolicy(maxRetries, retryDelay);
    }

    public boolean enabled() {
        return maxRetries > 0;
    }

    /**
     * Whether a listen that has now failed {@code consecutiveFailures} times in a
     * row may be retried.
     */
    public boolean allowsRetry(int consecutiveFailures) {
        return consecutiveFailures <= maxRetries;
    }
}
