package com.coursegen.orchestrator.fallback;

import java.time.Duration;

/**
 * Execution limits for one tier.
 *
 * @param timeout     wall-clock budget for a single attempt; zero runs the
 *                    producer inline without a deadline
 * @param maxAttempts attempts for retryable failures (PROVIDER, TIMEOUT)
 */
public record TierPolicy(Duration timeout, int maxAttempts) {

    public TierPolicy {
        if (timeout == null || timeout.isNegative()) timeout = Duration.ZERO;
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public static TierPolicy of(Duration timeout) {
        return new TierPolicy(timeout, 1);
    }

    public static TierPolicy of(Duration timeout, int maxAttempts) {
        return new TierPolicy(timeout, maxAttempts);
    }

    /** Local work that needs no deadline. */
    public static TierPolicy inline() {
        return new TierPolicy(Duration.ZERO, 1);
    }

    public boolean hasDeadline() {
        return !timeout.isZero();
    }
}
