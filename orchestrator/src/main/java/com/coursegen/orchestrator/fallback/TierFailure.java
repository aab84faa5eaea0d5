package com.coursegen.orchestrator.fallback;

import java.time.Duration;

/**
 * One failed attempt inside a chain, kept for the artifact's failure log.
 */
public record TierFailure(
        int         tier,
        String      producer,
        int         attempt,
        FailureKind kind,
        String      reason,
        Duration    elapsed
) {
    public String summary() {
        return "tier %d %s attempt %d: %s (%s, %d ms)"
                .formatted(tier, producer, attempt, kind, reason, elapsed.toMillis());
    }
}
