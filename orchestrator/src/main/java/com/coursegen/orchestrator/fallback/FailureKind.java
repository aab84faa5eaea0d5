package com.coursegen.orchestrator.fallback;

/**
 * Why a producer did not deliver a value.
 *
 * The kind, not the message text, decides what a {@link FallbackChain} does next.
 */
public enum FailureKind {

    /** Transient network failure or non-2xx answer. Retryable. */
    PROVIDER(true),

    /** Missing credential or capability. Skips the tier at once, never retried. */
    CONFIGURATION(false),

    /** Answer arrived but was unusable, even after repair. Not retried. */
    VALIDATION(false),

    /** Tier deadline or polling budget exceeded. Retryable. */
    TIMEOUT(true);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
