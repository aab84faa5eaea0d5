package com.coursegen.orchestrator.fallback;

import java.util.Objects;

/**
 * Tagged outcome of one producer call: either a value or a classified failure.
 *
 * Producers return this instead of throwing, so the chain can switch on
 * {@link #failureKind()} rather than catching exceptions.
 */
public final class ProducerResult<T> {

    private final T           value;
    private final FailureKind failureKind;
    private final String      reason;

    private ProducerResult(T value, FailureKind failureKind, String reason) {
        this.value       = value;
        this.failureKind = failureKind;
        this.reason      = reason;
    }

    public static <T> ProducerResult<T> ok(T value) {
        return new ProducerResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> ProducerResult<T> failure(FailureKind kind, String reason) {
        return new ProducerResult<>(null, Objects.requireNonNull(kind, "kind"),
                reason == null ? kind.name() : reason);
    }

    public static <T> ProducerResult<T> misconfigured(String reason) {
        return failure(FailureKind.CONFIGURATION, reason);
    }

    public static <T> ProducerResult<T> invalid(String reason) {
        return failure(FailureKind.VALIDATION, reason);
    }

    public static <T> ProducerResult<T> providerError(String reason) {
        return failure(FailureKind.PROVIDER, reason);
    }

    public static <T> ProducerResult<T> timedOut(String reason) {
        return failure(FailureKind.TIMEOUT, reason);
    }

    public boolean isOk() {
        return failureKind == null;
    }

    /** @throws IllegalStateException if this is a failure */
    public T value() {
        if (!isOk()) {
            throw new IllegalStateException("No value: " + failureKind + " " + reason);
        }
        return value;
    }

    /** Null for a successful result. */
    public FailureKind failureKind() {
        return failureKind;
    }

    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + failureKind + ": " + reason + ")";
    }
}
