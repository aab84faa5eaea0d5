package com.coursegen.orchestrator.pipeline;

/**
 * Cooperative cancellation flag shared between the API thread and the
 * worker driving one job. Checked before every stage and every lesson.
 */
public class CancellationToken {

    private volatile boolean cancelled;
    private volatile String  reason = "Cancelled by user";

    public void cancel(String reason) {
        if (reason != null && !reason.isBlank()) this.reason = reason;
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String reason() {
        return reason;
    }

    /** @throws JobCancelledException if {@link #cancel} has been called */
    public void throwIfCancelled() {
        if (cancelled) throw new JobCancelledException(reason);
    }
}
