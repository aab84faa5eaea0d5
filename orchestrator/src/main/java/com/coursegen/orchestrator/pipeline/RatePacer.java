package com.coursegen.orchestrator.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Spaces external provider calls by a fixed interval.
 *
 * Two ways to use it, sharing one record of the last reserved call start:
 * <ul>
 *   <li>{@link #pace()} after a call: waits until {@code max(now, last) + interval}.
 *       Used by sequential runs.</li>
 *   <li>{@link #acquire()} before a call: waits until {@code max(now, last + interval)},
 *       so the first caller goes at once and every later one starts at least one
 *       interval after the previous start. Used when lessons run concurrently.</li>
 * </ul>
 * Reservations are serialized, so the interval bounds the aggregate call rate
 * rather than each caller's own rate.
 */
public class RatePacer {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration interval;
    private final Clock    clock;
    private final Sleeper  sleeper;

    private Instant lastSlot = Instant.MIN;

    public RatePacer(Duration interval) {
        this(interval, Clock.systemUTC(), d -> Thread.sleep(d.toMillis()));
    }

    public RatePacer(Duration interval, Clock clock, Sleeper sleeper) {
        this.interval = interval == null ? Duration.ZERO : interval;
        this.clock    = clock;
        this.sleeper  = sleeper;
    }

    public static RatePacer disabled() {
        return new RatePacer(Duration.ZERO);
    }

    public boolean isEnabled() {
        return !interval.isZero() && !interval.isNegative();
    }

    public Duration interval() {
        return interval;
    }

    /**
     * Blocks until this caller's slot. Returns early, with the interrupt flag
     * set, if the thread is interrupted while waiting.
     */
    public void pace() {
        if (!isEnabled()) return;
        sleep(reserve());
    }

    /**
     * Blocks until this caller may start its call. Interrupts are handled as in
     * {@link #pace()}.
     */
    public void acquire() {
        if (!isEnabled()) return;
        sleep(reserveStart());
    }

    private void sleep(Duration wait) {
        if (wait.isZero() || wait.isNegative()) return;
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Claims the next slot and returns how long the caller has to wait for it. */
    synchronized Duration reserve() {
        Instant now  = clock.instant();
        Instant base = lastSlot.isAfter(now) ? lastSlot : now;
        Instant slot = base.plus(interval);
        lastSlot = slot;
        return Duration.between(now, slot);
    }

    /** Claims the earliest start at least one interval after the last one. */
    synchronized Duration reserveStart() {
        Instant now  = clock.instant();
        Instant next = lastSlot.plus(interval);
        Instant slot = next.isAfter(now) ? next : now;
        lastSlot = slot;
        return Duration.between(now, slot);
    }
}
