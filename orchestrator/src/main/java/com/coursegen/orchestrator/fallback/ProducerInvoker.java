package com.coursegen.orchestrator.fallback;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one producer attempt under its tier deadline and records metrics.
 *
 * Attempts with a deadline run on a separate pool so the caller can stop
 * waiting regardless of how the provider behaves; the worker is interrupted
 * on timeout. Every attempt is timed and counted:
 * <pre>
 *   coursegen.fallback.attempts{chain, producer, outcome="ok|provider|configuration|validation|timeout"}
 *   coursegen.fallback.duration{chain, producer}
 * </pre>
 */
public class ProducerInvoker {

    private final ExecutorService calls;
    private final MeterRegistry   meterRegistry;

    public ProducerInvoker(ExecutorService calls, MeterRegistry meterRegistry) {
        this.calls         = calls;
        this.meterRegistry = meterRegistry;
    }

    public <I, O> ProducerResult<O> invoke(String chain, Producer<I, O> producer, I input, TierPolicy policy) {
        Timer.Sample sample = Timer.start(meterRegistry);
        ProducerResult<O> result = policy.hasDeadline()
                ? invokeWithDeadline(producer, input, policy.timeout())
                : invokeInline(producer, input);
        sample.stop(meterRegistry.timer("coursegen.fallback.duration",
                "chain", chain, "producer", producer.name()));
        count(chain, producer.name(), result.isOk() ? "ok" : result.failureKind().name().toLowerCase(Locale.ROOT));
        return result;
    }

    /** Counts a terminal-tier synthesis, which never goes through {@link #invoke}. */
    void recordTerminal(String chain, String producer) {
        count(chain, producer, "ok");
    }

    private void count(String chain, String producer, String outcome) {
        meterRegistry.counter("coursegen.fallback.attempts",
                "chain", chain, "producer", producer, "outcome", outcome).increment();
    }

    private <I, O> ProducerResult<O> invokeInline(Producer<I, O> producer, I input) {
        try {
            return nonNull(producer.produce(input), producer);
        } catch (RuntimeException e) {
            return ProducerResult.providerError("Unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private <I, O> ProducerResult<O> invokeWithDeadline(Producer<I, O> producer, I input, Duration timeout) {
        // Carry the caller's logging context (jobId, stage, lesson) onto the pool thread.
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<ProducerResult<O>> future = calls.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return producer.produce(input);
            } finally {
                MDC.clear();
            }
        });
        try {
            return nonNull(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS), producer);
        } catch (TimeoutException e) {
            future.cancel(true);
            return ProducerResult.timedOut("No answer within " + timeout.toSeconds() + " s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ProducerResult.providerError("Unexpected " + cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ProducerResult.providerError("Interrupted while waiting for " + producer.name());
        }
    }

    private static <O> ProducerResult<O> nonNull(ProducerResult<O> result, Producer<?, O> producer) {
        return result != null ? result
                : ProducerResult.providerError(producer.name() + " returned no result");
    }
}
