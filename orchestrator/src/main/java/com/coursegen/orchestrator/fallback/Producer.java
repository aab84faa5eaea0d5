package com.coursegen.orchestrator.fallback;

import java.util.function.Function;

/**
 * One candidate implementation within a {@link FallbackChain}.
 *
 * Implementations report failure through {@link ProducerResult#failure}; a
 * missing credential must come back as {@link FailureKind#CONFIGURATION}
 * before any network work starts.
 */
public interface Producer<I, O> {

    /** Stable name, recorded as {@code provider_used} when this tier wins. */
    String name();

    ProducerResult<O> produce(I input);

    static <I, O> Producer<I, O> of(String name, Function<I, ProducerResult<O>> body) {
        return new Producer<>() {
            @Override public String name() { return name; }
            @Override public ProducerResult<O> produce(I input) { return body.apply(input); }
        };
    }
}
