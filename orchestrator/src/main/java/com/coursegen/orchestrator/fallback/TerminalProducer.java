package com.coursegen.orchestrator.fallback;

/**
 * Last tier of every chain: local, deterministic synthesis with no provider
 * call and no credential (a placeholder image, a sine-wave clip, a templated
 * text block).
 *
 * It returns the value directly rather than a {@link ProducerResult}, so a
 * chain built on it always yields a value. Only a local fault such as a full
 * disk can make it throw, and that propagates to the caller.
 */
@FunctionalInterface
public interface TerminalProducer<I, O> {

    O synthesize(I input);
}
