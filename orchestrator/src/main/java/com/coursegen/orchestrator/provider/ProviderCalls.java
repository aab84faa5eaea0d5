package com.coursegen.orchestrator.provider;

import com.coursegen.orchestrator.fallback.ProducerResult;

/**
 * Edge between exception-throwing provider clients and tagged producer results.
 */
public final class ProviderCalls {

    @FunctionalInterface
    public interface Call<T> {
        T run();
    }

    private ProviderCalls() {}

    /**
     * Run a provider call and convert a {@link ProviderException} into a failure
     * result carrying the same {@link com.coursegen.orchestrator.fallback.FailureKind}.
     */
    public static <T> ProducerResult<T> attempt(Call<T> call) {
        try {
            T value = call.run();
            return value != null ? ProducerResult.ok(value) : ProducerResult.invalid("Provider returned nothing");
        } catch (ProviderException e) {
            return ProducerResult.failure(e.kind(), e.getMessage());
        }
    }
}
