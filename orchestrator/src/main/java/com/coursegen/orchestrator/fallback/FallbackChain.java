package com.coursegen.orchestrator.fallback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of producers for one artifact type, tried until one succeeds.
 *
 * <p>Tier 1..n-1 are ordinary {@link Producer}s; tier n is a
 * {@link TerminalProducer} and the builder refuses to build without one, so
 * {@link #execute} always returns a value. Per failed attempt the chain
 * switches on the {@link FailureKind}:
 * <ul>
 *   <li>CONFIGURATION, VALIDATION: move to the next tier at once.</li>
 *   <li>PROVIDER, TIMEOUT: retry the same tier while its policy allows, then move on.</li>
 * </ul>
 * If the calling thread is interrupted, remaining external tiers are skipped
 * and the terminal producer answers.
 */
public final class FallbackChain<I, O> {

    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    private final String                 name;
    private final List<Tier<I, O>>       tiers;
    private final String                 terminalName;
    private final TerminalProducer<I, O> terminal;
    private final ProducerInvoker        invoker;

    private FallbackChain(Builder<I, O> b) {
        this.name         = b.name;
        this.tiers        = List.copyOf(b.tiers);
        this.terminalName = b.terminalName;
        this.terminal     = b.terminal;
        this.invoker      = b.invoker;
    }

    public static <I, O> Builder<I, O> builder(String name, ProducerInvoker invoker) {
        return new Builder<>(name, invoker);
    }

    public String name() {
        return name;
    }

    /** Number of tiers including the terminal one. */
    public int tierCount() {
        return tiers.size() + 1;
    }

    public ChainResult<O> execute(I input) {
        List<TierFailure> failures = new ArrayList<>();
        int attempts = 0;

        for (int i = 0; i < tiers.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[{}] interrupted, skipping to terminal producer '{}'", name, terminalName);
                break;
            }
            Tier<I, O> tier = tiers.get(i);
            int tierNumber = i + 1;
            int max = tier.policy().maxAttempts();

            for (int attempt = 1; attempt <= max; attempt++) {
                attempts++;
                long started = System.nanoTime();
                ProducerResult<O> result = invoker.invoke(name, tier.producer(), input, tier.policy());
                if (result.isOk()) {
                    if (tierNumber > 1) {
                        log.info("[{}] tier {}/{} '{}' succeeded after {} failed attempt(s)",
                                name, tierNumber, tierCount(), tier.producer().name(), failures.size());
                    }
                    return new ChainResult<>(result.value(), tier.producer().name(), tierNumber,
                            attempts, tierNumber > 1, failures);
                }

                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                failures.add(new TierFailure(tierNumber, tier.producer().name(), attempt,
                        result.failureKind(), result.reason(), elapsed));
                log.warn("[{}] tier {}/{} '{}' failed (attempt {}/{}, {}): {}",
                        name, tierNumber, tierCount(), tier.producer().name(),
                        attempt, max, result.failureKind(), result.reason());

                boolean retry = switch (result.failureKind()) {
                    case CONFIGURATION, VALIDATION -> false;
                    case PROVIDER, TIMEOUT -> attempt < max && !Thread.currentThread().isInterrupted();
                };
                if (!retry) break;
            }
        }

        attempts++;
        O value = terminal.synthesize(input);
        if (value == null) {
            throw new IllegalStateException("Terminal producer '" + terminalName + "' of chain '"
                    + name + "' returned null");
        }
        invoker.recordTerminal(name, terminalName);
        int tierNumber = tierCount();
        if (tierNumber > 1) {
            log.info("[{}] fell back to terminal producer '{}'", name, terminalName);
        }
        return new ChainResult<>(value, terminalName, tierNumber, attempts, tierNumber > 1, failures);
    }

    private record Tier<I, O>(Producer<I, O> producer, TierPolicy policy) {}

    public static final class Builder<I, O> {

        private final String                 name;
        private final ProducerInvoker        invoker;
        private final List<Tier<I, O>>       tiers = new ArrayList<>();
        private String                       terminalName;
        private TerminalProducer<I, O>       terminal;

        private Builder(String name, ProducerInvoker invoker) {
            this.name    = Objects.requireNonNull(name, "name");
            this.invoker = Objects.requireNonNull(invoker, "invoker");
        }

        public Builder<I, O> tier(Producer<I, O> producer, TierPolicy policy) {
            tiers.add(new Tier<>(Objects.requireNonNull(producer, "producer"),
                                 Objects.requireNonNull(policy, "policy")));
            return this;
        }

        public Builder<I, O> terminal(String producerName, TerminalProducer<I, O> producer) {
            this.terminalName = Objects.requireNonNull(producerName, "producerName");
            this.terminal     = Objects.requireNonNull(producer, "producer");
            return this;
        }

        /** @throws IllegalStateException if no terminal producer was given */
        public FallbackChain<I, O> build() {
            if (terminal == null) {
                throw new IllegalStateException("Fallback chain '" + name + "' must end with a terminal producer");
            }
            return new FallbackChain<>(this);
        }
    }
}
