// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.strategy;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;
import software.amazon.retry.validation.ParameterValidator;

/**
 * Generates the delays that pace a sequence of attempts.
 *
 * <p>A strategy is a finite, pull-based sequence: each call to {@link #tryNext()} consumes one attempt from the budget
 * and returns the jittered delay to wait if that attempt fails. Once {@code maxAttempts} delays have been handed out
 * the sequence is exhausted and stays exhausted. The only way to restart is to build a new instance.
 *
 * <p>Instances are not thread safe and must be owned by a single retry loop.
 */
public abstract class RetryStrategy {

    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    private final int maxAttempts;
    private final Jitterer jitterer;
    private int attemptCount;

    protected RetryStrategy(int maxAttempts, Jitterer jitterer) {
        this.maxAttempts = maxAttempts;
        this.jitterer = jitterer;
    }

    /**
     * Computes the raw (pre-jitter) delay for the current attempt.
     *
     * <p>May depend on {@link #getAttemptCount()}; call it at most once per attempt.
     *
     * @return the raw delay
     */
    public abstract Duration next();

    /**
     * Pulls the next delay of the sequence.
     *
     * @return the jittered delay for the attempt just started, or empty once the attempt budget is spent
     */
    public final Optional<Duration> tryNext() {
        if (attemptCount >= maxAttempts) {
            return Optional.empty();
        }
        attemptCount++;
        return Optional.of(jitterer.apply(next()));
    }

    /** @return true when no further delay will be produced */
    public final boolean isExhausted() {
        return attemptCount >= maxAttempts;
    }

    /** @return the number of delays handed out so far, which is the 1-based number of the current attempt */
    public final int getAttemptCount() {
        return attemptCount;
    }

    public final int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Options shared by every strategy.
     *
     * @param <B> the concrete builder type, for method chaining
     */
    public abstract static class Builder<B extends Builder<B>> {
        int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        double jitterSpread;
        Supplier<? extends RandomGenerator> randomSupplier;

        /**
         * Sets the total number of attempts, including the first one.
         *
         * @param maxAttempts zero or more, defaults to {@value RetryStrategy#DEFAULT_MAX_ATTEMPTS}
         * @return this builder for method chaining
         */
        public B maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return self();
        }

        /**
         * Sets the jitter spread.
         *
         * @param jitterSpread fraction in [0, 1), defaults to 0 (no jitter)
         * @return this builder for method chaining
         */
        public B jitterSpread(double jitterSpread) {
            this.jitterSpread = jitterSpread;
            return self();
        }

        /**
         * Sets the random source used for jitter.
         *
         * <p>Every strategy built afterwards, including those of a {@link #toFactory() factory}, draws from this one
         * instance. If the factory is shared between threads the generator must be thread safe; use
         * {@link #randomSupplier(Supplier)} otherwise.
         *
         * @param random the random source, or null to use the building thread's {@link ThreadLocalRandom}
         * @return this builder for method chaining
         */
        public B random(RandomGenerator random) {
            this.randomSupplier = random != null ? () -> random : null;
            return self();
        }

        /**
         * Sets a supplier of random sources used for jitter. It is called once per built strategy, in the building
         * thread, so that each strategy can own its generator.
         *
         * @param randomSupplier the supplier, or null to use the building thread's {@link ThreadLocalRandom}
         * @return this builder for method chaining
         */
        public B randomSupplier(Supplier<? extends RandomGenerator> randomSupplier) {
            this.randomSupplier = randomSupplier;
            return self();
        }

        /**
         * Builds a single strategy instance.
         *
         * @return a new strategy
         * @throws software.amazon.retry.exception.RetryConfigurationException if any option is invalid
         */
        public abstract RetryStrategy build();

        /**
         * Validates the current options and captures them in a factory. Changing this builder afterwards does not
         * affect the returned factory.
         *
         * @return a factory building a fresh strategy per call
         * @throws software.amazon.retry.exception.RetryConfigurationException if any option is invalid
         */
        public abstract StrategyFactory toFactory();

        protected abstract B self();

        void validateCommon() {
            ParameterValidator.validateNonNegativeInteger(maxAttempts, "maxAttempts");
            ParameterValidator.validateJitterSpread(jitterSpread, "jitterSpread");
        }

        Jitterer jitterer() {
            if (jitterSpread == 0.0) {
                return Jitterer.NONE;
            }
            return Jitterer.create(
                    jitterSpread, randomSupplier != null ? randomSupplier.get() : ThreadLocalRandom.current());
        }
    }
}
