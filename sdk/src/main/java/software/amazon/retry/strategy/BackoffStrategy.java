// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.strategy;

import java.time.Duration;
import software.amazon.retry.validation.ParameterValidator;

/**
 * Exponential backoff with a ceiling.
 *
 * <p>The delay for attempt {@code k} (1-based) is {@code min(startInterval * 2^k, maxInterval)}. Once the ceiling is
 * reached the strategy stops growing and returns {@code maxInterval} for every remaining attempt.
 */
public final class BackoffStrategy extends RetryStrategy {

    public static final Duration DEFAULT_START_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(60);

    private final Duration startInterval;
    private final Duration maxInterval;
    private Duration currentInterval;

    private BackoffStrategy(int maxAttempts, Jitterer jitterer, Duration startInterval, Duration maxInterval) {
        super(maxAttempts, jitterer);
        this.startInterval = startInterval;
        this.maxInterval = maxInterval;
        this.currentInterval = startInterval;
    }

    @Override
    public Duration next() {
        if (currentInterval.compareTo(maxInterval) < 0) {
            currentInterval = grow(getAttemptCount());
        }
        return currentInterval.compareTo(maxInterval) < 0 ? currentInterval : maxInterval;
    }

    private Duration grow(int exponent) {
        long startNanos = startInterval.toNanos();
        long maxNanos = maxInterval.toNanos();
        // startNanos * 2^exponent would reach the ceiling or overflow
        if (exponent >= Long.SIZE - 1 || startNanos > (maxNanos >> exponent)) {
            return maxInterval;
        }
        return Duration.ofNanos(startNanos << exponent);
    }

    public Duration getStartInterval() {
        return startInterval;
    }

    public Duration getMaxInterval() {
        return maxInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link BackoffStrategy}. */
    public static final class Builder extends RetryStrategy.Builder<Builder> {
        private Duration startInterval = DEFAULT_START_INTERVAL;
        private Duration maxInterval = DEFAULT_MAX_INTERVAL;

        private Builder() {}

        /**
         * Sets the base of the exponential growth.
         *
         * @param startInterval a positive duration, defaults to 1 second
         * @return this builder for method chaining
         */
        public Builder startInterval(Duration startInterval) {
            this.startInterval = startInterval;
            return this;
        }

        /**
         * Sets the ceiling of the delay.
         *
         * @param maxInterval a positive duration, defaults to 60 seconds
         * @return this builder for method chaining
         */
        public Builder maxInterval(Duration maxInterval) {
            this.maxInterval = maxInterval;
            return this;
        }

        @Override
        public BackoffStrategy build() {
            validate();
            return new BackoffStrategy(maxAttempts, jitterer(), startInterval, maxInterval);
        }

        @Override
        public StrategyFactory toFactory() {
            validate();
            var snapshot = new Builder()
                    .startInterval(startInterval)
                    .maxInterval(maxInterval)
                    .maxAttempts(maxAttempts)
                    .jitterSpread(jitterSpread)
                    .randomSupplier(randomSupplier);
            return snapshot::build;
        }

        @Override
        protected Builder self() {
            return this;
        }

        private void validate() {
            ParameterValidator.validateDuration(startInterval, "startInterval");
            ParameterValidator.validateDuration(maxInterval, "maxInterval");
            validateCommon();
        }
    }
}
