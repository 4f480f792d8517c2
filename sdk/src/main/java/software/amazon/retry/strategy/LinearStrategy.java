// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.strategy;

import java.time.Duration;
import software.amazon.retry.validation.ParameterValidator;

/** Waits the same interval after every failed attempt. */
public final class LinearStrategy extends RetryStrategy {
    private final Duration interval;

    private LinearStrategy(int maxAttempts, Jitterer jitterer, Duration interval) {
        super(maxAttempts, jitterer);
        this.interval = interval;
    }

    @Override
    public Duration next() {
        return interval;
    }

    public Duration getInterval() {
        return interval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link LinearStrategy}. The interval has no default and must be set. */
    public static final class Builder extends RetryStrategy.Builder<Builder> {
        private Duration interval;

        private Builder() {}

        /**
         * Sets the fixed delay between attempts.
         *
         * @param interval a positive duration
         * @return this builder for method chaining
         */
        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        @Override
        public LinearStrategy build() {
            validate();
            return new LinearStrategy(maxAttempts, jitterer(), interval);
        }

        @Override
        public StrategyFactory toFactory() {
            validate();
            var snapshot = new Builder()
                    .interval(interval)
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
            ParameterValidator.validateDuration(interval, "interval");
            validateCommon();
        }
    }
}
