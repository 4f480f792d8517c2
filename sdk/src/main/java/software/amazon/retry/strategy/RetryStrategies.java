// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.strategy;

import java.time.Duration;

/**
 * Factory class for creating common retry strategies.
 *
 * <p>This class provides preset strategy factories for common use cases, as well as shortcuts for creating custom
 * linear and exponential backoff strategies. All parameters are validated when the factory is created.
 */
public final class RetryStrategies {

    private RetryStrategies() {}

    /** Preset strategy factories for common use cases. */
    public static final class Presets {

        private Presets() {}

        /**
         * Default strategy: 10 total attempts, exponential backoff starting at 1 second (first delay 2 seconds), capped
         * at 60 seconds, no jitter.
         */
        public static final StrategyFactory DEFAULT = BackoffStrategy.builder().toFactory();

        /** Single attempt, no retry. Use this for operations that should not be retried. */
        public static final StrategyFactory NO_RETRY = LinearStrategy.builder()
                .interval(Duration.ofMillis(1))
                .maxAttempts(1)
                .toFactory();
    }

    /**
     * Creates a factory for linear strategies with the default attempt budget and no jitter.
     *
     * @param interval fixed delay between attempts
     * @return factory of {@link LinearStrategy}
     */
    public static StrategyFactory linear(Duration interval) {
        return linear(interval, RetryStrategy.DEFAULT_MAX_ATTEMPTS, 0.0);
    }

    /**
     * Creates a factory for linear strategies.
     *
     * @param interval fixed delay between attempts
     * @param maxAttempts maximum number of attempts (including initial attempt)
     * @param jitterSpread jitter spread in [0, 1)
     * @return factory of {@link LinearStrategy}
     */
    public static StrategyFactory linear(Duration interval, int maxAttempts, double jitterSpread) {
        return LinearStrategy.builder()
                .interval(interval)
                .maxAttempts(maxAttempts)
                .jitterSpread(jitterSpread)
                .toFactory();
    }

    /**
     * Creates a factory for exponential backoff strategies.
     *
     * <p>The delay for attempt {@code k} is {@code min(startInterval * 2^k, maxInterval)}.
     *
     * @param startInterval base of the exponential growth
     * @param maxInterval ceiling of the delay
     * @param maxAttempts maximum number of attempts (including initial attempt)
     * @param jitterSpread jitter spread in [0, 1)
     * @return factory of {@link BackoffStrategy}
     */
    public static StrategyFactory backoff(
            Duration startInterval, Duration maxInterval, int maxAttempts, double jitterSpread) {
        return BackoffStrategy.builder()
                .startInterval(startInterval)
                .maxInterval(maxInterval)
                .maxAttempts(maxAttempts)
                .jitterSpread(jitterSpread)
                .toFactory();
    }
}
