// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.strategy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;
import software.amazon.retry.validation.ParameterValidator;

/**
 * Randomizes retry delays to prevent thundering herd problems.
 *
 * <p>Jitter spreads retries of many clients over an interval around the calculated delay so that they do not hit a
 * recovering service at the same moment. With a spread {@code s}, a delay {@code d} becomes a value in {@code [d * (1 -
 * s), d * (1 + s))}.
 */
@FunctionalInterface
public interface Jitterer {

    /** No jitter - use exact calculated delay. Never touches a random source. */
    Jitterer NONE = interval -> interval;

    /**
     * Applies jitter to a delay.
     *
     * @param interval the calculated delay
     * @return the randomized delay
     */
    Duration apply(Duration interval);

    /**
     * Creates a jitterer drawing from the calling thread's {@link ThreadLocalRandom}.
     *
     * @param spread fraction in [0, 1); 0 disables jitter
     * @return the jitterer
     */
    static Jitterer create(double spread) {
        return create(spread, ThreadLocalRandom.current());
    }

    /**
     * Creates a jitterer drawing one value from {@code random} per call.
     *
     * @param spread fraction in [0, 1); 0 disables jitter
     * @param random the random source, not consulted when spread is 0
     * @return the jitterer
     * @throws software.amazon.retry.exception.RetryConfigurationException if spread is outside [0, 1)
     */
    static Jitterer create(double spread, RandomGenerator random) {
        ParameterValidator.validateJitterSpread(spread, "jitterSpread");
        if (spread == 0.0) {
            return NONE;
        }
        ParameterValidator.validateNotNull(random, "random");

        return interval -> {
            // uniform in [-1, 1)
            double factor = random.nextDouble() * 2 - 1;
            // toNanos() overflows past ~292 years
            double offsetNanos = factor * spread * (interval.getSeconds() * 1e9 + interval.getNano());
            // truncation towards zero keeps the result inside the half-open range
            return interval.plusSeconds((long) (offsetNanos / 1e9)).plusNanos((long) (offsetNanos % 1e9));
        };
    }
}
