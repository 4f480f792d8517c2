// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.validation;

import java.time.Duration;
import software.amazon.retry.exception.RetryConfigurationException;

/**
 * Utility class for validating input parameters in the Retry SDK.
 *
 * <p>Provides common validation methods to ensure consistent error messages and validation logic across the SDK. Every
 * method throws {@link RetryConfigurationException}.
 */
public final class ParameterValidator {

    /** Longest accepted delay: the nanosecond count must fit in a {@code long}. */
    public static final Duration MAX_DURATION = Duration.ofNanos(Long.MAX_VALUE);

    private ParameterValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a value is present.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @return the value, for inline use in constructors
     * @throws RetryConfigurationException if value is null
     */
    public static <T> T validateNotNull(T value, String parameterName) {
        if (value == null) {
            throw new RetryConfigurationException(parameterName + " cannot be null");
        }
        return value;
    }

    /**
     * Validates that a duration is strictly positive and no longer than {@link #MAX_DURATION}.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws RetryConfigurationException if duration is null, zero, negative or too long
     */
    public static void validateDuration(Duration duration, String parameterName) {
        validateNotNull(duration, parameterName);
        if (duration.isZero() || duration.isNegative()) {
            throw new RetryConfigurationException(parameterName + " must be positive, got: " + duration);
        }
        if (duration.compareTo(MAX_DURATION) > 0) {
            throw new RetryConfigurationException(
                    parameterName + " must not exceed " + MAX_DURATION + ", got: " + duration);
        }
    }

    /**
     * Validates that an optional duration (if provided) is strictly positive.
     *
     * @param duration the duration to validate (can be null)
     * @param parameterName the name of the parameter (for error messages)
     * @throws RetryConfigurationException if duration is non-null and not positive
     */
    public static void validateOptionalDuration(Duration duration, String parameterName) {
        if (duration != null) {
            validateDuration(duration, parameterName);
        }
    }

    /**
     * Validates that an attempt budget is not negative. Zero is allowed and means no attempt is made.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws RetryConfigurationException if value is negative
     */
    public static void validateNonNegativeInteger(int value, String parameterName) {
        if (value < 0) {
            throw new RetryConfigurationException(parameterName + " must not be negative, got: " + value);
        }
    }

    /**
     * Validates that a jitter spread lies in [0, 1).
     *
     * @param spread the spread to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws RetryConfigurationException if spread is NaN, negative, or at least 1
     */
    public static void validateJitterSpread(double spread, String parameterName) {
        if (!(spread >= 0.0 && spread < 1.0)) {
            throw new RetryConfigurationException(parameterName + " must be in [0, 1), got: " + spread);
        }
    }
}
