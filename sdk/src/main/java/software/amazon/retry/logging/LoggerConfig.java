// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.logging;

/** Configuration for RetryLogger behavior. */
public record LoggerConfig(boolean logFailureStackTraces) {

    /** Default configuration: log retryable failures by message only. */
    public static LoggerConfig defaults() {
        return new LoggerConfig(false);
    }

    /** Configuration that logs the full stack trace of every retryable failure. */
    public static LoggerConfig withFailureStackTraces() {
        return new LoggerConfig(true);
    }
}
