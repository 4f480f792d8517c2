// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.exception;

/** Thrown when a strategy, jitter or retry parameter is invalid. Always raised before any attempt runs. */
public class RetryConfigurationException extends IllegalArgumentException {
    public RetryConfigurationException(String message) {
        super(message);
    }
}
