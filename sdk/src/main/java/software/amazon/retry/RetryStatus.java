// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry;

/** Terminal state of a retried invocation. */
public enum RetryStatus {
    /** An attempt returned normally. */
    SUCCEEDED,

    /** Every attempt failed with a retryable failure. */
    EXHAUSTED,

    /** The sequence was stopped by a cancellation signal, a deadline or a thread interrupt. */
    CANCELLED
}
