// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.execution;

/** Why a retry sequence stopped before success or exhaustion. */
public enum CancellationReason {
    /** The caller's {@link CancellationSignal} was tripped. */
    CANCELLED,

    /** The configured deadline passed. */
    DEADLINE_EXCEEDED,

    /** The running thread was interrupted, either while sleeping or inside the operation. */
    INTERRUPTED
}
