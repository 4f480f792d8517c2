// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.execution;

/**
 * Polled by the retry loop before each attempt and before each sleep.
 *
 * <p>Implementations are usually tripped from another thread and must publish the change safely.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NEVER = () -> false;

    boolean isCancelled();
}
