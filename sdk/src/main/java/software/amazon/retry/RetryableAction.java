// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry;

/** A side-effecting operation without a result that may throw. */
@FunctionalInterface
public interface RetryableAction {
    void run() throws Exception;
}
