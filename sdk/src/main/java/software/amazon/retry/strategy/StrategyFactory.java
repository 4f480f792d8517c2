// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.strategy;

/**
 * Creates a fresh {@link RetryStrategy} for each retried invocation.
 *
 * <p>Strategies are stateful and must never be shared between two invocations, so the retry driver asks its factory for
 * a new instance every time it starts.
 */
@FunctionalInterface
public interface StrategyFactory {

    /** @return a new strategy with its attempt counter at zero */
    RetryStrategy create();
}
