// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry;

import java.util.concurrent.Callable;
import java.util.function.Supplier;
import software.amazon.retry.execution.RetryLoop;
import software.amazon.retry.strategy.StrategyFactory;
import software.amazon.retry.validation.ParameterValidator;

/**
 * Entry point of the SDK: runs operations under a {@link RetryConfig}.
 *
 * <p>A Retrier is immutable and can be shared between threads. Every call builds its own strategy from the configured
 * {@link StrategyFactory}, so concurrent calls never share retry state. A jitter source set with
 * {@link software.amazon.retry.strategy.RetryStrategy.Builder#random} is the exception: it must be thread safe, or be
 * given as a {@link software.amazon.retry.strategy.RetryStrategy.Builder#randomSupplier supplier} instead.
 *
 * <pre>{@code
 * Retrier retrier = Retrier.create(RetryConfig.builder()
 *     .strategyFactory(RetryStrategies.linear(Duration.ofMillis(500)))
 *     .build());
 *
 * RetryOutcome<String> outcome = retrier.execute(() -> client.fetch(key));
 * String value = outcome.orElseThrow();
 * }</pre>
 */
public final class Retrier {
    private final RetryConfig config;

    private Retrier(RetryConfig config) {
        this.config = config;
    }

    public static Retrier create() {
        return new Retrier(RetryConfig.defaultConfig());
    }

    public static Retrier create(RetryConfig config) {
        return new Retrier(ParameterValidator.validateNotNull(config, "config"));
    }

    /**
     * Runs {@code operation} with a fresh strategy from {@code strategyFactory}, retrying failures accepted by {@code
     * failureMatcher}.
     *
     * @param operation the operation to invoke
     * @param strategyFactory produces the strategy pacing this invocation
     * @param failureMatcher selects retryable failures
     * @return the outcome; a non-retryable failure is rethrown instead
     */
    public static <T> RetryOutcome<T> runWithRetry(
            Callable<T> operation, StrategyFactory strategyFactory, FailureMatcher failureMatcher) {
        var config = RetryConfig.builder()
                .strategyFactory(ParameterValidator.validateNotNull(strategyFactory, "strategyFactory"))
                .failureMatcher(ParameterValidator.validateNotNull(failureMatcher, "failureMatcher"))
                .build();
        return create(config).execute(operation);
    }

    /**
     * Invokes the operation until it succeeds, the strategy is exhausted, or the sequence is cancelled.
     *
     * <p>A failure rejected by the configured {@link FailureMatcher} is rethrown unchanged, checked exceptions
     * included, without further attempts.
     *
     * @param operation the operation to invoke
     * @return the outcome
     */
    public <T> RetryOutcome<T> execute(Callable<T> operation) {
        ParameterValidator.validateNotNull(operation, "operation");
        return new RetryLoop<>(operation, config).run();
    }

    /**
     * Same as {@link #execute(Callable)} for an operation without a result.
     *
     * @param action the action to invoke
     * @return the outcome, with a null value on success
     */
    public RetryOutcome<Void> run(RetryableAction action) {
        ParameterValidator.validateNotNull(action, "action");
        return execute(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Decorates an operation so that every call of the returned supplier runs it under this retrier.
     *
     * @param operation the operation to decorate
     * @return a supplier starting a new retried invocation per call
     */
    public <T> Supplier<RetryOutcome<T>> wrap(Callable<T> operation) {
        ParameterValidator.validateNotNull(operation, "operation");
        return () -> execute(operation);
    }

    public RetryConfig getConfig() {
        return config;
    }
}
