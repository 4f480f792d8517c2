// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry;

import java.util.List;
import java.util.Optional;
import software.amazon.retry.exception.RetryCancelledException;
import software.amazon.retry.exception.RetryExhaustedException;
import software.amazon.retry.execution.CancellationReason;

/**
 * Result of a retried invocation.
 *
 * <p>A non-successful outcome is a normal result, not an error: callers inspect {@link #getStatus()} or call {@link
 * #orElseThrow()} to turn it into an exception that still carries every recorded failure.
 *
 * @param <T> the operation's result type
 */
public final class RetryOutcome<T> {
    private final RetryStatus status;
    private final String operationName;
    private final T value;
    private final int attempts;
    private final List<Throwable> causes;
    private final CancellationReason cancellationReason;

    private RetryOutcome(
            RetryStatus status,
            String operationName,
            T value,
            int attempts,
            List<? extends Throwable> causes,
            CancellationReason cancellationReason) {
        this.status = status;
        this.operationName = operationName;
        this.value = value;
        this.attempts = attempts;
        this.causes = List.copyOf(causes);
        this.cancellationReason = cancellationReason;
    }

    /**
     * @param value the value returned by the successful attempt, may be null
     * @param attempts number of attempts made, including the successful one
     * @param causes failures recorded before the successful attempt
     */
    public static <T> RetryOutcome<T> succeeded(
            String operationName, T value, int attempts, List<? extends Throwable> causes) {
        return new RetryOutcome<>(RetryStatus.SUCCEEDED, operationName, value, attempts, causes, null);
    }

    /** @param causes one failure per attempt, in attempt order */
    public static <T> RetryOutcome<T> exhausted(String operationName, List<? extends Throwable> causes) {
        return new RetryOutcome<>(RetryStatus.EXHAUSTED, operationName, null, causes.size(), causes, null);
    }

    /**
     * @param attempts number of attempts started before cancellation
     * @param causes failures recorded before cancellation
     */
    public static <T> RetryOutcome<T> cancelled(
            String operationName, CancellationReason reason, int attempts, List<? extends Throwable> causes) {
        return new RetryOutcome<>(RetryStatus.CANCELLED, operationName, null, attempts, causes, reason);
    }

    public RetryStatus getStatus() {
        return status;
    }

    public boolean isSucceeded() {
        return status == RetryStatus.SUCCEEDED;
    }

    /**
     * @return the value returned by the successful attempt
     * @throws IllegalStateException if the outcome is not {@link RetryStatus#SUCCEEDED}
     */
    public T getValue() {
        if (!isSucceeded()) {
            throw new IllegalStateException("No value for a " + status + " outcome of " + operationName);
        }
        return value;
    }

    /** @return number of times the operation was invoked */
    public int getAttempts() {
        return attempts;
    }

    /** @return every recorded retryable failure, in attempt order */
    public List<Throwable> getCauses() {
        return causes;
    }

    public Optional<Throwable> getLastCause() {
        return causes.isEmpty() ? Optional.empty() : Optional.of(causes.get(causes.size() - 1));
    }

    /** @return why the sequence was cancelled, or null unless the status is {@link RetryStatus#CANCELLED} */
    public CancellationReason getCancellationReason() {
        return cancellationReason;
    }

    /**
     * Returns the value of a successful outcome or throws.
     *
     * @return the value returned by the successful attempt
     * @throws RetryExhaustedException if every attempt failed
     * @throws RetryCancelledException if the sequence was cancelled
     */
    public T orElseThrow() {
        return switch (status) {
            case SUCCEEDED -> value;
            case EXHAUSTED -> throw new RetryExhaustedException(operationName, attempts, causes);
            case CANCELLED -> throw new RetryCancelledException(operationName, cancellationReason, causes);
        };
    }

    @Override
    public String toString() {
        return switch (status) {
            case SUCCEEDED -> String.format("RetryOutcome{%s succeeded after %d attempt(s)}", operationName, attempts);
            case EXHAUSTED -> String.format("RetryOutcome{%s exhausted after %d attempt(s)}", operationName, attempts);
            case CANCELLED -> String.format("RetryOutcome{%s cancelled: %s}", operationName, cancellationReason);
        };
    }
}
