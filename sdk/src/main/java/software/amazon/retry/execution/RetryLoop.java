// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.execution;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.retry.RetryConfig;
import software.amazon.retry.RetryOutcome;
import software.amazon.retry.logging.RetryLogger;
import software.amazon.retry.strategy.RetryStrategy;
import software.amazon.retry.util.ExceptionHelper;

/**
 * Drives one retried invocation of an operation.
 *
 * <p>Each pulled delay pays for exactly one invocation. A retryable failure is recorded and followed by a sleep of the
 * pulled delay, unless it was the last attempt. A non-retryable failure is rethrown as is. Cancellation, the deadline
 * and the thread's interrupt flag are checked before every invocation and before every sleep. A sleep never runs past
 * the deadline.
 *
 * <p>A loop runs once, in the calling thread, and owns the strategy it creates.
 *
 * @param <T> the operation's result type
 */
public class RetryLoop<T> {
    private static final Logger logger = LoggerFactory.getLogger(RetryLoop.class);

    private final Callable<T> operation;
    private final RetryConfig config;
    private final String operationName;
    private final RetryLogger retryLogger;
    private final List<Throwable> causes = new ArrayList<>();
    private int attempts;
    private Instant checkedAt;

    public RetryLoop(Callable<T> operation, RetryConfig config) {
        this.operation = operation;
        this.config = config;
        this.operationName = config.getOperationName();
        this.retryLogger = new RetryLogger(logger, operationName, config.getLoggerConfig());
    }

    public RetryOutcome<T> run() {
        RetryStrategy strategy = config.getStrategyFactory().create();

        Optional<Duration> delay;
        while ((delay = strategy.tryNext()).isPresent()) {
            var reason = checkCancellation();
            if (reason != null) {
                return cancelled(reason);
            }

            attempts = strategy.getAttemptCount();
            retryLogger.setAttempt(attempts, strategy.getMaxAttempts());
            retryLogger.debug("Starting attempt {} of {}", attempts, strategy.getMaxAttempts());
            try {
                T result = operation.call();
                if (!causes.isEmpty()) {
                    retryLogger.info("{} succeeded after {} failed attempt(s)", operationName, causes.size());
                }
                return RetryOutcome.succeeded(operationName, result, attempts, causes);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(CancellationReason.INTERRUPTED);
            } catch (Exception e) {
                if (!config.getFailureMatcher().isRetryable(e)) {
                    retryLogger.info("{} failed with non-retryable {}", operationName, e.toString());
                    ExceptionHelper.sneakyThrow(e);
                }
                causes.add(e);
                if (strategy.isExhausted()) {
                    retryLogger.warnFailure("Attempt " + attempts + " failed, no attempts left", e);
                    break;
                }
                retryLogger.warnFailure("Attempt " + attempts + " failed, retrying in " + delay.get(), e);
            }

            reason = checkCancellation();
            if (reason != null) {
                return cancelled(reason);
            }
            try {
                config.getSleeper().sleep(boundedByDeadline(delay.get()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(CancellationReason.INTERRUPTED);
            }
        }

        retryLogger.warn("{} exhausted after {} attempt(s)", operationName, attempts);
        return RetryOutcome.exhausted(operationName, causes);
    }

    private CancellationReason checkCancellation() {
        if (config.getCancellationSignal().isCancelled()) {
            return CancellationReason.CANCELLED;
        }
        var deadline = config.getDeadline();
        if (deadline != null) {
            checkedAt = config.getClock().instant();
            if (!checkedAt.isBefore(deadline)) {
                return CancellationReason.DEADLINE_EXCEEDED;
            }
        }
        if (Thread.currentThread().isInterrupted()) {
            return CancellationReason.INTERRUPTED;
        }
        return null;
    }

    /** Shortens the delay to the time left before the deadline, as of the last cancellation check. */
    private Duration boundedByDeadline(Duration delay) {
        var deadline = config.getDeadline();
        if (deadline == null) {
            return delay;
        }
        var remaining = Duration.between(checkedAt, deadline);
        return remaining.compareTo(delay) < 0 ? remaining : delay;
    }

    private RetryOutcome<T> cancelled(CancellationReason reason) {
        retryLogger.info("{} cancelled ({}) after {} attempt(s)", operationName, reason, attempts);
        return RetryOutcome.cancelled(operationName, reason, attempts, causes);
    }
}
