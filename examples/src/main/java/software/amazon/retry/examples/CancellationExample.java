// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.examples;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.retry.Retrier;
import software.amazon.retry.RetryConfig;
import software.amazon.retry.RetryOutcome;
import software.amazon.retry.execution.CancellationToken;
import software.amazon.retry.strategy.RetryStrategies;

/**
 * Example stopping a retry sequence from outside: with a {@link CancellationToken} tripped by another thread, or with
 * a deadline.
 */
public class CancellationExample {

    private static final Logger logger = LoggerFactory.getLogger(CancellationExample.class);

    public RetryOutcome<Void> pollUntilCancelled(CancellationToken token, Duration interval) {
        var retrier = Retrier.create(RetryConfig.builder()
                .operationName("poll-job-status")
                .strategyFactory(RetryStrategies.linear(interval, Integer.MAX_VALUE, 0.0))
                .cancellationSignal(token)
                .build());

        return retrier.run(() -> {
            throw new IllegalStateException("Job still running");
        });
    }

    public RetryOutcome<Void> pollWithDeadline(Clock clock, Duration budget, Duration interval) {
        var retrier = Retrier.create(RetryConfig.builder()
                .operationName("poll-job-status")
                .strategyFactory(RetryStrategies.linear(interval, Integer.MAX_VALUE, 0.0))
                .clock(clock)
                .deadline(clock.instant().plus(budget))
                .build());

        return retrier.run(() -> {
            throw new IllegalStateException("Job still running");
        });
    }

    public static void main(String[] args) {
        var example = new CancellationExample();
        var token = new CancellationToken();
        var scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(token::cancel, 200, TimeUnit.MILLISECONDS);
            var cancelled = example.pollUntilCancelled(token, Duration.ofMillis(50));
            logger.info("Token: {} after {} attempt(s)", cancelled.getCancellationReason(), cancelled.getAttempts());
        } finally {
            scheduler.shutdownNow();
        }

        var timedOut = example.pollWithDeadline(Clock.systemUTC(), Duration.ofMillis(200), Duration.ofMillis(50));
        logger.info("Deadline: {} after {} attempt(s)", timedOut.getCancellationReason(), timedOut.getAttempts());
    }
}
