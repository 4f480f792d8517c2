// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.examples;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.retry.FailureMatcher;
import software.amazon.retry.Retrier;
import software.amazon.retry.RetryConfig;
import software.amazon.retry.RetryOutcome;
import software.amazon.retry.exception.RetryExhaustedException;
import software.amazon.retry.execution.Sleeper;
import software.amazon.retry.strategy.BackoffStrategy;

/**
 * Example demonstrating exponential backoff with jitter and failure classification.
 *
 * <p>This example shows how to:
 *
 * <ul>
 *   <li>retry only I/O failures, letting validation errors through immediately
 *   <li>spread retries of many clients with jitter
 *   <li>decorate an operation once and call it many times
 *   <li>turn an exhausted outcome into a {@link RetryExhaustedException} carrying every failure
 * </ul>
 */
public class BackoffWithJitterExample {

    private static final Logger logger = LoggerFactory.getLogger(BackoffWithJitterExample.class);

    /** Thrown for requests that can never succeed, so retrying them is pointless. */
    public static class InvalidOrderException extends RuntimeException {
        public InvalidOrderException(String message) {
            super(message);
        }
    }

    /** Order lookup backed by a connection that drops now and then. */
    @FunctionalInterface
    public interface OrderClient {
        String fetch(String orderId) throws IOException;
    }

    private final Retrier retrier;

    public BackoffWithJitterExample(Sleeper sleeper) {
        this.retrier = Retrier.create(RetryConfig.builder()
                .operationName("fetch-order")
                .strategyFactory(BackoffStrategy.builder()
                        .startInterval(Duration.ofMillis(20))
                        .maxInterval(Duration.ofMillis(500))
                        .maxAttempts(6)
                        .jitterSpread(0.2)
                        .toFactory())
                .failureMatcher(FailureMatcher.anyOf(IOException.class, UncheckedIOException.class))
                .sleeper(sleeper)
                .build());
    }

    public Supplier<RetryOutcome<String>> fetchOrder(OrderClient client, String orderId) {
        return retrier.wrap(() -> {
            if (orderId.isBlank()) {
                throw new InvalidOrderException("Order id must not be blank");
            }
            return client.fetch(orderId);
        });
    }

    public static void main(String[] args) {
        var attempts = new int[1];
        OrderClient client = orderId -> {
            if (++attempts[0] < 4) {
                throw new IOException("Connection reset");
            }
            return "order " + orderId + ": shipped";
        };

        var example = new BackoffWithJitterExample(Sleeper.SYSTEM);
        var outcome = example.fetchOrder(client, "A-1001").get();
        logger.info("Fetched after {} attempt(s): {}", outcome.getAttempts(), outcome.orElseThrow());

        try {
            example.fetchOrder(client, " ").get();
        } catch (InvalidOrderException e) {
            logger.warn("Not retried: {}", e.getMessage());
        }
    }
}
