// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.examples;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.retry.FailureMatcher;
import software.amazon.retry.Retrier;
import software.amazon.retry.RetryOutcome;
import software.amazon.retry.strategy.RetryStrategies;

/**
 * Example retrying a service that fails a fixed number of times before answering.
 *
 * <p>Uses a linear strategy: the same short pause after every failure.
 */
public class FlakyServiceExample {

    private static final Logger logger = LoggerFactory.getLogger(FlakyServiceExample.class);

    /** Simulated remote service that is unavailable for its first {@code failuresBeforeSuccess} calls. */
    public static class FlakyService {
        private final int failuresBeforeSuccess;
        private int calls;

        public FlakyService(int failuresBeforeSuccess) {
            this.failuresBeforeSuccess = failuresBeforeSuccess;
        }

        public String greet(String name) {
            calls++;
            if (calls <= failuresBeforeSuccess) {
                throw new IllegalStateException("Service unavailable (call " + calls + ")");
            }
            return "Hello, " + name + "!";
        }

        public int getCalls() {
            return calls;
        }
    }

    public RetryOutcome<String> greet(FlakyService service, String name, int maxAttempts) {
        return Retrier.runWithRetry(
                () -> service.greet(name),
                RetryStrategies.linear(Duration.ofMillis(50), maxAttempts, 0.0),
                FailureMatcher.any());
    }

    public static void main(String[] args) {
        var service = new FlakyService(2);
        var outcome = new FlakyServiceExample().greet(service, "world", 5);

        logger.info("{} after {} call(s): {}", outcome.getStatus(), service.getCalls(), outcome.orElseThrow());
    }
}
