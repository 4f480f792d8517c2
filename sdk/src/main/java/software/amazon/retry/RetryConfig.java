// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry;

import java.time.Clock;
import java.time.Instant;
import software.amazon.retry.execution.CancellationSignal;
import software.amazon.retry.execution.Sleeper;
import software.amazon.retry.logging.LoggerConfig;
import software.amazon.retry.strategy.RetryStrategies;
import software.amazon.retry.strategy.StrategyFactory;

/**
 * Configuration for a {@link Retrier}. This class provides a builder pattern for configuring the delay strategy, the
 * failure classification and the collaborators of the retry loop.
 *
 * <p>Configuration is immutable. Unset options fall back to their defaults when the config is built.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * RetryConfig config = RetryConfig.builder()
 *     .operationName("fetch-inventory")
 *     .strategyFactory(RetryStrategies.backoff(Duration.ofMillis(100), Duration.ofSeconds(5), 6, 0.2))
 *     .failureMatcher(FailureMatcher.anyOf(IOException.class))
 *     .build();
 * }</pre>
 */
public final class RetryConfig {
    static final String DEFAULT_OPERATION_NAME = "operation";

    private final String operationName;
    private final StrategyFactory strategyFactory;
    private final FailureMatcher failureMatcher;
    private final Sleeper sleeper;
    private final CancellationSignal cancellationSignal;
    private final Instant deadline;
    private final Clock clock;
    private final LoggerConfig loggerConfig;

    private RetryConfig(Builder builder) {
        this.operationName = builder.operationName != null ? builder.operationName : DEFAULT_OPERATION_NAME;
        this.strategyFactory =
                builder.strategyFactory != null ? builder.strategyFactory : RetryStrategies.Presets.DEFAULT;
        this.failureMatcher = builder.failureMatcher != null ? builder.failureMatcher : FailureMatcher.any();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.cancellationSignal =
                builder.cancellationSignal != null ? builder.cancellationSignal : CancellationSignal.NEVER;
        this.deadline = builder.deadline;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.loggerConfig = builder.loggerConfig != null ? builder.loggerConfig : LoggerConfig.defaults();
    }

    /**
     * Creates a RetryConfig with default settings: default backoff, every failure retryable, no deadline.
     *
     * @return RetryConfig with default configuration
     */
    public static RetryConfig defaultConfig() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return a builder pre-populated with this configuration */
    public Builder toBuilder() {
        return new Builder()
                .operationName(operationName)
                .strategyFactory(strategyFactory)
                .failureMatcher(failureMatcher)
                .sleeper(sleeper)
                .cancellationSignal(cancellationSignal)
                .deadline(deadline)
                .clock(clock)
                .loggerConfig(loggerConfig);
    }

    public String getOperationName() {
        return operationName;
    }

    public StrategyFactory getStrategyFactory() {
        return strategyFactory;
    }

    public FailureMatcher getFailureMatcher() {
        return failureMatcher;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public CancellationSignal getCancellationSignal() {
        return cancellationSignal;
    }

    /** @return the instant after which no attempt or sleep starts, or null if there is none */
    public Instant getDeadline() {
        return deadline;
    }

    public Clock getClock() {
        return clock;
    }

    public LoggerConfig getLoggerConfig() {
        return loggerConfig;
    }

    /** Builder for creating RetryConfig instances. */
    public static final class Builder {
        private String operationName;
        private StrategyFactory strategyFactory;
        private FailureMatcher failureMatcher;
        private Sleeper sleeper;
        private CancellationSignal cancellationSignal;
        private Instant deadline;
        private Clock clock;
        private LoggerConfig loggerConfig;

        private Builder() {}

        /**
         * Sets the name used for the operation in log entries and exception messages.
         *
         * @param operationName the name, defaults to {@value RetryConfig#DEFAULT_OPERATION_NAME}
         * @return this builder for method chaining
         */
        public Builder operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        /**
         * Sets the factory asked for a fresh strategy on every invocation.
         *
         * @param strategyFactory the factory, defaults to {@link RetryStrategies.Presets#DEFAULT}
         * @return this builder for method chaining
         */
        public Builder strategyFactory(StrategyFactory strategyFactory) {
            this.strategyFactory = strategyFactory;
            return this;
        }

        /**
         * Sets which failures are retried.
         *
         * @param failureMatcher the matcher, defaults to {@link FailureMatcher#any()}
         * @return this builder for method chaining
         */
        public Builder failureMatcher(FailureMatcher failureMatcher) {
            this.failureMatcher = failureMatcher;
            return this;
        }

        /**
         * Sets how the loop waits between attempts.
         *
         * @param sleeper the sleeper, defaults to {@link Sleeper#SYSTEM}
         * @return this builder for method chaining
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Sets the signal polled before each attempt and each sleep.
         *
         * @param cancellationSignal the signal, defaults to {@link CancellationSignal#NEVER}
         * @return this builder for method chaining
         */
        public Builder cancellationSignal(CancellationSignal cancellationSignal) {
            this.cancellationSignal = cancellationSignal;
            return this;
        }

        /**
         * Sets an external deadline. Reaching it cancels the sequence at the next check.
         *
         * @param deadline the deadline, or null for none
         * @return this builder for method chaining
         */
        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        /**
         * Sets the clock the deadline is checked against.
         *
         * @param clock the clock, defaults to {@link Clock#systemUTC()}
         * @return this builder for method chaining
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder loggerConfig(LoggerConfig loggerConfig) {
            this.loggerConfig = loggerConfig;
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(this);
        }
    }
}
