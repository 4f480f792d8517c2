// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import software.amazon.retry.execution.CancellationSignal;
import software.amazon.retry.execution.CancellationToken;
import software.amazon.retry.execution.Sleeper;
import software.amazon.retry.logging.LoggerConfig;
import software.amazon.retry.strategy.RetryStrategies;

class RetryConfigTest {

    @Test
    void testDefaults() {
        var config = RetryConfig.defaultConfig();

        assertEquals("operation", config.getOperationName());
        assertSame(RetryStrategies.Presets.DEFAULT, config.getStrategyFactory());
        assertTrue(config.getFailureMatcher().isRetryable(new RuntimeException()));
        assertSame(Sleeper.SYSTEM, config.getSleeper());
        assertSame(CancellationSignal.NEVER, config.getCancellationSignal());
        assertNull(config.getDeadline());
        assertNotNull(config.getClock());
        assertEquals(LoggerConfig.defaults(), config.getLoggerConfig());
    }

    @Test
    void testBuilderChaining() {
        var strategy = RetryStrategies.linear(Duration.ofSeconds(1));
        var matcher = FailureMatcher.anyOf(IllegalStateException.class);
        Sleeper sleeper = duration -> {};
        var token = new CancellationToken();
        var deadline = Instant.parse("2030-01-01T00:00:00Z");
        var clock = Clock.fixed(deadline, ZoneOffset.UTC);

        var config = RetryConfig.builder()
                .operationName("charge-card")
                .strategyFactory(strategy)
                .failureMatcher(matcher)
                .sleeper(sleeper)
                .cancellationSignal(token)
                .deadline(deadline)
                .clock(clock)
                .loggerConfig(LoggerConfig.withFailureStackTraces())
                .build();

        assertEquals("charge-card", config.getOperationName());
        assertSame(strategy, config.getStrategyFactory());
        assertSame(matcher, config.getFailureMatcher());
        assertSame(sleeper, config.getSleeper());
        assertSame(token, config.getCancellationSignal());
        assertEquals(deadline, config.getDeadline());
        assertSame(clock, config.getClock());
        assertTrue(config.getLoggerConfig().logFailureStackTraces());
    }

    @Test
    void testNullOptionsFallBackToDefaults() {
        var config = RetryConfig.builder()
                .operationName(null)
                .strategyFactory(null)
                .sleeper(null)
                .build();

        assertEquals("operation", config.getOperationName());
        assertSame(RetryStrategies.Presets.DEFAULT, config.getStrategyFactory());
        assertSame(Sleeper.SYSTEM, config.getSleeper());
    }

    @Test
    void testToBuilderCopiesEverything() {
        var original = RetryConfig.builder()
                .operationName("copy-me")
                .strategyFactory(RetryStrategies.Presets.NO_RETRY)
                .deadline(Instant.EPOCH)
                .build();

        var copy = original.toBuilder().operationName("copied").build();

        assertEquals("copied", copy.getOperationName());
        assertSame(RetryStrategies.Presets.NO_RETRY, copy.getStrategyFactory());
        assertEquals(Instant.EPOCH, copy.getDeadline());
        assertEquals("copy-me", original.getOperationName());
    }
}
