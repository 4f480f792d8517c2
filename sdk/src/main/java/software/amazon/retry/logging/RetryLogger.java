// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/** Logger wrapper that adds the retried operation and the current attempt to log entries via MDC. */
public class RetryLogger {
    static final String MDC_OPERATION = "retryOperation";
    static final String MDC_ATTEMPT = "attempt";
    static final String MDC_MAX_ATTEMPTS = "maxAttempts";

    private final Logger delegate;
    private final String operationName;
    private final LoggerConfig config;
    private Integer attempt;
    private Integer maxAttempts;

    public RetryLogger(Logger delegate, String operationName, LoggerConfig config) {
        this.delegate = delegate;
        this.operationName = operationName;
        this.config = config;
    }

    public void setAttempt(int attempt, int maxAttempts) {
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
    }

    public void debug(String format, Object... args) {
        log(() -> delegate.debug(format, args));
    }

    public void info(String format, Object... args) {
        log(() -> delegate.info(format, args));
    }

    public void warn(String format, Object... args) {
        log(() -> delegate.warn(format, args));
    }

    /**
     * Logs a failed attempt at warn level. The stack trace is only attached when {@link
     * LoggerConfig#logFailureStackTraces()} is set.
     */
    public void warnFailure(String message, Throwable failure) {
        if (config.logFailureStackTraces()) {
            log(() -> delegate.warn(message, failure));
        } else {
            log(() -> delegate.warn("{}: {}", message, String.valueOf(failure)));
        }
    }

    private void log(Runnable logAction) {
        try {
            MDC.put(MDC_OPERATION, operationName);
            if (attempt != null) {
                MDC.put(MDC_ATTEMPT, String.valueOf(attempt));
                MDC.put(MDC_MAX_ATTEMPTS, String.valueOf(maxAttempts));
            }

            logAction.run();
        } finally {
            MDC.remove(MDC_OPERATION);
            MDC.remove(MDC_ATTEMPT);
            MDC.remove(MDC_MAX_ATTEMPTS);
        }
    }
}
