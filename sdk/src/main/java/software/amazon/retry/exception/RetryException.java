// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.exception;

import java.util.List;

/**
 * Base class for the terminal, non-successful retry outcomes when they are surfaced as exceptions.
 *
 * <p>The recorded failure causes are kept in attempt order. The last one is reported as {@link #getCause()} and the
 * earlier ones are attached as suppressed exceptions so that every cause shows up once in stack traces.
 */
public class RetryException extends RuntimeException {
    private final List<Throwable> causes;

    public RetryException(String message, List<? extends Throwable> causes) {
        super(message, causes.isEmpty() ? null : causes.get(causes.size() - 1));
        this.causes = List.copyOf(causes);
        for (int i = 0; i < this.causes.size() - 1; i++) {
            addSuppressed(this.causes.get(i));
        }
    }

    /** @return every recorded failure cause, in attempt order */
    public List<Throwable> getCauses() {
        return causes;
    }
}
