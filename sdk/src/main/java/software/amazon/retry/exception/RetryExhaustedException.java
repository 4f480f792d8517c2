// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.exception;

import java.util.List;

public class RetryExhaustedException extends RetryException {
    private final int attempts;

    public RetryExhaustedException(String operationName, int attempts, List<? extends Throwable> causes) {
        super(String.format("%s failed after %d attempt(s)", operationName, attempts), causes);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
