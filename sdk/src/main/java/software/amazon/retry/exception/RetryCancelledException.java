// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.exception;

import java.util.List;
import software.amazon.retry.execution.CancellationReason;

public class RetryCancelledException extends RetryException {
    private final CancellationReason reason;

    public RetryCancelledException(
            String operationName, CancellationReason reason, List<? extends Throwable> causes) {
        super(
                String.format(
                        "%s cancelled (%s) after %d failed attempt(s)", operationName, reason, causes.size()),
                causes);
        this.reason = reason;
    }

    public CancellationReason getReason() {
        return reason;
    }
}
