// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/** A {@link CancellationSignal} that any thread can trip once. */
public final class CancellationToken implements CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Requests cancellation. The retry loop notices it at its next check; an operation already running is not
     * interrupted.
     *
     * @return true if this call tripped the token, false if it was already cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
