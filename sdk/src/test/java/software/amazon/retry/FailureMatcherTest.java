// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry;

import static org.junit.jupiter.api.Assertions.*;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class FailureMatcherTest {

    @Test
    void anyMatchesEverything() {
        var matcher = FailureMatcher.any();

        assertTrue(matcher.isRetryable(new IOException()));
        assertTrue(matcher.isRetryable(new IllegalStateException()));
    }

    @Test
    void anyOfMatchesSubclasses() {
        var matcher = FailureMatcher.anyOf(IOException.class, TimeoutException.class);

        assertTrue(matcher.isRetryable(new FileNotFoundException()));
        assertTrue(matcher.isRetryable(new TimeoutException()));
        assertFalse(matcher.isRetryable(new IllegalArgumentException()));
    }

    @Test
    void anyOfWithoutTypesMatchesNothing() {
        assertFalse(FailureMatcher.anyOf().isRetryable(new IOException()));
    }

    @Test
    void combinators() {
        var notFound = FailureMatcher.anyOf(FileNotFoundException.class);
        var io = FailureMatcher.anyOf(IOException.class);

        var ioButNotMissingFile = io.and(notFound.negate());

        assertTrue(ioButNotMissingFile.isRetryable(new IOException()));
        assertFalse(ioButNotMissingFile.isRetryable(new FileNotFoundException()));
        assertFalse(ioButNotMissingFile.isRetryable(new RuntimeException()));
    }
}
