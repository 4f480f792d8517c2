// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retry.strategy;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;
import org.junit.jupiter.api.Test;
import software.amazon.retry.exception.RetryConfigurationException;

class JittererTest {

    @Test
    void zeroSpreadIsIdentityAndNeverDrawsRandomValues() {
        var random = mock(RandomGenerator.class);
        var jitterer = Jitterer.create(0.0, random);

        assertSame(Jitterer.NONE, jitterer);
        for (long millis : new long[] {1, 7, 1000, 60_000}) {
            assertEquals(Duration.ofMillis(millis), jitterer.apply(Duration.ofMillis(millis)));
        }
        verifyNoInteractions(random);
    }

    @Test
    void drawsExactlyOneRandomValuePerCall() {
        var random = mock(RandomGenerator.class);
        when(random.nextDouble()).thenReturn(0.5);
        var jitterer = Jitterer.create(0.2, random);

        jitterer.apply(Duration.ofSeconds(1));
        jitterer.apply(Duration.ofSeconds(2));

        verify(random, times(2)).nextDouble();
    }

    @Test
    void scalesDrawIntoSymmetricRange() {
        var random = mock(RandomGenerator.class);
        var jitterer = Jitterer.create(0.5, random);

        // draw 0.0 maps to factor -1
        when(random.nextDouble()).thenReturn(0.0);
        assertEquals(Duration.ofMillis(500), jitterer.apply(Duration.ofSeconds(1)));

        // draw 0.5 maps to factor 0
        when(random.nextDouble()).thenReturn(0.5);
        assertEquals(Duration.ofSeconds(1), jitterer.apply(Duration.ofSeconds(1)));

        // draw 0.75 maps to factor 0.5
        when(random.nextDouble()).thenReturn(0.75);
        assertEquals(Duration.ofMillis(1250), jitterer.apply(Duration.ofSeconds(1)));
    }

    @Test
    void upperBoundIsExclusive() {
        var random = mock(RandomGenerator.class);
        when(random.nextDouble()).thenReturn(Math.nextDown(1.0));
        var jitterer = Jitterer.create(0.5, random);

        var jittered = jitterer.apply(Duration.ofSeconds(1));

        assertTrue(jittered.compareTo(Duration.ofMillis(1500)) < 0, "got " + jittered);
    }

    @Test
    void jitteredValuesStayWithinSpread() {
        var random = new SplittableRandom(42);
        for (double spread : new double[] {0.01, 0.1, 0.5, 0.99}) {
            var jitterer = Jitterer.create(spread, random);
            for (int i = 0; i < 1000; i++) {
                long nanos = Duration.ofMillis(1 + random.nextInt(100_000)).toNanos();
                long jittered = jitterer.apply(Duration.ofNanos(nanos)).toNanos();

                assertTrue(jittered >= nanos * (1 - spread), "spread " + spread + " below range: " + jittered);
                assertTrue(jittered < nanos * (1 + spread), "spread " + spread + " above range: " + jittered);
            }
        }
    }

    @Test
    void rejectsSpreadOutsideUnitInterval() {
        assertThrows(RetryConfigurationException.class, () -> Jitterer.create(1.0));
        assertThrows(RetryConfigurationException.class, () -> Jitterer.create(-0.01));
        assertThrows(RetryConfigurationException.class, () -> Jitterer.create(Double.POSITIVE_INFINITY));
    }

    @Test
    void rejectsMissingRandomSourceWhenJitterIsActive() {
        assertThrows(RetryConfigurationException.class, () -> Jitterer.create(0.1, null));
        assertDoesNotThrow(() -> Jitterer.create(0.0, null));
    }

    @Test
    void delaysBeyondNanosecondRangeDoNotOverflow() {
        var random = mock(RandomGenerator.class);
        var jitterer = Jitterer.create(0.5, random);
        var millennium = Duration.ofDays(365L * 1000);

        when(random.nextDouble()).thenReturn(Math.nextDown(1.0));
        var high = jitterer.apply(millennium);
        when(random.nextDouble()).thenReturn(0.0);
        var low = jitterer.apply(millennium);

        assertTrue(high.compareTo(millennium) > 0, "got " + high);
        assertTrue(high.compareTo(millennium.multipliedBy(3).dividedBy(2)) < 0, "got " + high);
        assertTrue(low.compareTo(millennium.dividedBy(2)) >= 0, "got " + low);
        assertTrue(low.compareTo(millennium) < 0, "got " + low);
    }
}
