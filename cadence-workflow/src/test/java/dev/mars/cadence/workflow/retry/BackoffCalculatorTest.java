/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.cadence.workflow.retry;

import dev.mars.cadence.core.BackoffStrategy;
import dev.mars.cadence.core.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackoffCalculator delay growth, clamping and jitter.
 */
class BackoffCalculatorTest {

    private final BackoffCalculator calculator = new BackoffCalculator(new Random(42));

    private static RetryPolicy policy(BackoffStrategy strategy, long baseMs, long maxMs, boolean jitter) {
        return RetryPolicy.builder()
                .maxAttempts(10)
                .backoffStrategy(strategy)
                .baseDelay(Duration.ofMillis(baseMs))
                .maxDelay(Duration.ofMillis(maxMs))
                .jitter(jitter)
                .build();
    }

    @ParameterizedTest(name = "{0} attempt {1} -> {2}ms")
    @CsvSource({
            "FIXED, 1, 1000",
            "FIXED, 5, 1000",
            "LINEAR, 1, 1000",
            "LINEAR, 3, 3000",
            "EXPONENTIAL, 1, 1000",
            "EXPONENTIAL, 2, 2000",
            "EXPONENTIAL, 3, 4000",
            "EXPONENTIAL, 5, 16000"
    })
    void testDelayGrowth(BackoffStrategy strategy, int attempt, long expectedMs) {
        RetryPolicy policy = policy(strategy, 1000, 300_000, false);
        assertEquals(Duration.ofMillis(expectedMs), calculator.computeDelay(policy, attempt));
    }

    @Test
    @DisplayName("Delays are clamped to the policy maximum")
    void testClampedToMaxDelay() {
        assertEquals(Duration.ofMillis(300_000),
                calculator.computeDelay(policy(BackoffStrategy.EXPONENTIAL, 1000, 300_000, false), 10));
        assertEquals(Duration.ofMillis(5000),
                calculator.computeDelay(policy(BackoffStrategy.LINEAR, 1000, 5000, false), 8));
    }

    @Test
    @DisplayName("Very large attempt numbers saturate instead of overflowing")
    void testNoOverflow() {
        RetryPolicy exponential = policy(BackoffStrategy.EXPONENTIAL, 1000, 300_000, false);
        RetryPolicy linear = policy(BackoffStrategy.LINEAR, 1000, 300_000, false);

        assertEquals(Duration.ofMillis(300_000), calculator.computeDelay(exponential, 64));
        assertEquals(Duration.ofMillis(300_000), calculator.computeDelay(exponential, Integer.MAX_VALUE));
        assertEquals(Duration.ofMillis(300_000), calculator.computeDelay(linear, Integer.MAX_VALUE));
    }

    @Test
    void testNonPositiveAttemptRejected() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertThrows(IllegalArgumentException.class, () -> calculator.computeDelay(policy, 0));
        assertThrows(IllegalArgumentException.class, () -> calculator.nextDelay(policy, -1));
    }

    @Test
    @DisplayName("Without jitter the next delay is exactly the computed delay")
    void testNoJitterIsExact() {
        RetryPolicy policy = policy(BackoffStrategy.EXPONENTIAL, 250, 10_000, false);
        for (int attempt = 1; attempt <= 6; attempt++) {
            assertEquals(calculator.computeDelay(policy, attempt), calculator.nextDelay(policy, attempt));
        }
    }

    @Test
    @DisplayName("Jittered delays stay within half to the full computed delay")
    void testJitterBounds() {
        RetryPolicy policy = policy(BackoffStrategy.FIXED, 1000, 1000, true);
        boolean varied = false;
        long first = calculator.nextDelay(policy, 1).toMillis();
        for (int i = 0; i < 200; i++) {
            long delay = calculator.nextDelay(policy, 1).toMillis();
            assertTrue(delay >= 500 && delay <= 1000, "delay out of range: " + delay);
            varied |= delay != first;
        }
        assertTrue(varied, "jitter should vary the delay");
    }

    @Test
    @DisplayName("Same seed gives the same jittered sequence")
    void testSeededJitterIsReproducible() {
        RetryPolicy policy = policy(BackoffStrategy.EXPONENTIAL, 100, 60_000, true);
        BackoffCalculator a = new BackoffCalculator(new Random(7));
        BackoffCalculator b = new BackoffCalculator(new Random(7));
        for (int attempt = 1; attempt <= 5; attempt++) {
            assertEquals(a.nextDelay(policy, attempt), b.nextDelay(policy, attempt));
        }
    }

    @Test
    void testZeroBaseDelayStaysZero() {
        RetryPolicy policy = policy(BackoffStrategy.EXPONENTIAL, 0, 0, true);
        assertEquals(Duration.ZERO, calculator.nextDelay(policy, 3));
    }

    @Test
    void testZeroBaseDelayWithLargeAttemptStaysZero() {
        RetryPolicy policy = policy(BackoffStrategy.EXPONENTIAL, 0, 5000, false);
        assertEquals(Duration.ZERO, calculator.computeDelay(policy, 63));
        assertEquals(Duration.ZERO, calculator.computeDelay(policy, Integer.MAX_VALUE));
    }
}
