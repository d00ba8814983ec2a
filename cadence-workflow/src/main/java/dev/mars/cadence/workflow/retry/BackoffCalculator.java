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

import dev.mars.cadence.core.RetryPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Computes the wait before a retry from a task's {@link RetryPolicy}.
 *
 * <p>Algorithm, for the 1-based number {@code a} of the attempt that just failed:</p>
 * <pre>
 * FIXED       delay = base
 * LINEAR      delay = base * a
 * EXPONENTIAL delay = base * 2^(a-1)
 * delay = min(delay, maxDelay)
 * jitter:     delay = delay * uniform[0.5, 1.0]
 * </pre>
 *
 * <p>Example with base 1000ms, max 300000ms, exponential: attempt 1 waits 1000ms, attempt 2
 * 2000ms, attempt 3 4000ms, attempt 10 is capped at 300000ms. Multiplication saturates at
 * the cap instead of overflowing.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class BackoffCalculator {

    static final double MIN_JITTER_FACTOR = 0.5;

    private final Random random;

    public BackoffCalculator() {
        this(new Random());
    }

    /**
     * @param random jitter source; pass a seeded instance for reproducible delays
     */
    public BackoffCalculator(Random random) {
        this.random = Objects.requireNonNull(random, "Random cannot be null");
    }

    /**
     * Delay before the next attempt, before jitter, clamped to the policy's maximum.
     *
     * @param policy the task's retry policy
     * @param attempt number of the attempt that just failed (1-based)
     * @throws IllegalArgumentException if {@code attempt} is not positive
     */
    public Duration computeDelay(RetryPolicy policy, int attempt) {
        Objects.requireNonNull(policy, "Retry policy cannot be null");
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (was " + attempt + ")");
        }

        long baseMs = policy.getBaseDelay().toMillis();
        long maxMs = policy.getMaxDelay().toMillis();
        long delayMs;

        switch (policy.getBackoffStrategy()) {
            case FIXED:
                delayMs = baseMs;
                break;
            case LINEAR:
                delayMs = baseMs > maxMs / attempt ? maxMs : baseMs * attempt;
                break;
            case EXPONENTIAL:
                int shift = attempt - 1;
                if (baseMs == 0) {
                    delayMs = 0;
                } else {
                    delayMs = shift >= 62 || baseMs > (maxMs >> shift) ? maxMs : baseMs << shift;
                }
                break;
            default:
                throw new IllegalStateException("Unhandled backoff strategy: " + policy.getBackoffStrategy());
        }

        return Duration.ofMillis(Math.min(delayMs, maxMs));
    }

    /**
     * Delay before the next attempt, with jitter applied when the policy enables it.
     *
     * @param policy the task's retry policy
     * @param attempt number of the attempt that just failed (1-based)
     */
    public Duration nextDelay(RetryPolicy policy, int attempt) {
        Duration computed = computeDelay(policy, attempt);
        if (!policy.isJitter() || computed.isZero()) {
            return computed;
        }
        double factor = MIN_JITTER_FACTOR + random.nextDouble() * (1.0 - MIN_JITTER_FACTOR);
        return Duration.ofMillis(Math.round(computed.toMillis() * factor));
    }
}
