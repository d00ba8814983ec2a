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

package dev.mars.cadence.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry settings attached to a task.
 *
 * <p>Defaults: 3 attempts, exponential backoff from 1 second capped at 300 seconds, jitter on.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(300);

    private final int maxAttempts;
    private final BackoffStrategy backoffStrategy;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final boolean jitter;

    private RetryPolicy(Builder builder) {
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 (was " + builder.maxAttempts + ")");
        }
        this.backoffStrategy = Objects.requireNonNull(builder.backoffStrategy, "Backoff strategy cannot be null");
        this.baseDelay = Objects.requireNonNull(builder.baseDelay, "Base delay cannot be null");
        this.maxDelay = Objects.requireNonNull(builder.maxDelay, "Max delay cannot be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay cannot be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay (" + maxDelay + ") must be >= baseDelay (" + baseDelay + ")");
        }
        this.maxAttempts = builder.maxAttempts;
        this.jitter = builder.jitter;
    }

    /**
     * @return the default policy
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * A policy that runs a task exactly once.
     */
    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).jitter(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public BackoffStrategy getBackoffStrategy() {
        return backoffStrategy;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public boolean isJitter() {
        return jitter;
    }

    /**
     * @return a builder pre-filled with this policy's values
     */
    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .backoffStrategy(backoffStrategy)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .jitter(jitter);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxAttempts == that.maxAttempts &&
               jitter == that.jitter &&
               backoffStrategy == that.backoffStrategy &&
               baseDelay.equals(that.baseDelay) &&
               maxDelay.equals(that.maxDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAttempts, backoffStrategy, baseDelay, maxDelay, jitter);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
               "maxAttempts=" + maxAttempts +
               ", backoffStrategy=" + backoffStrategy +
               ", baseDelay=" + baseDelay +
               ", maxDelay=" + maxDelay +
               ", jitter=" + jitter +
               '}';
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private boolean jitter = true;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffStrategy(BackoffStrategy backoffStrategy) {
            this.backoffStrategy = backoffStrategy;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
