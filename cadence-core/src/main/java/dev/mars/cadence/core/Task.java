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

import dev.mars.cadence.core.exceptions.InvalidTransitionException;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The smallest dispatchable unit of work: one capability, one input payload, and the ids of
 * the tasks whose results it needs first.
 *
 * <p>The definition fields are immutable. Runtime state (status, attempts, output, error,
 * timestamps) is mutated only by the orchestrator through the guarded methods below, each of
 * which checks the {@link TaskStatus} transition table. Runtime state is read concurrently by
 * status queries, so every accessor of mutable state is synchronized.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class Task {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_ESTIMATED_DURATION = Duration.ofSeconds(60);

    private final String id;
    private final String name;
    private final Capability capability;
    private final Map<String, Object> input;
    private final Set<String> dependencies;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final Duration estimatedDuration;

    private TaskStatus status = TaskStatus.PENDING;
    private Map<String, Object> output;
    private String errorMessage;
    private FailureKind failureKind;
    private Instant startedAt;
    private Instant completedAt;
    private int attemptCount;

    private Task(Builder builder) {
        this.id = requireText(builder.id, "Task ID");
        this.name = builder.name != null ? builder.name : builder.id;
        this.capability = Objects.requireNonNull(builder.capability, "Capability cannot be null");
        this.input = builder.input != null ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.input)) : Map.of();
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependencies));
        this.timeout = Objects.requireNonNull(builder.timeout, "Timeout cannot be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout for task '" + id + "' must be positive");
        }
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "Retry policy cannot be null");
        this.estimatedDuration = Objects.requireNonNull(builder.estimatedDuration, "Estimated duration cannot be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Capability getCapability() {
        return capability;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    /**
     * @return ids of the tasks that must have recorded results before this one may run,
     *         in declaration order
     */
    public Set<String> getDependencies() {
        return dependencies;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Duration getEstimatedDuration() {
        return estimatedDuration;
    }

    public synchronized TaskStatus getStatus() {
        return status;
    }

    public synchronized Optional<Map<String, Object>> getOutput() {
        return Optional.ofNullable(output);
    }

    public synchronized Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public synchronized Optional<FailureKind> getFailureKind() {
        return Optional.ofNullable(failureKind);
    }

    public synchronized Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public synchronized Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    /**
     * @return time between the first dispatch and the terminal state, if both happened
     */
    public synchronized Optional<Duration> getDuration() {
        if (startedAt == null || completedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, completedAt));
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized boolean hasAttemptsRemaining() {
        return attemptCount < retryPolicy.getMaxAttempts();
    }

    // ── Engine-side mutations ──────────────────────────────────────────

    /**
     * Starts a new attempt: PENDING or RETRYING → RUNNING, and bumps the attempt counter.
     *
     * @param now clock reading for the first dispatch timestamp
     * @throws InvalidTransitionException if the task is not PENDING or RETRYING
     * @throws IllegalStateException if the retry policy allows no further attempt
     */
    public synchronized void beginAttempt(Instant now) throws InvalidTransitionException {
        if (attemptCount >= retryPolicy.getMaxAttempts()) {
            throw new IllegalStateException("Task " + id + " already used all "
                    + retryPolicy.getMaxAttempts() + " attempts");
        }
        transitionTo(TaskStatus.RUNNING);
        attemptCount++;
        if (startedAt == null) {
            startedAt = now;
        }
    }

    /**
     * RUNNING → RETRYING after a failed attempt that still has attempts left.
     */
    public synchronized void markRetrying() throws InvalidTransitionException {
        if (!hasAttemptsRemaining()) {
            throw new IllegalStateException("Task " + id + " has no attempts remaining");
        }
        transitionTo(TaskStatus.RETRYING);
    }

    /**
     * RUNNING → COMPLETED with the agent's result.
     */
    public synchronized void complete(Map<String, Object> result, Instant now) throws InvalidTransitionException {
        transitionTo(TaskStatus.COMPLETED);
        this.output = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : Map.of();
        this.completedAt = now;
    }

    /**
     * RUNNING → FAILED once attempts are exhausted.
     */
    public synchronized void fail(String error, FailureKind kind, Instant now) throws InvalidTransitionException {
        transitionTo(TaskStatus.FAILED);
        this.errorMessage = error;
        this.failureKind = kind;
        this.completedAt = now;
    }

    /**
     * PENDING → SKIPPED for a task its stage abandoned before dispatch.
     */
    public synchronized void skip() throws InvalidTransitionException {
        transitionTo(TaskStatus.SKIPPED);
    }

    private void transitionTo(TaskStatus target) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target, status.getValidTransitions());
        }
        status = target;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Task) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public synchronized String toString() {
        return "Task{" +
               "id='" + id + '\'' +
               ", capability=" + capability +
               ", status=" + status +
               ", attempts=" + attemptCount +
               '}';
    }

    /**
     * Builder for Task.
     */
    public static class Builder {
        private String id;
        private String name;
        private Capability capability;
        private Map<String, Object> input = Map.of();
        private final Set<String> dependencies = new LinkedHashSet<>();
        private Duration timeout = DEFAULT_TIMEOUT;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration estimatedDuration = DEFAULT_ESTIMATED_DURATION;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder capability(Capability capability) {
            this.capability = capability;
            return this;
        }

        public Builder input(Map<String, Object> input) {
            this.input = input;
            return this;
        }

        public Builder dependsOn(String... taskIds) {
            return dependsOn(List.of(taskIds));
        }

        public Builder dependsOn(Iterable<String> taskIds) {
            for (String taskId : taskIds) {
                dependencies.add(Objects.requireNonNull(taskId, "Dependency ID cannot be null"));
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
