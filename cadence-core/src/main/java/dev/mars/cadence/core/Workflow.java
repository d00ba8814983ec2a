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
import dev.mars.cadence.core.validation.ValidationResult;
import dev.mars.cadence.core.validation.WorkflowValidator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Top-level orchestrated unit: an ordered sequence of stages built once with its whole task
 * graph.
 *
 * <p>{@link Builder#build()} validates the graph (unique task ids, dependencies resolvable
 * inside the workflow, no cycles) and refuses to create an invalid workflow. After that the
 * stages and tasks never change; only the runtime status fields move.</p>
 *
 * <p>Status changes are serialized on the workflow's monitor. {@link #awaitWhilePaused()}
 * lets the run loop block on a paused workflow until another thread resumes or cancels it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class Workflow {

    private final String id;
    private final String name;
    private final String projectId;
    private final List<Stage> stages;
    private final Map<String, Object> metadata;
    private final Map<String, Task> tasksById;

    private WorkflowStatus status = WorkflowStatus.PENDING;
    private int currentStage;
    private Instant startedAt;
    private Instant completedAt;
    private String errorMessage;
    private FailureKind failureKind;

    private Workflow(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = Objects.requireNonNull(builder.name, "Workflow name cannot be null");
        this.projectId = Objects.requireNonNull(builder.projectId, "Project ID cannot be null");
        this.stages = List.copyOf(builder.stages);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));

        Map<String, Task> index = new LinkedHashMap<>();
        for (Stage stage : stages) {
            for (Task task : stage.getTasks()) {
                index.putIfAbsent(task.getId(), task);
            }
        }
        this.tasksById = Collections.unmodifiableMap(index);
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

    public String getProjectId() {
        return projectId;
    }

    public List<Stage> getStages() {
        return stages;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return every task of every stage, in stage then declaration order
     */
    public List<Task> getTasks() {
        return List.copyOf(tasksById.values());
    }

    public Optional<Task> findTask(String taskId) {
        return Optional.ofNullable(tasksById.get(taskId));
    }

    public int getTotalTaskCount() {
        return tasksById.size();
    }

    public int getCompletedTaskCount() {
        return (int) tasksById.values().stream()
                .filter(task -> task.getStatus() == TaskStatus.COMPLETED)
                .count();
    }

    public synchronized WorkflowStatus getStatus() {
        return status;
    }

    public synchronized int getCurrentStage() {
        return currentStage;
    }

    public synchronized Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public synchronized Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public synchronized Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public synchronized Optional<FailureKind> getFailureKind() {
        return Optional.ofNullable(failureKind);
    }

    // ── Engine-side mutations ──────────────────────────────────────────

    /**
     * Moves the workflow to {@code target}.
     *
     * @throws InvalidTransitionException if the transition table forbids it
     */
    public synchronized void transitionTo(WorkflowStatus target) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target, status.getValidTransitions());
        }
        status = target;
        notifyAll();
    }

    /**
     * Moves the workflow to {@code target} if {@code expected} is the current status.
     *
     * @return {@code true} if the status changed
     */
    public synchronized boolean transitionIf(WorkflowStatus expected, WorkflowStatus target) {
        if (status != expected || !status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        notifyAll();
        return true;
    }

    public synchronized void markStarted(Instant now) throws InvalidTransitionException {
        transitionTo(WorkflowStatus.RUNNING);
        this.startedAt = now;
        this.currentStage = 0;
    }

    public synchronized void setCurrentStage(int stageIndex) {
        if (stageIndex < 0 || stageIndex >= Math.max(1, stages.size())) {
            throw new IndexOutOfBoundsException("Stage index " + stageIndex + " out of range for " + stages.size() + " stages");
        }
        this.currentStage = stageIndex;
    }

    public synchronized void markCompleted(Instant now) throws InvalidTransitionException {
        transitionTo(WorkflowStatus.COMPLETED);
        this.completedAt = now;
    }

    /**
     * Fails the workflow from RUNNING or PAUSED; a workflow that already reached a terminal
     * status keeps it and only the first error is recorded.
     *
     * @return {@code true} if the workflow moved to FAILED
     */
    public synchronized boolean markFailed(String error, FailureKind kind, Instant now) {
        if (!status.canTransitionTo(WorkflowStatus.FAILED)) {
            return false;
        }
        status = WorkflowStatus.FAILED;
        this.errorMessage = error;
        this.failureKind = kind;
        this.completedAt = now;
        notifyAll();
        return true;
    }

    /**
     * Cancels a non-terminal workflow.
     *
     * @return {@code true} if the workflow moved to CANCELLED
     */
    public synchronized boolean markCancelled(Instant now) {
        if (!status.canTransitionTo(WorkflowStatus.CANCELLED)) {
            return false;
        }
        status = WorkflowStatus.CANCELLED;
        this.completedAt = now;
        notifyAll();
        return true;
    }

    /**
     * Blocks while the workflow is PAUSED.
     *
     * @return the status that ended the wait
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public synchronized WorkflowStatus awaitWhilePaused() throws InterruptedException {
        while (status == WorkflowStatus.PAUSED) {
            wait();
        }
        return status;
    }

    @Override
    public synchronized String toString() {
        return "Workflow{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", projectId='" + projectId + '\'' +
               ", status=" + status +
               ", stages=" + stages.stream().map(Stage::getName).collect(Collectors.toList()) +
               '}';
    }

    /**
     * Builder for Workflow.
     */
    public static class Builder {
        private String id;
        private String name;
        private String projectId;
        private final List<Stage> stages = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stages.add(Objects.requireNonNull(stage, "Stage cannot be null"));
            return this;
        }

        public Builder stages(List<Stage> stages) {
            stages.forEach(this::stage);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        /**
         * Builds and validates the workflow.
         *
         * @throws IllegalArgumentException listing every validation error if the task graph
         *         is invalid
         */
        public Workflow build() {
            ValidationResult validation = new WorkflowValidator().validate(stages);
            if (!validation.isValid()) {
                StringBuilder sb = new StringBuilder("Invalid workflow '").append(name).append("':");
                for (ValidationResult.ValidationIssue error : validation.getErrors()) {
                    sb.append("\n  - ").append(error);
                }
                throw new IllegalArgumentException(sb.toString());
            }
            return new Workflow(this);
        }
    }
}
