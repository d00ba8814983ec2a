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

package dev.mars.cadence.workflow;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.cadence.core.FailureKind;
import dev.mars.cadence.core.Workflow;
import dev.mars.cadence.core.WorkflowStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of a workflow's progress.
 *
 * <p>Serializes to JSON with snake_case field names; absent optional fields are omitted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkflowStatusSnapshot {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @JsonProperty("workflow_id")
    private final String workflowId;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("status")
    private final WorkflowStatus status;

    @JsonProperty("progress")
    private final double progress;

    @JsonProperty("current_stage")
    private final int currentStage;

    @JsonProperty("total_stages")
    private final int totalStages;

    @JsonProperty("completed_tasks")
    private final int completedTasks;

    @JsonProperty("total_tasks")
    private final int totalTasks;

    @JsonProperty("started_at")
    private final Instant startedAt;

    @JsonProperty("completed_at")
    private final Instant completedAt;

    @JsonProperty("error_message")
    private final String errorMessage;

    @JsonProperty("failure_kind")
    private final FailureKind failureKind;

    private WorkflowStatusSnapshot(Workflow workflow) {
        this.workflowId = workflow.getId();
        this.name = workflow.getName();
        this.status = workflow.getStatus();
        this.currentStage = workflow.getCurrentStage();
        this.totalStages = workflow.getStages().size();
        this.completedTasks = workflow.getCompletedTaskCount();
        this.totalTasks = workflow.getTotalTaskCount();
        this.progress = progress(completedTasks, totalTasks);
        this.startedAt = workflow.getStartedAt().orElse(null);
        this.completedAt = workflow.getCompletedAt().orElse(null);
        this.errorMessage = workflow.getErrorMessage().orElse(null);
        this.failureKind = workflow.getFailureKind().orElse(null);
    }

    public static WorkflowStatusSnapshot of(Workflow workflow) {
        return new WorkflowStatusSnapshot(workflow);
    }

    /**
     * Percentage of completed tasks, rounded half-up to two decimals; 0 when there are no tasks.
     */
    static double progress(int completed, int total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(completed)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getName() {
        return name;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public double getProgress() {
        return progress;
    }

    public int getCurrentStage() {
        return currentStage;
    }

    public int getTotalStages() {
        return totalStages;
    }

    public int getCompletedTasks() {
        return completedTasks;
    }

    public int getTotalTasks() {
        return totalTasks;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<FailureKind> getFailureKind() {
        return Optional.ofNullable(failureKind);
    }

    /**
     * @return the snapshot as a JSON object
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize status of workflow " + workflowId, e);
        }
    }

    @Override
    public String toString() {
        return "WorkflowStatusSnapshot{" +
               "workflowId='" + workflowId + '\'' +
               ", status=" + status +
               ", progress=" + progress +
               ", currentStage=" + currentStage + "/" + totalStages +
               '}';
    }
}
