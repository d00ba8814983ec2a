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

import dev.mars.cadence.core.FailureKind;
import dev.mars.cadence.core.Workflow;
import dev.mars.cadence.core.WorkflowStatus;
import dev.mars.cadence.core.exceptions.TaskFailureException;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one workflow run.
 *
 * <p>Captures the workflow's terminal status at the end of the run together with the typed
 * failure of every task that failed, keyed by task id.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowRunResult {

    private final String workflowId;
    private final WorkflowStatus status;
    private final FailureKind failureKind;
    private final String errorMessage;
    private final Duration duration;
    private final Throwable cause;
    private final Map<String, TaskFailureException> taskFailures;

    WorkflowRunResult(Workflow workflow, Duration duration, Throwable cause,
                      Map<String, TaskFailureException> taskFailures) {
        this.workflowId = workflow.getId();
        this.status = workflow.getStatus();
        this.failureKind = workflow.getFailureKind().orElse(null);
        this.errorMessage = workflow.getErrorMessage().orElse(null);
        this.duration = Objects.requireNonNull(duration, "Duration cannot be null");
        this.cause = cause;
        this.taskFailures = Collections.unmodifiableMap(new LinkedHashMap<>(taskFailures));
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /**
     * @return {@code true} only if the workflow reached COMPLETED
     */
    public boolean isSuccess() {
        return status == WorkflowStatus.COMPLETED;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public Optional<FailureKind> getFailureKind() {
        return Optional.ofNullable(failureKind);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * @return the exception that ended a failed run, if any
     */
    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    /**
     * @return terminal failures by task id; a task that used more than one attempt is reported
     *         as a {@link dev.mars.cadence.core.exceptions.RetryExhaustedException}
     */
    public Map<String, TaskFailureException> getTaskFailures() {
        return taskFailures;
    }

    @Override
    public String toString() {
        return "WorkflowRunResult{" +
               "workflowId='" + workflowId + '\'' +
               ", status=" + status +
               ", failureKind=" + failureKind +
               ", duration=" + duration +
               ", failedTasks=" + taskFailures.keySet() +
               '}';
    }
}
