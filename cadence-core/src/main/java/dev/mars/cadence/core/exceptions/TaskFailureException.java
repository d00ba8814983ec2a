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

package dev.mars.cadence.core.exceptions;

import dev.mars.cadence.core.FailureKind;

import java.util.Objects;

/**
 * Base class for failures raised while dispatching a single task.
 *
 * <p>Task-level failures never escape the dispatch boundary: the orchestrator turns every one
 * of them into a retry or a terminal task failure.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public abstract class TaskFailureException extends CadenceException {

    private final String taskId;

    protected TaskFailureException(String taskId, String message) {
        super(message);
        this.taskId = Objects.requireNonNull(taskId, "Task ID cannot be null");
    }

    protected TaskFailureException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = Objects.requireNonNull(taskId, "Task ID cannot be null");
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * @return the taxonomy entry for this failure
     */
    public abstract FailureKind getFailureKind();
}
