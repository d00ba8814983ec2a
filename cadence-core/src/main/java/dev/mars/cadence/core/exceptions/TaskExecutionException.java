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

/**
 * Thrown when an agent reports that it could not perform a task.
 */
public class TaskExecutionException extends TaskFailureException {

    public TaskExecutionException(String taskId, String message) {
        super(taskId, message);
    }

    public TaskExecutionException(String taskId, String message, Throwable cause) {
        super(taskId, message, cause);
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.TASK_EXECUTION_ERROR;
    }
}
