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

import java.time.Duration;

/**
 * Thrown when an agent does not finish a task within the task's deadline.
 */
public class TaskTimeoutException extends TaskFailureException {

    private final Duration timeout;

    public TaskTimeoutException(String taskId, Duration timeout) {
        super(taskId, "Task timed out after " + formatSeconds(timeout) + " seconds");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.TASK_TIMEOUT;
    }

    private static String formatSeconds(Duration timeout) {
        if (timeout.toMillis() % 1000 == 0) {
            return String.valueOf(timeout.getSeconds());
        }
        return String.valueOf(timeout.toMillis() / 1000.0);
    }
}
