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
 * Terminal task failure: every attempt allowed by the retry policy failed.
 *
 * <p>The cause is the failure of the final attempt and its message becomes the task's
 * error message.</p>
 */
public class RetryExhaustedException extends TaskFailureException {

    private final int attempts;

    public RetryExhaustedException(String taskId, int attempts, TaskFailureException lastFailure) {
        super(taskId, lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * @return the failure of the final attempt
     */
    public TaskFailureException getLastFailure() {
        return (TaskFailureException) getCause();
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.RETRY_EXHAUSTED;
    }
}
