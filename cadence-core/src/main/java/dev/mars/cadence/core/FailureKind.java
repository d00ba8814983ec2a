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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Typed classification of why a task, stage or workflow failed.
 */
public enum FailureKind {

    /** No healthy agent of the required capability was registered. */
    AGENT_UNAVAILABLE("agent_unavailable"),

    /** The agent did not answer within the task deadline. */
    TASK_TIMEOUT("task_timeout"),

    /** The agent reported a failure. */
    TASK_EXECUTION_ERROR("task_execution_error"),

    /** All attempts allowed by the retry policy failed. */
    RETRY_EXHAUSTED("retry_exhausted"),

    /** A stop-on-error stage failed and halted the workflow. */
    STAGE_FAILURE("stage_failure"),

    /** An unexpected fault escaped the engine itself. */
    WORKFLOW_EXECUTION_ERROR("workflow_execution_error");

    private final String value;

    FailureKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
