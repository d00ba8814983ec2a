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

package dev.mars.cadence.workflow.event;

/**
 * Event type names published by the orchestrator, and the payload keys they carry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class EventTypes {

    // Workflow lifecycle
    public static final String WORKFLOW_STARTED = "workflow.started";
    public static final String WORKFLOW_STAGE_COMPLETED = "workflow.stage_completed";
    public static final String WORKFLOW_COMPLETED = "workflow.completed";
    public static final String WORKFLOW_FAILED = "workflow.failed";
    public static final String WORKFLOW_PAUSED = "workflow.paused";
    public static final String WORKFLOW_RESUMED = "workflow.resumed";
    public static final String WORKFLOW_CANCELLED = "workflow.cancelled";

    // Task lifecycle
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_RETRYING = "task.retrying";
    public static final String TASK_SKIPPED = "task.skipped";

    // Agents
    public static final String AGENT_UNAVAILABLE = "agent.unavailable";

    // Payload keys
    public static final String WORKFLOW_ID = "workflow_id";
    public static final String PROJECT_ID = "project_id";
    public static final String TASK_ID = "task_id";
    public static final String STAGE_NAME = "stage_name";
    public static final String STAGE_INDEX = "stage_index";
    public static final String SUCCESS = "success";
    public static final String DURATION_SECONDS = "duration_seconds";
    public static final String TIMESTAMP = "timestamp";
    public static final String ERROR = "error";
    public static final String FAILURE_KIND = "failure_kind";
    public static final String RESULT = "result";
    public static final String ATTEMPTS = "attempts";
    public static final String ATTEMPT = "attempt";
    public static final String DELAY_MS = "delay_ms";
    public static final String REASON = "reason";
    public static final String CAPABILITY = "capability";

    private EventTypes() {
    }
}
