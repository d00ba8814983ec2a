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

package dev.mars.cadence.workflow.agent;

import dev.mars.cadence.core.Capability;
import dev.mars.cadence.core.Task;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A worker that fulfils tasks of one capability.
 *
 * <p>Implementations complete the returned future with the task's result payload, or
 * exceptionally to report a failure. The orchestrator waits on the future under the task's
 * timeout and cancels it when the timeout fires.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface Agent {

    /**
     * @return identifier unique within one registry
     */
    String getAgentId();

    /**
     * @return the capability this agent fulfils
     */
    Capability getCapability();

    /**
     * Executes one attempt of a task.
     *
     * @param task the task, with its input payload
     * @return future completed with the result payload
     */
    CompletableFuture<Map<String, Object>> execute(Task task);

    /**
     * Reports whether the agent can take another task right now. Must not block.
     */
    boolean healthCheck();
}
