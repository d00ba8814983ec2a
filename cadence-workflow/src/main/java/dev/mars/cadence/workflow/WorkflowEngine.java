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

import dev.mars.cadence.core.Workflow;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for running workflows and administering the runs in progress.
 */
public interface WorkflowEngine extends AutoCloseable {

    /**
     * Runs a workflow to the end on the calling thread.
     *
     * @param workflow a workflow that has not run yet
     * @return {@code true} if the workflow completed
     * @throws IllegalStateException if the engine is shut down or the workflow has already run
     */
    boolean execute(Workflow workflow);

    /**
     * Runs a workflow on the engine's run executor.
     *
     * @param workflow a workflow that has not run yet
     * @return future completed with the outcome of the run
     */
    CompletableFuture<WorkflowRunResult> submit(Workflow workflow);

    /**
     * Gets the status of a workflow known to this engine.
     *
     * @param workflowId the workflow ID
     * @return a snapshot, or empty if the id is unknown
     */
    Optional<WorkflowStatusSnapshot> getWorkflowStatus(String workflowId);

    /**
     * Pauses a running workflow. The run stops before its next stage.
     *
     * @param workflowId the workflow ID
     * @return true if the workflow was paused
     */
    boolean pause(String workflowId);

    /**
     * Resumes a paused workflow.
     *
     * @param workflowId the workflow ID
     * @return true if the workflow was resumed
     */
    boolean resume(String workflowId);

    /**
     * Cancels a workflow that has not finished. The run stops before its next stage.
     *
     * @param workflowId the workflow ID
     * @return true if the workflow was cancelled
     */
    boolean cancel(String workflowId);

    /**
     * Forgets a finished workflow.
     *
     * @param workflowId the workflow ID
     * @return true if a workflow in a terminal status was removed
     */
    boolean removeWorkflow(String workflowId);

    /**
     * Shuts down the engine and its worker pools.
     */
    void shutdown();

    @Override
    default void close() {
        shutdown();
    }
}
