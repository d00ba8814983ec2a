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

import dev.mars.cadence.core.RetryPolicy;
import dev.mars.cadence.core.Task;
import dev.mars.cadence.core.Workflow;
import dev.mars.cadence.core.exceptions.AgentUnavailableException;
import dev.mars.cadence.core.exceptions.InvalidTransitionException;
import dev.mars.cadence.core.exceptions.RetryExhaustedException;
import dev.mars.cadence.core.exceptions.TaskExecutionException;
import dev.mars.cadence.core.exceptions.TaskFailureException;
import dev.mars.cadence.core.exceptions.TaskTimeoutException;
import dev.mars.cadence.workflow.agent.Agent;
import dev.mars.cadence.workflow.agent.AgentRegistry;
import dev.mars.cadence.workflow.event.EventBus;
import dev.mars.cadence.workflow.event.EventTypes;
import dev.mars.cadence.workflow.observability.WorkflowMetrics;
import dev.mars.cadence.workflow.retry.BackoffCalculator;
import dev.mars.cadence.workflow.retry.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one task to a terminal state.
 *
 * <p>Each attempt selects a healthy agent for the task's capability, invokes it, and waits for
 * the result under the task's timeout. A failed attempt (no agent, agent error, or timeout) is
 * retried after the backoff delay while the retry policy allows; the loop is bounded by the
 * task's attempt counter.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class TaskDispatcher {

    private static final Logger logger = Logger.getLogger(TaskDispatcher.class.getName());

    private final AgentRegistry agentRegistry;
    private final EventBus eventBus;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;
    private final Clock clock;
    private final WorkflowMetrics metrics;

    TaskDispatcher(AgentRegistry agentRegistry, EventBus eventBus, BackoffCalculator backoffCalculator,
                   Sleeper sleeper, Clock clock, WorkflowMetrics metrics) {
        this.agentRegistry = agentRegistry;
        this.eventBus = eventBus;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Dispatches a PENDING task until it completes or exhausts its attempts.
     *
     * @return {@code true} if the task completed
     * @throws InterruptedException if interrupted while waiting on the agent or the backoff
     * @throws InvalidTransitionException if the task is not PENDING
     */
    boolean dispatch(Task task, RunContext context) throws InterruptedException, InvalidTransitionException {
        Workflow workflow = context.getWorkflow();
        RetryPolicy policy = task.getRetryPolicy();
        TaskFailureException lastFailure = null;

        while (true) {
            task.beginAttempt(clock.instant());
            int attempt = task.getAttemptCount();
            metrics.recordTaskDispatched(workflow.getName(), task.getCapability());
            logger.info("Executing task " + task.getId() + " (attempt " + attempt + "/" + policy.getMaxAttempts() + ")");

            try {
                Map<String, Object> result = attemptOnce(task, context);
                task.complete(result, clock.instant());
                context.recordResult(task.getId(), task.getOutput().orElse(Map.of()));
                taskCompleted(task, workflow);
                return true;
            } catch (TaskFailureException failure) {
                lastFailure = failure;
                logger.warning("Task " + task.getId() + " failed (attempt " + attempt + "): " + failure.getMessage());
            }

            if (!task.hasAttemptsRemaining()) {
                break;
            }

            task.markRetrying();
            Duration delay = backoffCalculator.nextDelay(policy, attempt);
            metrics.recordTaskRetry(workflow.getName(), task.getCapability());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(EventTypes.WORKFLOW_ID, workflow.getId());
            payload.put(EventTypes.TASK_ID, task.getId());
            payload.put(EventTypes.ATTEMPT, attempt);
            payload.put(EventTypes.DELAY_MS, delay.toMillis());
            payload.put(EventTypes.ERROR, lastFailure.getMessage());
            eventBus.publish(EventTypes.TASK_RETRYING, payload);

            logger.info("Retrying task " + task.getId() + " in " + delay.toMillis() + " ms");
            sleeper.sleep(delay);
        }

        taskFailed(task, workflow, context, lastFailure);
        return false;
    }

    private Map<String, Object> attemptOnce(Task task, RunContext context)
            throws TaskFailureException, InterruptedException {
        Optional<Agent> selected = agentRegistry.selectAgent(task.getCapability());
        if (selected.isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(EventTypes.WORKFLOW_ID, context.getWorkflow().getId());
            payload.put(EventTypes.TASK_ID, task.getId());
            payload.put(EventTypes.CAPABILITY, task.getCapability().getName());
            eventBus.publish(EventTypes.AGENT_UNAVAILABLE, payload);
            throw new AgentUnavailableException(task.getId(), task.getCapability());
        }

        Agent agent = selected.get();
        logger.fine("Task " + task.getId() + " assigned to agent " + agent.getAgentId());

        CompletableFuture<Map<String, Object>> future;
        try {
            future = agent.execute(task);
        } catch (RuntimeException e) {
            throw new TaskExecutionException(task.getId(), describe(e), e);
        }
        if (future == null) {
            throw new TaskExecutionException(task.getId(), "Agent " + agent.getAgentId() + " returned no result");
        }

        try {
            Map<String, Object> result = future.get(task.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : Map.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TaskTimeoutException(task.getId(), task.getTimeout());
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            throw new TaskExecutionException(task.getId(), describe(cause), cause);
        } catch (CancellationException e) {
            throw new TaskExecutionException(task.getId(), "Agent " + agent.getAgentId() + " cancelled the task", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private void taskCompleted(Task task, Workflow workflow) {
        double seconds = seconds(task.getDuration().orElse(Duration.ZERO));
        metrics.recordTaskCompleted(workflow.getName(), task.getCapability(), seconds);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EventTypes.WORKFLOW_ID, workflow.getId());
        payload.put(EventTypes.TASK_ID, task.getId());
        payload.put(EventTypes.DURATION_SECONDS, seconds);
        payload.put(EventTypes.RESULT, task.getOutput().orElse(Map.of()));
        eventBus.publish(EventTypes.TASK_COMPLETED, payload);

        logger.info("Task " + task.getId() + " completed successfully");
    }

    private void taskFailed(Task task, Workflow workflow, RunContext context, TaskFailureException lastFailure)
            throws InvalidTransitionException {
        int attempts = task.getAttemptCount();
        task.fail(lastFailure.getMessage(), lastFailure.getFailureKind(), clock.instant());

        TaskFailureException terminal = attempts > 1
                ? new RetryExhaustedException(task.getId(), attempts, lastFailure)
                : lastFailure;
        context.recordFailure(task.getId(), terminal);
        metrics.recordTaskFailed(workflow.getName(), task.getCapability(), lastFailure.getFailureKind());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EventTypes.WORKFLOW_ID, workflow.getId());
        payload.put(EventTypes.TASK_ID, task.getId());
        payload.put(EventTypes.ERROR, lastFailure.getMessage());
        payload.put(EventTypes.ATTEMPTS, attempts);
        payload.put(EventTypes.FAILURE_KIND, lastFailure.getFailureKind().getValue());
        eventBus.publish(EventTypes.TASK_FAILED, payload);

        logger.warning("Task " + task.getId() + " failed after " + attempts + " attempt(s): " + lastFailure.getMessage());
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Task failure details for: " + task.getId(), terminal);
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
