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

import dev.mars.cadence.config.CadenceConfiguration;
import dev.mars.cadence.core.FailureKind;
import dev.mars.cadence.core.Stage;
import dev.mars.cadence.core.Workflow;
import dev.mars.cadence.core.WorkflowStatus;
import dev.mars.cadence.core.exceptions.CadenceException;
import dev.mars.cadence.core.exceptions.InvalidTransitionException;
import dev.mars.cadence.core.exceptions.StageFailureException;
import dev.mars.cadence.core.exceptions.WorkflowExecutionException;
import dev.mars.cadence.workflow.agent.Agent;
import dev.mars.cadence.workflow.agent.AgentRegistry;
import dev.mars.cadence.workflow.event.EventBus;
import dev.mars.cadence.workflow.event.EventTypes;
import dev.mars.cadence.workflow.event.InMemoryEventBus;
import dev.mars.cadence.workflow.observability.WorkflowMetrics;
import dev.mars.cadence.workflow.retry.BackoffCalculator;
import dev.mars.cadence.workflow.retry.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Multi-stage workflow execution engine.
 *
 * <p>A run walks the workflow's stages in order. Each stage is handed to a
 * {@link StageExecutor}, which dispatches its tasks through a {@link TaskDispatcher}
 * sequentially or on the worker pool. A failed stop-on-error stage halts the run; every other
 * stage outcome lets the run continue. Lifecycle transitions are published on the
 * {@link EventBus}.</p>
 *
 * <p>Pause and cancel only change the workflow status. The run observes them between stages:
 * a paused run blocks until it is resumed or cancelled, and a cancelled run stops.</p>
 *
 * <p>Every run fault is caught at the top of the run and recorded on the workflow as FAILED;
 * {@link #execute(Workflow)} reports it as {@code false}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowOrchestrator implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(WorkflowOrchestrator.class.getName());

    private final AgentRegistry agentRegistry;
    private final EventBus eventBus;
    private final Clock clock;
    private final WorkflowMetrics metrics;
    private final ExecutorService workerPool;
    private final ExecutorService runExecutor;
    private final StageExecutor stageExecutor;
    private final Map<String, Workflow> activeWorkflows = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    public WorkflowOrchestrator() {
        this(builder());
    }

    private WorkflowOrchestrator(Builder builder) {
        CadenceConfiguration configuration = builder.configuration != null
                ? builder.configuration
                : new CadenceConfiguration();
        this.agentRegistry = builder.agentRegistry != null ? builder.agentRegistry : new AgentRegistry();
        this.eventBus = builder.eventBus != null ? builder.eventBus : new InMemoryEventBus();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : WorkflowMetrics.fromConfiguration(configuration);
        BackoffCalculator backoffCalculator = new BackoffCalculator(builder.random != null ? builder.random : new Random());
        Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;

        // Parallel passes hold one worker per in-flight task, so the pool grows past its core size
        // instead of queueing: every eligible task of a pass launches at once.
        this.workerPool = new ThreadPoolExecutor(configuration.getParallelWorkers(), Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(), threadFactory("cadence-worker"));
        this.runExecutor = Executors.newCachedThreadPool(threadFactory("cadence-run"));

        TaskDispatcher dispatcher = new TaskDispatcher(agentRegistry, eventBus, backoffCalculator, sleeper, clock, metrics);
        this.stageExecutor = new StageExecutor(dispatcher, workerPool, eventBus);

        logger.info("WorkflowOrchestrator created with " + configuration.getParallelWorkers() + " core parallel workers");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers an agent with this orchestrator's registry.
     */
    public void registerAgent(Agent agent) {
        agentRegistry.register(agent);
    }

    public AgentRegistry getAgentRegistry() {
        return agentRegistry;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    @Override
    public boolean execute(Workflow workflow) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        ensureRunning();
        register(workflow);
        return run(workflow).isSuccess();
    }

    @Override
    public CompletableFuture<WorkflowRunResult> submit(Workflow workflow) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        try {
            ensureRunning();
            register(workflow);
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.supplyAsync(() -> run(workflow), runExecutor);
    }

    @Override
    public Optional<WorkflowStatusSnapshot> getWorkflowStatus(String workflowId) {
        if (workflowId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(activeWorkflows.get(workflowId)).map(WorkflowStatusSnapshot::of);
    }

    @Override
    public boolean pause(String workflowId) {
        Workflow workflow = lookup(workflowId);
        if (workflow == null || !workflow.transitionIf(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED)) {
            return false;
        }
        logger.info("Workflow " + workflowId + " paused");
        publishAdminEvent(EventTypes.WORKFLOW_PAUSED, workflowId, clock.instant());
        return true;
    }

    @Override
    public boolean resume(String workflowId) {
        Workflow workflow = lookup(workflowId);
        if (workflow == null || !workflow.transitionIf(WorkflowStatus.PAUSED, WorkflowStatus.RUNNING)) {
            return false;
        }
        logger.info("Workflow " + workflowId + " resumed");
        publishAdminEvent(EventTypes.WORKFLOW_RESUMED, workflowId, clock.instant());
        return true;
    }

    @Override
    public boolean cancel(String workflowId) {
        Workflow workflow = lookup(workflowId);
        Instant now = clock.instant();
        if (workflow == null || !workflow.markCancelled(now)) {
            return false;
        }
        logger.info("Workflow " + workflowId + " cancelled");
        publishAdminEvent(EventTypes.WORKFLOW_CANCELLED, workflowId, now);
        return true;
    }

    @Override
    public boolean removeWorkflow(String workflowId) {
        Workflow workflow = lookup(workflowId);
        if (workflow == null || !workflow.getStatus().isTerminal()) {
            return false;
        }
        return activeWorkflows.remove(workflowId, workflow);
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        runExecutor.shutdown();
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
            if (!runExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                runExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            runExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("WorkflowOrchestrator shutdown completed");
    }

    // ── Run ────────────────────────────────────────────────────────────

    private WorkflowRunResult run(Workflow workflow) {
        RunContext context = new RunContext(workflow);
        Instant startedAt = clock.instant();

        try {
            workflow.markStarted(startedAt);
        } catch (InvalidTransitionException e) {
            if (workflow.getStatus() == WorkflowStatus.CANCELLED) {
                logger.info("Workflow " + workflow.getId() + " was cancelled before it started");
                return new WorkflowRunResult(workflow, Duration.ZERO, null, Map.of());
            }
            throw new IllegalStateException("Workflow " + workflow.getId()
                    + " cannot be started from status " + workflow.getStatus(), e);
        }

        metrics.recordWorkflowStarted(workflow.getName());
        logger.info("Starting workflow " + workflow.getId() + " (" + workflow.getName() + ")");

        Map<String, Object> started = new LinkedHashMap<>();
        started.put(EventTypes.WORKFLOW_ID, workflow.getId());
        started.put(EventTypes.PROJECT_ID, workflow.getProjectId());
        started.put(EventTypes.TIMESTAMP, startedAt.toString());
        eventBus.publish(EventTypes.WORKFLOW_STARTED, started);

        try {
            if (!runStages(workflow, context)) {
                return cancelled(workflow, context, startedAt);
            }
            return completed(workflow, context, startedAt);
        } catch (StageFailureException e) {
            logger.warning("Workflow " + workflow.getId() + " halted: " + e.getMessage()
                    + " (failed tasks: " + e.getFailedTaskIds() + ")");
            return failed(workflow, context, startedAt, e.getMessage(), FailureKind.STAGE_FAILURE, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String message = "Workflow execution interrupted";
            return failed(workflow, context, startedAt, message, FailureKind.WORKFLOW_EXECUTION_ERROR,
                    new WorkflowExecutionException(workflow.getId(), message, e));
        } catch (CadenceException | RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            // Log without stack trace; details at FINE
            logger.log(Level.SEVERE, "Workflow execution failed: " + workflow.getId() + " - " + message);
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Workflow execution exception details for: " + workflow.getId(), e);
            }
            return failed(workflow, context, startedAt, message, FailureKind.WORKFLOW_EXECUTION_ERROR,
                    new WorkflowExecutionException(workflow.getId(), message, e));
        }
    }

    /**
     * @return {@code false} if the run was cancelled before all stages finished
     * @throws StageFailureException if a stop-on-error stage failed
     */
    private boolean runStages(Workflow workflow, RunContext context) throws InterruptedException, CadenceException {
        List<Stage> stages = workflow.getStages();
        for (int i = 0; i < stages.size(); i++) {
            if (!awaitRunnable(workflow)) {
                return false;
            }
            Stage stage = stages.get(i);
            workflow.setCurrentStage(i);

            StageExecutor.StageOutcome outcome = stageExecutor.execute(stage, context);
            if (!outcome.isSuccess() && stage.getFailureStrategy().haltsWorkflow()) {
                throw new StageFailureException(stage.getName(), outcome.getFailedTaskIds());
            }

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(EventTypes.WORKFLOW_ID, workflow.getId());
            payload.put(EventTypes.STAGE_NAME, stage.getName());
            payload.put(EventTypes.STAGE_INDEX, i);
            payload.put(EventTypes.SUCCESS, outcome.isSuccess());
            eventBus.publish(EventTypes.WORKFLOW_STAGE_COMPLETED, payload);
        }
        return awaitRunnable(workflow);
    }

    /**
     * Blocks while the workflow is paused.
     *
     * @return {@code true} if the run may continue
     */
    private boolean awaitRunnable(Workflow workflow) throws InterruptedException {
        if (workflow.getStatus() == WorkflowStatus.PAUSED) {
            logger.info("Workflow " + workflow.getId() + " is paused, waiting for resume");
        }
        return workflow.awaitWhilePaused() == WorkflowStatus.RUNNING;
    }

    /**
     * Completes a run whose stages all finished. A pause that lands after the last stage holds
     * completion until the workflow is resumed or cancelled.
     */
    private WorkflowRunResult completed(Workflow workflow, RunContext context, Instant startedAt)
            throws InterruptedException, InvalidTransitionException {
        Instant completedAt;
        while (true) {
            completedAt = clock.instant();
            try {
                workflow.markCompleted(completedAt);
                break;
            } catch (InvalidTransitionException e) {
                WorkflowStatus status = workflow.getStatus();
                if (status == WorkflowStatus.CANCELLED) {
                    return cancelled(workflow, context, startedAt);
                }
                if (status != WorkflowStatus.PAUSED) {
                    throw e;
                }
                if (!awaitRunnable(workflow)) {
                    return cancelled(workflow, context, startedAt);
                }
            }
        }

        Duration duration = Duration.between(startedAt, completedAt);
        double seconds = TaskDispatcher.seconds(duration);
        metrics.recordWorkflowCompleted(workflow.getName(), seconds);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EventTypes.WORKFLOW_ID, workflow.getId());
        payload.put(EventTypes.DURATION_SECONDS, seconds);
        payload.put(EventTypes.TIMESTAMP, completedAt.toString());
        eventBus.publish(EventTypes.WORKFLOW_COMPLETED, payload);

        logger.info("Workflow " + workflow.getId() + " completed successfully");
        return new WorkflowRunResult(workflow, duration, null, context.getFailures());
    }

    private WorkflowRunResult failed(Workflow workflow, RunContext context, Instant startedAt,
                                     String message, FailureKind failureKind, Throwable cause) {
        Instant now = clock.instant();
        if (!workflow.markFailed(message, failureKind, now)) {
            return cancelled(workflow, context, startedAt);
        }

        Duration duration = Duration.between(startedAt, now);
        metrics.recordWorkflowFailed(workflow.getName(), failureKind, TaskDispatcher.seconds(duration));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EventTypes.WORKFLOW_ID, workflow.getId());
        payload.put(EventTypes.ERROR, message);
        payload.put(EventTypes.FAILURE_KIND, failureKind.getValue());
        payload.put(EventTypes.TIMESTAMP, now.toString());
        eventBus.publish(EventTypes.WORKFLOW_FAILED, payload);

        logger.warning("Workflow " + workflow.getId() + " failed: " + message);
        return new WorkflowRunResult(workflow, duration, cause, context.getFailures());
    }

    private WorkflowRunResult cancelled(Workflow workflow, RunContext context, Instant startedAt) {
        Instant end = workflow.getCompletedAt().orElse(clock.instant());
        metrics.recordWorkflowCancelled(workflow.getName());
        logger.info("Workflow " + workflow.getId() + " stopped after cancellation");
        return new WorkflowRunResult(workflow, Duration.between(startedAt, end), null, context.getFailures());
    }

    // ── Helpers ────────────────────────────────────────────────────────

    private void register(Workflow workflow) {
        Workflow existing = activeWorkflows.putIfAbsent(workflow.getId(), workflow);
        if (existing != null && existing != workflow) {
            throw new IllegalStateException("Another workflow with id " + workflow.getId() + " is already registered");
        }
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new IllegalStateException("Workflow orchestrator is shut down");
        }
    }

    private Workflow lookup(String workflowId) {
        return workflowId != null ? activeWorkflows.get(workflowId) : null;
    }

    private void publishAdminEvent(String eventType, String workflowId, Instant timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EventTypes.WORKFLOW_ID, workflowId);
        payload.put(EventTypes.TIMESTAMP, timestamp.toString());
        eventBus.publish(eventType, payload);
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Builder for WorkflowOrchestrator. Every collaborator is optional.
     */
    public static class Builder {
        private CadenceConfiguration configuration;
        private AgentRegistry agentRegistry;
        private EventBus eventBus;
        private Random random;
        private Sleeper sleeper;
        private Clock clock;
        private WorkflowMetrics metrics;

        public Builder configuration(CadenceConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder agentRegistry(AgentRegistry agentRegistry) {
            this.agentRegistry = agentRegistry;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        /**
         * @param random jitter source for retry delays
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public WorkflowOrchestrator build() {
            return new WorkflowOrchestrator(this);
        }
    }
}
