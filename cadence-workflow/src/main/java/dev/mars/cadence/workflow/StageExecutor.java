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

import dev.mars.cadence.core.FailureStrategy;
import dev.mars.cadence.core.Stage;
import dev.mars.cadence.core.Task;
import dev.mars.cadence.core.TaskStatus;
import dev.mars.cadence.core.exceptions.InvalidTransitionException;
import dev.mars.cadence.workflow.event.EventBus;
import dev.mars.cadence.workflow.event.EventTypes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Executes the tasks of one stage and applies its failure strategy.
 *
 * <p>A pass walks the stage's tasks once. Sequential passes check each task's dependencies
 * when its turn comes; parallel passes take the eligible set once, launch it on the worker
 * pool and join every launched task. Ineligible tasks are left PENDING.</p>
 *
 * <ul>
 *   <li>CONTINUE_ON_ERROR and STOP_ON_ERROR run a single pass.</li>
 *   <li>STOP_ON_ERROR in sequential mode stops at the first failure and marks the tasks it
 *       never reached SKIPPED.</li>
 *   <li>RETRY_FAILED repeats passes over tasks that became eligible during the previous pass
 *       until a pass has nothing left to dispatch. Failed tasks are never re-run.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class StageExecutor {

    private static final Logger logger = Logger.getLogger(StageExecutor.class.getName());

    private final TaskDispatcher dispatcher;
    private final ExecutorService workerPool;
    private final EventBus eventBus;

    StageExecutor(TaskDispatcher dispatcher, ExecutorService workerPool, EventBus eventBus) {
        this.dispatcher = dispatcher;
        this.workerPool = workerPool;
        this.eventBus = eventBus;
    }

    StageOutcome execute(Stage stage, RunContext context) throws InterruptedException, InvalidTransitionException {
        logger.info("Executing stage: " + stage.getName() + " (" + (stage.isParallel() ? "parallel" : "sequential")
                + ", " + stage.getFailureStrategy().getValue() + ")");

        List<String> failedTaskIds = new ArrayList<>();
        runPass(stage, stage.getTasks(), context, failedTaskIds);

        if (stage.getFailureStrategy() == FailureStrategy.RETRY_FAILED) {
            List<Task> ready = readyTasks(stage, context);
            while (!ready.isEmpty()) {
                logger.fine("Stage " + stage.getName() + " re-pass over " + ready.size() + " newly eligible task(s)");
                runPass(stage, ready, context, failedTaskIds);
                ready = readyTasks(stage, context);
            }
        }

        boolean success = stage.getFailureStrategy() == FailureStrategy.CONTINUE_ON_ERROR || failedTaskIds.isEmpty();
        return new StageOutcome(success, failedTaskIds);
    }

    private void runPass(Stage stage, List<Task> tasks, RunContext context, List<String> failedTaskIds)
            throws InterruptedException, InvalidTransitionException {
        if (stage.isParallel()) {
            runParallel(tasks, context, failedTaskIds);
        } else {
            runSequential(stage, tasks, context, failedTaskIds);
        }
    }

    private void runSequential(Stage stage, List<Task> tasks, RunContext context, List<String> failedTaskIds)
            throws InterruptedException, InvalidTransitionException {
        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            if (task.getStatus() != TaskStatus.PENDING) {
                continue;
            }
            if (!context.isEligible(task)) {
                logger.fine("Task " + task.getId() + " waiting for dependencies " + context.missingDependencies(task));
                continue;
            }

            if (!dispatcher.dispatch(task, context)) {
                failedTaskIds.add(task.getId());
                if (stage.getFailureStrategy() == FailureStrategy.STOP_ON_ERROR) {
                    skipRemaining(stage, task, tasks.subList(i + 1, tasks.size()), context);
                    return;
                }
            }
        }
    }

    private void runParallel(List<Task> tasks, RunContext context, List<String> failedTaskIds)
            throws InterruptedException, InvalidTransitionException {
        List<Task> eligible = new ArrayList<>();
        for (Task task : tasks) {
            if (task.getStatus() != TaskStatus.PENDING) {
                continue;
            }
            if (context.isEligible(task)) {
                eligible.add(task);
            } else {
                logger.fine("Task " + task.getId() + " waiting for dependencies " + context.missingDependencies(task));
            }
        }
        if (eligible.isEmpty()) {
            return;
        }

        List<Callable<Boolean>> calls = eligible.stream()
                .map(task -> (Callable<Boolean>) () -> dispatcher.dispatch(task, context))
                .collect(Collectors.toList());

        // invokeAll returns only after every launched task has finished
        List<Future<Boolean>> futures = workerPool.invokeAll(calls);

        Throwable unexpected = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                if (!futures.get(i).get()) {
                    failedTaskIds.add(eligible.get(i).getId());
                }
            } catch (ExecutionException e) {
                failedTaskIds.add(eligible.get(i).getId());
                if (unexpected == null) {
                    unexpected = e.getCause();
                }
            }
        }

        if (unexpected instanceof InvalidTransitionException) {
            throw (InvalidTransitionException) unexpected;
        }
        if (unexpected instanceof InterruptedException) {
            throw (InterruptedException) unexpected;
        }
        if (unexpected instanceof RuntimeException) {
            throw (RuntimeException) unexpected;
        }
        if (unexpected instanceof Error) {
            throw (Error) unexpected;
        }
        if (unexpected != null) {
            throw new IllegalStateException("Parallel task dispatch failed", unexpected);
        }
    }

    private void skipRemaining(Stage stage, Task failedTask, List<Task> remaining, RunContext context)
            throws InvalidTransitionException {
        String reason = "Stage " + stage.getName() + " stopped after task " + failedTask.getId() + " failed";
        for (Task task : remaining) {
            if (task.getStatus() != TaskStatus.PENDING) {
                continue;
            }
            task.skip();
            logger.info("Skipping task " + task.getId() + ": " + reason);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(EventTypes.WORKFLOW_ID, context.getWorkflow().getId());
            payload.put(EventTypes.TASK_ID, task.getId());
            payload.put(EventTypes.REASON, reason);
            eventBus.publish(EventTypes.TASK_SKIPPED, payload);
        }
    }

    private static List<Task> readyTasks(Stage stage, RunContext context) {
        return stage.getTasks().stream()
                .filter(task -> task.getStatus() == TaskStatus.PENDING)
                .filter(context::isEligible)
                .collect(Collectors.toList());
    }

    /**
     * Result of one stage.
     */
    static final class StageOutcome {
        private final boolean success;
        private final List<String> failedTaskIds;

        StageOutcome(boolean success, List<String> failedTaskIds) {
            this.success = success;
            this.failedTaskIds = List.copyOf(failedTaskIds);
        }

        boolean isSuccess() {
            return success;
        }

        List<String> getFailedTaskIds() {
            return failedTaskIds;
        }
    }
}
