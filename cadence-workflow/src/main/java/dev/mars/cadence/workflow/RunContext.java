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

import dev.mars.cadence.core.Task;
import dev.mars.cadence.core.Workflow;
import dev.mars.cadence.core.exceptions.TaskFailureException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State of one workflow run: the result store that gates dependent tasks and the terminal
 * failures collected so far. Created when a run starts and dropped when it ends.
 */
final class RunContext {

    private final Workflow workflow;
    private final Map<String, Map<String, Object>> results = new ConcurrentHashMap<>();
    private final Map<String, TaskFailureException> failures = Collections.synchronizedMap(new LinkedHashMap<>());

    RunContext(Workflow workflow) {
        this.workflow = workflow;
    }

    Workflow getWorkflow() {
        return workflow;
    }

    /**
     * A task is eligible once every one of its dependencies has a recorded result.
     */
    boolean isEligible(Task task) {
        return results.keySet().containsAll(task.getDependencies());
    }

    Set<String> missingDependencies(Task task) {
        Set<String> missing = new LinkedHashSet<>(task.getDependencies());
        missing.removeAll(results.keySet());
        return missing;
    }

    void recordResult(String taskId, Map<String, Object> result) {
        if (results.putIfAbsent(taskId, result) != null) {
            throw new IllegalStateException("Result already recorded for task " + taskId);
        }
    }

    void recordFailure(String taskId, TaskFailureException failure) {
        failures.put(taskId, failure);
    }

    Map<String, TaskFailureException> getFailures() {
        synchronized (failures) {
            return new LinkedHashMap<>(failures);
        }
    }
}
