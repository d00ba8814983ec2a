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

package dev.mars.cadence.core.validation;

import dev.mars.cadence.core.Stage;
import dev.mars.cadence.core.Task;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Construction-time checks for a workflow's stages and task graph.
 *
 * <p>Errors: duplicate stage names, duplicate task ids anywhere in the workflow, dependencies
 * on unknown tasks, self-dependencies and cycles. Warnings: empty workflows, empty stages, and
 * tasks that depend on a task declared in a later stage (such a task can never run, because
 * gating only sees results recorded before its stage pass).</p>
 */
public class WorkflowValidator {

    public ValidationResult validate(List<Stage> stages) {
        ValidationResult result = new ValidationResult();
        if (stages.isEmpty()) {
            result.addWarning("stages", "No stages defined");
            return result;
        }

        Set<String> stageNames = new HashSet<>();
        Set<String> taskIds = new HashSet<>();
        DependencyGraph graph = new DependencyGraph();

        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);
            if (!stageNames.add(stage.getName())) {
                result.addError("stages[" + i + "]", "Duplicate stage name: " + stage.getName());
            }
            if (stage.getTasks().isEmpty()) {
                result.addWarning("stages[" + i + "]", "Stage '" + stage.getName() + "' has no tasks");
            }
            for (Task task : stage.getTasks()) {
                if (!taskIds.add(task.getId())) {
                    result.addError("stages[" + i + "].tasks", "Duplicate task id: " + task.getId());
                }
                graph.addTask(task.getId(), task.getDependencies());
            }
        }

        result.merge(graph.validate());
        checkForwardReferences(stages, taskIds, result);
        return result;
    }

    private void checkForwardReferences(List<Stage> stages, Set<String> allTaskIds, ValidationResult result) {
        Set<String> declaredSoFar = new HashSet<>();
        for (Stage stage : stages) {
            for (Task task : stage.getTasks()) {
                declaredSoFar.add(task.getId());
            }
            for (Task task : stage.getTasks()) {
                for (String dependency : task.getDependencies()) {
                    if (allTaskIds.contains(dependency) && !declaredSoFar.contains(dependency)) {
                        result.addWarning("tasks." + task.getId() + ".dependsOn",
                                "Dependency '" + dependency + "' is declared in a later stage");
                    }
                }
            }
        }
    }
}
